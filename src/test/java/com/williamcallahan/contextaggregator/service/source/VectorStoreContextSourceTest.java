package com.williamcallahan.contextaggregator.service.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.contextaggregator.config.ContextAggregatorProperties;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.SourceSettings;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.SourceFilters;
import com.williamcallahan.contextaggregator.domain.context.SourceQuery;
import com.williamcallahan.contextaggregator.domain.context.SourceResult;
import com.williamcallahan.contextaggregator.domain.context.TaskType;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Verifies mapping of vector store documents into chunks and the optional language filter.
 */
class VectorStoreContextSourceTest {

    private final Clock clock = Clock.systemUTC();
    private VectorStore vectorStore;
    private ObjectProvider<VectorStore> vectorStoreProvider;
    private VectorStoreContextSource source;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        vectorStore = mock(VectorStore.class);
        vectorStoreProvider = mock(ObjectProvider.class);
        when(vectorStoreProvider.getIfAvailable()).thenReturn(vectorStore);
        source = new VectorStoreContextSource(vectorStoreProvider, new ContextAggregatorProperties(), clock);
        source.initialize(new SourceSettings(true, 2000, 20, 0, 10));
    }

    @AfterEach
    void tearDown() {
        source.dispose();
    }

    @Test
    void mapsDocumentsWithScoresAndMetadata() {
        Document scored = Document.builder()
                .id("doc-1")
                .text("class Parser {}")
                .metadata(Map.of("file_path", "src/Parser.java", "start_line", 1, "end_line", 20, "language", "java"))
                .score(0.83)
                .build();
        Document unscored = Document.builder().id("doc-2").text("class Lexer {}").build();
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(scored, unscored));

        SourceResult result = source.retrieve(query(List.of()));

        assertTrue(result.isSuccess());
        assertEquals(2, result.chunks().size());
        ContextChunk first = result.chunks().get(0);
        assertEquals("doc-1", first.id());
        assertEquals(0.83, first.relevance(), 1e-9);
        assertEquals("src/Parser.java", first.metadata().filePath());
        assertEquals(20, first.metadata().endLine());
        assertEquals(0.9, result.chunks().get(1).relevance(), 1e-9);
    }

    @Test
    void appliesLanguageFilterWhenHintsNameLanguages() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of());

        source.retrieve(query(List.of("java")));

        ArgumentCaptor<SearchRequest> captured = ArgumentCaptor.forClass(SearchRequest.class);
        verify(vectorStore).similaritySearch(captured.capture());
        assertEquals("find parser", captured.getValue().getQuery());
        assertEquals(5, captured.getValue().getTopK());
        assertNotNull(captured.getValue().getFilterExpression());
    }

    @Test
    void omitsFilterWithoutLanguages() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of());

        source.retrieve(query(List.of()));

        ArgumentCaptor<SearchRequest> captured = ArgumentCaptor.forClass(SearchRequest.class);
        verify(vectorStore).similaritySearch(captured.capture());
        assertNull(captured.getValue().getFilterExpression());
    }

    @Test
    void unavailableWithoutVectorStoreBean() {
        when(vectorStoreProvider.getIfAvailable()).thenReturn(null);

        assertFalse(source.isAvailable());
        assertFalse(source.retrieve(query(List.of())).isSuccess());
    }

    private SourceQuery query(List<String> languages) {
        return new SourceQuery(
                "find parser",
                TaskType.IMPLEMENTATION,
                5,
                1000,
                500,
                new SourceFilters(List.of(), languages, null, null),
                clock.instant().plusSeconds(2));
    }
}
