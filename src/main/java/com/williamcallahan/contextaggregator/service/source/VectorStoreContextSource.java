package com.williamcallahan.contextaggregator.service.source;

import com.williamcallahan.contextaggregator.config.ContextAggregatorProperties;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.SourceFilters;
import com.williamcallahan.contextaggregator.domain.context.SourceQuery;
import com.williamcallahan.contextaggregator.support.ChunkMetadataMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Semantic code search over a Spring AI {@link VectorStore}.
 *
 * <p>The store is optional: without one on the context the adapter reports itself unavailable.
 * Similarity scores become chunk relevance; documents without a score fall back to rank decay.</p>
 */
@Component
public class VectorStoreContextSource extends AbstractContextSource {
    private static final Logger log = LoggerFactory.getLogger(VectorStoreContextSource.class);
    private static final String LANGUAGE_KEY = "language";

    private final ObjectProvider<VectorStore> vectorStoreProvider;
    private final ContextAggregatorProperties.VectorStoreBackend backend;

    public VectorStoreContextSource(
            ObjectProvider<VectorStore> vectorStoreProvider, ContextAggregatorProperties properties, Clock clock) {
        super(ContextSourceType.VECTOR_DB, clock);
        this.vectorStoreProvider = vectorStoreProvider;
        this.backend = properties.getBackends().getVectorStore();
    }

    @Override
    protected boolean isBackendConfigured() {
        return vectorStoreProvider.getIfAvailable() != null;
    }

    @Override
    protected SourceFetch fetch(SourceQuery query) {
        VectorStore vectorStore = vectorStoreProvider.getIfAvailable();
        if (vectorStore == null) {
            throw new SourceRetrievalException("No vector store is configured");
        }

        SearchRequest.Builder searchRequest = SearchRequest.builder()
                .query(query.text())
                .topK(Math.max(1, query.maxChunks()))
                .similarityThreshold(backend.getSimilarityThreshold());
        SourceFilters filters = query.filters();
        if (backend.isFilterByLanguage() && !filters.languages().isEmpty()) {
            searchRequest.filterExpression(new FilterExpressionBuilder()
                    .in(LANGUAGE_KEY, filters.languages().toArray())
                    .build());
        }

        List<Document> documents = vectorStore.similaritySearch(searchRequest.build());
        if (documents == null) {
            return SourceFetch.of(List.of());
        }
        log.debug("Vector store returned {} documents", documents.size());

        List<ContextChunk> chunks = new ArrayList<>(documents.size());
        for (int rank = 0; rank < documents.size(); rank++) {
            Document document = documents.get(rank);
            String text = document.getText();
            if (text == null || text.isBlank()) {
                continue;
            }
            String chunkId = document.getId() == null ? "vector-" + rank : document.getId();
            chunks.add(ContextChunk.of(
                    chunkId,
                    text,
                    ContextSourceType.VECTOR_DB,
                    relevanceOf(document, rank),
                    ChunkMetadataMapper.fromMap(document.getMetadata())));
        }
        return SourceFetch.of(chunks);
    }

    private static double relevanceOf(Document document, int rank) {
        Double score = document.getScore();
        if (score != null) {
            return score;
        }
        return RankDecay.relevanceAt(rank);
    }
}
