package com.williamcallahan.contextaggregator.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Verifies that only chunks without vectors are embedded and that embedding failures are tolerated.
 */
class ChunkEmbeddingServiceTest {

    private EmbeddingModel embeddingModel;
    private ChunkEmbeddingService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        embeddingModel = mock(EmbeddingModel.class);
        ObjectProvider<EmbeddingModel> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(embeddingModel);
        service = new ChunkEmbeddingService(provider);
    }

    @Test
    void embedsOnlyChunksMissingVectors() {
        ContextChunk alreadyEmbedded = new ContextChunk(
                "a", "has vector", ContextSourceType.VECTOR_DB, 0.9, null, null, new float[] {1.0f, 0.0f});
        ContextChunk plain = ContextChunk.of("b", "needs vector", ContextSourceType.RAG, 0.5, null);
        when(embeddingModel.embed(List.of("needs vector"))).thenReturn(List.of(new float[] {0.0f, 1.0f}));

        List<ContextChunk> embedded = service.embedMissing(List.of(alreadyEmbedded, plain));

        assertSame(alreadyEmbedded, embedded.get(0));
        assertArrayEquals(new float[] {0.0f, 1.0f}, embedded.get(1).embedding());
        verify(embeddingModel).embed(List.of("needs vector"));
    }

    @Test
    void failureLeavesChunksUnchanged() {
        ContextChunk plain = ContextChunk.of("b", "needs vector", ContextSourceType.RAG, 0.5, null);
        when(embeddingModel.embed(anyList())).thenThrow(new IllegalStateException("model offline"));

        List<ContextChunk> result = service.embedMissing(List.of(plain));

        assertEquals(List.of(plain), result);
        assertFalse(result.get(0).hasEmbedding());
    }

    @Test
    void mismatchedVectorCountLeavesChunksUnchanged() {
        ContextChunk first = ContextChunk.of("a", "one", ContextSourceType.RAG, 0.5, null);
        ContextChunk second = ContextChunk.of("b", "two", ContextSourceType.RAG, 0.5, null);
        when(embeddingModel.embed(anyList())).thenReturn(List.of(new float[] {1.0f}));

        assertEquals(List.of(first, second), service.embedMissing(List.of(first, second)));
    }
}
