package com.williamcallahan.contextaggregator.service;

import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Fills in embeddings for chunks whose source did not supply one.
 *
 * <p>Works only when an {@link EmbeddingModel} is on the context. Embedding failures leave the
 * chunks unchanged: semantic deduplication and diversity ranking then treat them as dissimilar.</p>
 */
@Service
public class ChunkEmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(ChunkEmbeddingService.class);

    private final ObjectProvider<EmbeddingModel> embeddingModelProvider;

    public ChunkEmbeddingService(ObjectProvider<EmbeddingModel> embeddingModelProvider) {
        this.embeddingModelProvider = embeddingModelProvider;
    }

    /**
     * Returns the chunks with embeddings added where missing, in the same order.
     *
     * @param chunks merged chunks
     * @return chunks, embedded where possible
     */
    public List<ContextChunk> embedMissing(List<ContextChunk> chunks) {
        EmbeddingModel embeddingModel = embeddingModelProvider.getIfAvailable();
        if (embeddingModel == null || chunks.isEmpty()) {
            return chunks;
        }
        List<Integer> missingPositions = new ArrayList<>();
        List<String> missingTexts = new ArrayList<>();
        for (int index = 0; index < chunks.size(); index++) {
            if (!chunks.get(index).hasEmbedding()) {
                missingPositions.add(index);
                missingTexts.add(chunks.get(index).content());
            }
        }
        if (missingTexts.isEmpty()) {
            return chunks;
        }

        List<float[]> vectors;
        try {
            vectors = embeddingModel.embed(missingTexts);
        } catch (RuntimeException embeddingFailure) {
            log.warn("Embedding {} chunks failed (exceptionType={}); continuing without vectors",
                    missingTexts.size(), embeddingFailure.getClass().getSimpleName());
            return chunks;
        }
        if (vectors == null || vectors.size() != missingTexts.size()) {
            log.warn("Embedding model returned {} vectors for {} chunks; continuing without vectors",
                    vectors == null ? 0 : vectors.size(), missingTexts.size());
            return chunks;
        }

        List<ContextChunk> embedded = new ArrayList<>(chunks);
        for (int index = 0; index < missingPositions.size(); index++) {
            int position = missingPositions.get(index);
            embedded.set(position, embedded.get(position).withEmbedding(vectors.get(index)));
        }
        log.debug("Embedded {} chunks", missingPositions.size());
        return embedded;
    }
}
