package com.williamcallahan.contextaggregator.domain.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Arrays;
import java.util.Objects;

/**
 * One retrieved unit of context: text, provenance and a relevance score.
 *
 * <p>Chunks are values. Pipeline stages filter and reorder them and derive copies through the
 * {@code with*} methods; nothing mutates a chunk after construction. The embedding array is
 * copied on the way in and on every read.</p>
 *
 * @param id backend-scoped chunk identifier
 * @param content chunk text
 * @param source backend that produced the chunk
 * @param relevance relevance score clamped to [0, 1]
 * @param metadata provenance fields
 * @param tokenCount precomputed token count, or null when not yet counted
 * @param embedding optional embedding vector used for semantic dedup and diversity ranking
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextChunk(
        String id,
        String content,
        ContextSourceType source,
        double relevance,
        ChunkMetadata metadata,
        Integer tokenCount,
        float[] embedding) {

    public ContextChunk {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(source, "source");
        metadata = metadata == null ? ChunkMetadata.empty() : metadata;
        relevance = clampRelevance(relevance);
        if (tokenCount != null && tokenCount < 0) {
            throw new IllegalArgumentException("tokenCount must not be negative");
        }
        embedding = embedding == null || embedding.length == 0 ? null : embedding.clone();
    }

    /**
     * Creates a chunk without token count or embedding.
     */
    public static ContextChunk of(
            String id, String content, ContextSourceType source, double relevance, ChunkMetadata metadata) {
        return new ContextChunk(id, content, source, relevance, metadata, null, null);
    }

    /**
     * Reports whether this chunk carries a usable embedding vector.
     *
     * @return true when an embedding is present
     */
    public boolean hasEmbedding() {
        return embedding != null;
    }

    /**
     * Returns a copy of the embedding vector, or null when absent.
     *
     * @return embedding copy
     */
    @Override
    public float[] embedding() {
        return embedding == null ? null : embedding.clone();
    }

    public ContextChunk withTokenCount(int newTokenCount) {
        return new ContextChunk(id, content, source, relevance, metadata, newTokenCount, embedding);
    }

    public ContextChunk withContent(String newContent, int newTokenCount) {
        return new ContextChunk(id, newContent, source, relevance, metadata, newTokenCount, embedding);
    }

    public ContextChunk withEmbedding(float[] newEmbedding) {
        return new ContextChunk(id, content, source, relevance, metadata, tokenCount, newEmbedding);
    }

    public ContextChunk withoutEmbedding() {
        return embedding == null ? this : new ContextChunk(id, content, source, relevance, metadata, tokenCount, null);
    }

    private static double clampRelevance(double relevance) {
        if (Double.isNaN(relevance)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, relevance));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ContextChunk that)) {
            return false;
        }
        return Double.compare(relevance, that.relevance) == 0
                && id.equals(that.id)
                && content.equals(that.content)
                && source == that.source
                && metadata.equals(that.metadata)
                && Objects.equals(tokenCount, that.tokenCount)
                && Arrays.equals(embedding, that.embedding);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, content, source, relevance, metadata, tokenCount);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "ContextChunk[id=" + id + ", source=" + source + ", relevance=" + relevance
                + ", tokenCount=" + tokenCount + ", embedding=" + (embedding == null ? "none" : embedding.length + "d")
                + "]";
    }
}
