package com.williamcallahan.contextaggregator.domain.context;

import java.util.List;

/**
 * Outcome of one adapter call. Failures are values: a non-null {@code error} with no chunks.
 *
 * @param chunks retrieved chunks
 * @param latencyMs wall time spent in the adapter, retries included
 * @param cacheHit whether the backend answered from its own cache
 * @param error failure description, or null on success
 */
public record SourceResult(List<ContextChunk> chunks, long latencyMs, boolean cacheHit, String error) {

    public SourceResult {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        if (error != null && !chunks.isEmpty()) {
            throw new IllegalArgumentException("A failed source result carries no chunks");
        }
    }

    public static SourceResult success(List<ContextChunk> chunks, long latencyMs, boolean cacheHit) {
        return new SourceResult(chunks, latencyMs, cacheHit, null);
    }

    public static SourceResult failure(String error, long latencyMs) {
        return new SourceResult(List.of(), latencyMs, false, error == null || error.isBlank() ? "Unknown error" : error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
