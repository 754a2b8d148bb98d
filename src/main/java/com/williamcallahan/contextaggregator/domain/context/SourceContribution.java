package com.williamcallahan.contextaggregator.domain.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * Per-source bookkeeping for one request. Exactly one exists per queried source.
 *
 * @param source queried source
 * @param chunksProvided chunks the source returned
 * @param tokensUsed tokens across the returned chunks
 * @param latencyMs adapter latency
 * @param cacheHit backend cache flag, or true for every source when the response came from cache
 * @param error failure description, or null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceContribution(
        ContextSourceType source, int chunksProvided, int tokensUsed, long latencyMs, boolean cacheHit, String error) {

    public SourceContribution {
        Objects.requireNonNull(source, "source");
    }

    public static SourceContribution failed(ContextSourceType source, String error, long latencyMs) {
        return new SourceContribution(source, 0, 0, latencyMs, false, error);
    }

    public boolean succeeded() {
        return error == null;
    }

    public SourceContribution asCacheHit() {
        return new SourceContribution(source, chunksProvided, tokensUsed, latencyMs, true, error);
    }
}
