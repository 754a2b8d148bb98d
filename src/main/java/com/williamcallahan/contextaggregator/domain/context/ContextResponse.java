package com.williamcallahan.contextaggregator.domain.context;

import java.util.List;
import java.util.Objects;

/**
 * Top-level aggregation result; this is the value the response cache stores.
 *
 * @param requestId identifier of the request that produced (or retrieved) this response
 * @param context assembled context
 * @param sources one contribution per queried source
 * @param metrics aggregate metrics
 */
public record ContextResponse(
        String requestId, AssembledContext context, List<SourceContribution> sources, ContextMetrics metrics) {

    public ContextResponse {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(metrics, "metrics");
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    /**
     * Re-stamps a cached response for a new request.
     *
     * @param newRequestId id of the request being served
     * @param latencyMs time spent serving from cache
     * @return copy flagged as a cache hit
     */
    public ContextResponse asCacheHit(String newRequestId, long latencyMs) {
        return new ContextResponse(
                newRequestId,
                context,
                sources.stream().map(SourceContribution::asCacheHit).toList(),
                metrics.asCacheHit(latencyMs));
    }
}
