package com.williamcallahan.contextaggregator.domain.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Health of every registered source and of the cache.
 *
 * @param healthy true when at least one source and the cache are healthy
 * @param sources per-source health
 * @param cache cache health
 */
public record HealthStatus(boolean healthy, Map<ContextSourceType, SourceHealth> sources, CacheHealth cache) {

    public HealthStatus {
        Objects.requireNonNull(cache, "cache");
        sources = sources == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }

    /**
     * Computes the overall flag from its parts.
     */
    public static HealthStatus of(Map<ContextSourceType, SourceHealth> sources, CacheHealth cache) {
        boolean anySourceHealthy = sources.values().stream().anyMatch(SourceHealth::healthy);
        return new HealthStatus(anySourceHealthy && cache.healthy(), sources, cache);
    }

    /**
     * Health of one source.
     *
     * @param healthy availability check result
     * @param latencyMs check latency, null when the check threw
     * @param error check failure, null on success
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SourceHealth(boolean healthy, Long latencyMs, String error) {}

    /**
     * Health of the response cache.
     *
     * @param healthy backend reachable
     * @param provider backing technology
     */
    public record CacheHealth(boolean healthy, CacheProvider provider) {}
}
