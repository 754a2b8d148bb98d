package com.williamcallahan.contextaggregator.domain.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller input for one aggregation.
 *
 * <p>Structural defaults (empty hints, default options) are filled in here. Semantic checks such
 * as a blank query or a non-positive budget are left to the aggregator so that malformed requests
 * surface as configuration errors rather than construction failures.</p>
 *
 * @param query free-text query
 * @param taskType task tag driving default sources and priorities
 * @param maxTokens hard token ceiling for the request
 * @param reservedTokens tokens held back from the budget, or null for the configured default
 * @param sources explicit source list, or null for the task defaults
 * @param sourcePriorities per-source weight overrides
 * @param hints retrieval hints
 * @param options processing options
 */
public record ContextRequest(
        String query,
        TaskType taskType,
        int maxTokens,
        Integer reservedTokens,
        List<ContextSourceType> sources,
        Map<ContextSourceType, Integer> sourcePriorities,
        ContextHints hints,
        ContextOptions options) {

    public ContextRequest {
        sources = sources == null ? null : List.copyOf(sources);
        sourcePriorities = sourcePriorities == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(sourcePriorities));
        hints = hints == null ? ContextHints.none() : hints;
        options = options == null ? ContextOptions.defaults() : options;
    }

    /**
     * Creates a request with default sources, hints and options.
     */
    public static ContextRequest of(String query, TaskType taskType, int maxTokens) {
        return new ContextRequest(query, taskType, maxTokens, null, null, null, null, null);
    }
}
