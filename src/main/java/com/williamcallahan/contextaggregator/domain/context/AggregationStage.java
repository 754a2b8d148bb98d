package com.williamcallahan.contextaggregator.domain.context;

/**
 * Per-request states of the aggregation pipeline, in order.
 *
 * <p>{@link #FAILED} is reachable only from {@link #VALIDATING}; a cache hit jumps from
 * {@link #CACHE_CHECK} straight to {@link #DONE}.</p>
 */
public enum AggregationStage {
    VALIDATING,
    CACHE_CHECK,
    FANNING_OUT,
    MERGING,
    DEDUPING,
    RANKING,
    ASSEMBLING,
    CACHING,
    DONE,
    FAILED
}
