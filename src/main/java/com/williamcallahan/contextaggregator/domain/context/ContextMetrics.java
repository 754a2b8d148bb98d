package com.williamcallahan.contextaggregator.domain.context;

/**
 * Aggregate metrics stamped onto a response.
 *
 * @param totalLatencyMs request wall time
 * @param totalTokens tokens in the assembled context
 * @param budgetUtilization totalTokens divided by the effective budget
 * @param deduplicationRate removed chunks divided by merged chunks
 * @param cacheHitRate share of the request answered from cache
 * @param sourcesQueried sources the request fanned out to
 * @param sourcesSucceeded sources that returned without error
 * @param cacheHit true when the response was served from the response cache
 * @param budgetWarning true when utilization fell below the configured warning threshold
 */
public record ContextMetrics(
        long totalLatencyMs,
        int totalTokens,
        double budgetUtilization,
        double deduplicationRate,
        double cacheHitRate,
        int sourcesQueried,
        int sourcesSucceeded,
        boolean cacheHit,
        boolean budgetWarning) {

    public ContextMetrics asCacheHit(long latencyMs) {
        return new ContextMetrics(
                latencyMs,
                totalTokens,
                budgetUtilization,
                deduplicationRate,
                1.0,
                sourcesQueried,
                sourcesSucceeded,
                true,
                budgetWarning);
    }
}
