package com.williamcallahan.contextaggregator.domain.context;

/**
 * Snapshot of response cache counters.
 *
 * @param hits lookups answered from cache
 * @param misses lookups that found nothing
 * @param size current entry count (approximate for shared stores)
 * @param maxSize configured entry bound
 * @param hitRate hits divided by lookups, 0 when there were none
 */
public record CacheStats(long hits, long misses, long size, long maxSize, double hitRate) {

    public static CacheStats of(long hits, long misses, long size, long maxSize) {
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
        return new CacheStats(hits, misses, size, maxSize, hitRate);
    }
}
