package com.williamcallahan.contextaggregator.service.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.contextaggregator.domain.context.AssembledContext;
import com.williamcallahan.contextaggregator.domain.context.CacheProvider;
import com.williamcallahan.contextaggregator.domain.context.CacheStats;
import com.williamcallahan.contextaggregator.domain.context.ContextFormat;
import com.williamcallahan.contextaggregator.domain.context.ContextMetrics;
import com.williamcallahan.contextaggregator.domain.context.ContextResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

/**
 * Verifies per-entry expiry, pattern invalidation and hit counters of the in-process cache.
 */
class CaffeineContextCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final CaffeineContextCache cache = new CaffeineContextCache(100, nanos::get);

    @Test
    void returnsStoredResponseUntilTtlElapses() {
        cache.set("ctx:a", response("req-1"), Duration.ofSeconds(60));

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(59));
        assertTrue(cache.get("ctx:a").isPresent());

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(2));
        assertFalse(cache.get("ctx:a").isPresent());
    }

    @Test
    void ignoresNonPositiveTtl() {
        cache.set("ctx:a", response("req-1"), Duration.ZERO);

        assertFalse(cache.get("ctx:a").isPresent());
    }

    @Test
    void clearsOnlyKeysMatchingGlob() {
        cache.set("ctx:alpha", response("1"), Duration.ofMinutes(5));
        cache.set("ctx:beta", response("2"), Duration.ofMinutes(5));
        cache.set("session-7", response("3"), Duration.ofMinutes(5));

        assertEquals(2, cache.clear("ctx:*"));
        assertFalse(cache.get("ctx:alpha").isPresent());
        assertTrue(cache.get("session-7").isPresent());
    }

    @Test
    void blankPatternClearsEverything() {
        cache.set("ctx:alpha", response("1"), Duration.ofMinutes(5));
        cache.set("session-7", response("2"), Duration.ofMinutes(5));

        assertEquals(2, cache.clear(null));
        assertEquals(0, cache.stats().size());
    }

    @Test
    void statsTrackHitsAndMisses() {
        cache.set("ctx:a", response("req-1"), Duration.ofMinutes(5));
        cache.get("ctx:a");
        cache.get("ctx:a");
        cache.get("ctx:missing");
        cache.delete("ctx:a");

        CacheStats stats = cache.stats();

        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(0, stats.size());
        assertEquals(100, stats.maxSize());
        assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
        assertEquals(CacheProvider.MEMORY, cache.provider());
        assertTrue(cache.healthCheck());
    }

    static ContextResponse response(String requestId) {
        return new ContextResponse(
                requestId,
                AssembledContext.empty(ContextFormat.XML),
                List.of(),
                new ContextMetrics(5, 0, 0.0, 0.0, 0.0, 0, 0, false, true));
    }
}
