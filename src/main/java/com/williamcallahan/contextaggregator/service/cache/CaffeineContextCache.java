package com.williamcallahan.contextaggregator.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.williamcallahan.contextaggregator.domain.context.CacheProvider;
import com.williamcallahan.contextaggregator.domain.context.CacheStats;
import com.williamcallahan.contextaggregator.domain.context.ContextResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process bounded response cache with a per-entry time-to-live.
 */
public class CaffeineContextCache implements ContextCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineContextCache.class);

    private final Cache<String, TimedEntry> entries;
    private final int maxEntries;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public CaffeineContextCache(int maxEntries) {
        this(maxEntries, Ticker.systemTicker());
    }

    public CaffeineContextCache(int maxEntries, Ticker ticker) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be greater than 0");
        }
        this.maxEntries = maxEntries;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .ticker(Objects.requireNonNull(ticker, "ticker"))
                .expireAfter(new PerEntryExpiry())
                .build();
    }

    @Override
    public Optional<ContextResponse> get(String key) {
        TimedEntry entry = entries.getIfPresent(key);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, ContextResponse value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        entries.put(key, new TimedEntry(value, ttl.toNanos()));
    }

    @Override
    public void delete(String key) {
        entries.invalidate(key);
    }

    @Override
    public long clear(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            long removed = entries.estimatedSize();
            entries.invalidateAll();
            entries.cleanUp();
            log.info("Cleared all {} cached responses", removed);
            return removed;
        }
        Pattern matcher = KeyPatterns.compile(pattern);
        List<String> matching = entries.asMap().keySet().stream()
                .filter(key -> matcher.matcher(key).matches())
                .toList();
        entries.invalidateAll(matching);
        log.info("Cleared {} cached responses matching {}", matching.size(), pattern);
        return matching.size();
    }

    @Override
    public CacheStats stats() {
        entries.cleanUp();
        return CacheStats.of(hits.sum(), misses.sum(), entries.estimatedSize(), maxEntries);
    }

    @Override
    public boolean healthCheck() {
        return true;
    }

    @Override
    public CacheProvider provider() {
        return CacheProvider.MEMORY;
    }

    private record TimedEntry(ContextResponse value, long ttlNanos) {}

    private static final class PerEntryExpiry implements Expiry<String, TimedEntry> {

        @Override
        public long expireAfterCreate(String key, TimedEntry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, TimedEntry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, TimedEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
