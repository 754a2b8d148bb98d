package com.williamcallahan.contextaggregator.service.cache;

import com.williamcallahan.contextaggregator.domain.context.CacheProvider;
import com.williamcallahan.contextaggregator.domain.context.CacheStats;
import com.williamcallahan.contextaggregator.domain.context.ContextResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Response cache contract. The aggregator depends only on this interface.
 *
 * <p>Implementations throw {@link ContextCacheException} when the backing store cannot be reached;
 * callers decide whether to fail open.</p>
 */
public interface ContextCache {

    Optional<ContextResponse> get(String key);

    void set(String key, ContextResponse value, Duration ttl);

    void delete(String key);

    /**
     * Removes entries whose key matches a glob pattern where {@code *} matches any run of characters.
     *
     * @param pattern glob pattern, or null to remove everything
     * @return number of entries removed
     */
    long clear(String pattern);

    CacheStats stats();

    /**
     * Checks the backing store.
     *
     * @return true when reads and writes are expected to succeed
     */
    boolean healthCheck();

    CacheProvider provider();
}
