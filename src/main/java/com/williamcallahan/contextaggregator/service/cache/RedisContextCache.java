package com.williamcallahan.contextaggregator.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.contextaggregator.domain.context.CacheProvider;
import com.williamcallahan.contextaggregator.domain.context.CacheStats;
import com.williamcallahan.contextaggregator.domain.context.ContextResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Protocol;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

/**
 * Shared response cache on Redis. Entries are JSON strings written with {@code SETEX}.
 */
public class RedisContextCache implements ContextCache, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RedisContextCache.class);
    private static final int SCAN_BATCH = 200;
    private static final String PONG = "PONG";

    private final UnifiedJedis jedis;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final int maxEntries;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public RedisContextCache(UnifiedJedis jedis, ObjectMapper objectMapper, String keyPrefix, int maxEntries) {
        this.jedis = jedis;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.maxEntries = maxEntries;
    }

    @Override
    public Optional<ContextResponse> get(String key) {
        String payload;
        try {
            payload = jedis.get(keyPrefix + key);
        } catch (JedisException jedisException) {
            throw new ContextCacheException("Redis GET failed for " + key, jedisException);
        }
        if (payload == null) {
            misses.increment();
            return Optional.empty();
        }
        try {
            ContextResponse response = objectMapper.readValue(payload, ContextResponse.class);
            hits.increment();
            return Optional.of(response);
        } catch (JsonProcessingException unreadable) {
            log.warn("Dropping unreadable cache entry {} (exceptionType={})",
                    key, unreadable.getClass().getSimpleName());
            misses.increment();
            delete(key);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, ContextResponse value, Duration ttl) {
        if (ttl == null || ttl.getSeconds() <= 0) {
            return;
        }
        try {
            jedis.setex(keyPrefix + key, ttl.getSeconds(), objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException unwritable) {
            throw new ContextCacheException("Could not serialize response for " + key, unwritable);
        } catch (JedisException jedisException) {
            throw new ContextCacheException("Redis SETEX failed for " + key, jedisException);
        }
    }

    @Override
    public void delete(String key) {
        try {
            jedis.del(keyPrefix + key);
        } catch (JedisException jedisException) {
            throw new ContextCacheException("Redis DEL failed for " + key, jedisException);
        }
    }

    @Override
    public long clear(String pattern) {
        String match = KeyPatterns.toRedisMatch(keyPrefix + (pattern == null || pattern.isBlank() ? "*" : pattern));
        long removed = 0;
        try {
            String cursor = ScanParams.SCAN_POINTER_START;
            ScanParams params = new ScanParams().match(match).count(SCAN_BATCH);
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                List<String> keys = page.getResult();
                if (!keys.isEmpty()) {
                    removed += jedis.del(keys.toArray(new String[0]));
                }
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
        } catch (JedisException jedisException) {
            throw new ContextCacheException("Redis clear failed for pattern " + match, jedisException);
        }
        log.info("Cleared {} cached responses matching {}", removed, match);
        return removed;
    }

    @Override
    public CacheStats stats() {
        long size = 0;
        try {
            String cursor = ScanParams.SCAN_POINTER_START;
            ScanParams params = new ScanParams().match(KeyPatterns.toRedisMatch(keyPrefix) + "*").count(SCAN_BATCH);
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                size += page.getResult().size();
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
        } catch (JedisException jedisException) {
            log.warn("Could not count cached responses (exceptionType={})",
                    jedisException.getClass().getSimpleName());
        }
        return CacheStats.of(hits.sum(), misses.sum(), size, maxEntries);
    }

    @Override
    public boolean healthCheck() {
        try {
            Object reply = jedis.sendCommand(Protocol.Command.PING);
            String text = reply instanceof byte[] bytes ? new String(bytes, StandardCharsets.UTF_8)
                    : String.valueOf(reply);
            return PONG.equalsIgnoreCase(text);
        } catch (JedisException jedisException) {
            log.warn("Redis health check failed (exceptionType={})", jedisException.getClass().getSimpleName());
            return false;
        }
    }

    @Override
    public CacheProvider provider() {
        return CacheProvider.REDIS;
    }

    @Override
    public void close() {
        jedis.close();
    }
}
