package com.williamcallahan.contextaggregator.service.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.williamcallahan.contextaggregator.domain.context.ContextResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import redis.clients.jedis.Protocol;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

/**
 * Verifies key prefixing, JSON storage and error translation of the Redis cache.
 */
class RedisContextCacheTest {
    private static final String PREFIX = "context-aggregator:";

    private UnifiedJedis jedis;
    private RedisContextCache cache;

    @BeforeEach
    void setUp() {
        jedis = mock(UnifiedJedis.class);
        cache = new RedisContextCache(jedis, new ObjectMapper().registerModule(new JavaTimeModule()), PREFIX, 1000);
    }

    @Test
    void storesWithTtlAndReadsBackUnderPrefixedKey() {
        ContextResponse response = CaffeineContextCacheTest.response("req-9");
        cache.set("ctx:abc", response, Duration.ofSeconds(300));

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(jedis).setex(eq(PREFIX + "ctx:abc"), eq(300L), payload.capture());

        when(jedis.get(PREFIX + "ctx:abc")).thenReturn(payload.getValue());
        Optional<ContextResponse> cached = cache.get("ctx:abc");

        assertTrue(cached.isPresent());
        assertEquals("req-9", cached.get().requestId());
        assertEquals(1, cache.stats().hits());
    }

    @Test
    void unreadableEntryIsDroppedAndCountedAsMiss() {
        when(jedis.get(PREFIX + "ctx:bad")).thenReturn("{not json");

        assertFalse(cache.get("ctx:bad").isPresent());
        verify(jedis).del(PREFIX + "ctx:bad");
        assertEquals(1, cache.stats().misses());
    }

    @Test
    void connectionFailureSurfacesAsCacheException() {
        when(jedis.get(anyString())).thenThrow(new JedisConnectionException("connection refused"));

        assertThrows(ContextCacheException.class, () -> cache.get("ctx:any"));
    }

    @Test
    void clearScansPrefixedPatternAndDeletesMatches() {
        when(jedis.scan(eq(ScanParams.SCAN_POINTER_START), any(ScanParams.class)))
                .thenReturn(new ScanResult<>("17", List.of(PREFIX + "ctx:a", PREFIX + "ctx:b")));
        when(jedis.scan(eq("17"), any(ScanParams.class)))
                .thenReturn(new ScanResult<>(ScanParams.SCAN_POINTER_START, List.of(PREFIX + "ctx:c")));
        when(jedis.del(new String[] {PREFIX + "ctx:a", PREFIX + "ctx:b"})).thenReturn(2L);
        when(jedis.del(new String[] {PREFIX + "ctx:c"})).thenReturn(1L);

        assertEquals(3, cache.clear("ctx:*"));
    }

    @Test
    void healthCheckRequiresPong() {
        when(jedis.sendCommand(Protocol.Command.PING)).thenReturn("PONG".getBytes());
        assertTrue(cache.healthCheck());

        when(jedis.sendCommand(Protocol.Command.PING)).thenThrow(new JedisConnectionException("down"));
        assertFalse(cache.healthCheck());
    }

    @Test
    void skipsWriteForSubSecondTtl() {
        cache.set("ctx:short", CaffeineContextCacheTest.response("req-1"), Duration.ofMillis(500));

        verify(jedis, never()).setex(anyString(), anyLong(), anyString());
    }
}
