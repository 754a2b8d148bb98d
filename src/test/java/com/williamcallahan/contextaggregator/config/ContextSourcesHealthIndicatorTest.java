package com.williamcallahan.contextaggregator.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.williamcallahan.contextaggregator.domain.context.CacheProvider;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.HealthStatus;
import com.williamcallahan.contextaggregator.domain.context.HealthStatus.CacheHealth;
import com.williamcallahan.contextaggregator.domain.context.HealthStatus.SourceHealth;
import com.williamcallahan.contextaggregator.service.ContextAggregatorService;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

/**
 * Verifies the health indicator reports source and cache state.
 */
class ContextSourcesHealthIndicatorTest {

    @Test
    void reportsUpWhenOneSourceAndCacheAreHealthy() {
        Map<ContextSourceType, SourceHealth> sources = new EnumMap<>(ContextSourceType.class);
        sources.put(ContextSourceType.VECTOR_DB, new SourceHealth(true, 12L, null));
        sources.put(ContextSourceType.RAG, new SourceHealth(false, null, "connection refused"));
        ContextAggregatorService aggregatorService = mock(ContextAggregatorService.class);
        when(aggregatorService.healthCheck())
                .thenReturn(HealthStatus.of(sources, new CacheHealth(true, CacheProvider.MEMORY)));

        Health health = new ContextSourcesHealthIndicator(aggregatorService).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("up", health.getDetails().get("vector_db"));
        assertEquals("down (connection refused)", health.getDetails().get("rag"));
        assertEquals("memory up", health.getDetails().get("cache"));
    }

    @Test
    void reportsDownWhenCacheIsUnreachable() {
        Map<ContextSourceType, SourceHealth> sources = new EnumMap<>(ContextSourceType.class);
        sources.put(ContextSourceType.VECTOR_DB, new SourceHealth(true, 4L, null));
        ContextAggregatorService aggregatorService = mock(ContextAggregatorService.class);
        when(aggregatorService.healthCheck())
                .thenReturn(HealthStatus.of(sources, new CacheHealth(false, CacheProvider.REDIS)));

        Health health = new ContextSourcesHealthIndicator(aggregatorService).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("redis down", health.getDetails().get("cache"));
    }

    @Test
    void reportsDownWhenNoSourceIsAvailable() {
        Map<ContextSourceType, SourceHealth> sources = new EnumMap<>(ContextSourceType.class);
        sources.put(ContextSourceType.MCP, new SourceHealth(false, null, null));
        ContextAggregatorService aggregatorService = mock(ContextAggregatorService.class);
        when(aggregatorService.healthCheck())
                .thenReturn(HealthStatus.of(sources, new CacheHealth(true, CacheProvider.MEMORY)));

        Health health = new ContextSourcesHealthIndicator(aggregatorService).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("down", health.getDetails().get("mcp"));
    }
}
