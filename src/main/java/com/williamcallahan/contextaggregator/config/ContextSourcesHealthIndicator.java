package com.williamcallahan.contextaggregator.config;

import com.williamcallahan.contextaggregator.domain.context.HealthStatus;
import com.williamcallahan.contextaggregator.service.ContextAggregatorService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes source and cache health through {@code /actuator/health}.
 *
 * <p>UP when at least one source is available and the cache answers; each source is listed as a
 * detail either way.</p>
 */
@Component
public class ContextSourcesHealthIndicator implements HealthIndicator {
    private static final String DETAIL_KEY_CACHE = "cache";
    private static final String UP = "up";
    private static final String DOWN = "down";

    private final ContextAggregatorService aggregatorService;

    public ContextSourcesHealthIndicator(ContextAggregatorService aggregatorService) {
        this.aggregatorService = aggregatorService;
    }

    @Override
    public Health health() {
        HealthStatus status = aggregatorService.healthCheck();
        Health.Builder builder = status.healthy() ? Health.up() : Health.down();
        status.sources().forEach((sourceType, sourceHealth) -> builder.withDetail(
                sourceType.wireId(),
                sourceHealth.healthy() ? UP : DOWN + (sourceHealth.error() == null ? "" : " (" + sourceHealth.error() + ")")));
        builder.withDetail(DETAIL_KEY_CACHE, status.cache().provider().wireId() + " " + (status.cache().healthy() ? UP : DOWN));
        return builder.build();
    }
}
