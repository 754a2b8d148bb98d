package com.williamcallahan.contextaggregator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.contextaggregator.application.context.ChunkDeduplicator;
import com.williamcallahan.contextaggregator.application.context.ChunkRanker;
import com.williamcallahan.contextaggregator.application.context.ContextAssembler;
import com.williamcallahan.contextaggregator.application.context.RequestFingerprint;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig;
import com.williamcallahan.contextaggregator.domain.context.CacheProvider;
import com.williamcallahan.contextaggregator.service.ChunkEmbeddingService;
import com.williamcallahan.contextaggregator.service.ContextAggregatorService;
import com.williamcallahan.contextaggregator.service.ContextSourceRegistry;
import com.williamcallahan.contextaggregator.service.cache.CaffeineContextCache;
import com.williamcallahan.contextaggregator.service.cache.ContextCache;
import com.williamcallahan.contextaggregator.service.cache.RedisContextCache;
import com.williamcallahan.contextaggregator.service.source.ContextSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelOption;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import redis.clients.jedis.JedisPooled;

/**
 * Wires the aggregator: configuration snapshot, cache provider, fan-out pool, adapter registry and
 * the outbound HTTP client the adapters share.
 */
@Configuration
public class ContextAggregatorConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ContextAggregatorConfiguration.class);
    private static final String FAN_OUT_EXECUTOR = "contextFanOutExecutor";
    private static final int CONNECT_TIMEOUT_MILLIS = 5000;
    private static final Duration RESPONSE_TIMEOUT = Duration.ofSeconds(30);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Validates the bound properties and freezes them into the startup snapshot.
     *
     * @param properties bound {@code app.context.*} settings
     * @return validated snapshot
     */
    @Bean
    public AggregatorConfig aggregatorConfig(ContextAggregatorProperties properties) {
        properties.validateConfiguration();
        return properties.toAggregatorConfig();
    }

    @Bean
    public WebClient.Builder webClientBuilder() {
        // Per-call deadlines are enforced by the adapters; these are outer bounds.
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(RESPONSE_TIMEOUT)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);
        return WebClient.builder().clientConnector(new ReactorClientHttpConnector(httpClient));
    }

    /**
     * Selects the response cache provider from configuration.
     *
     * @param config startup snapshot
     * @param properties backend connection settings
     * @param objectMapper serializer for the shared store
     * @return response cache
     */
    @Bean
    public ContextCache contextCache(
            AggregatorConfig config, ContextAggregatorProperties properties, ObjectMapper objectMapper) {
        if (config.caching().provider() == CacheProvider.REDIS) {
            ContextAggregatorProperties.RedisBackend redis = properties.getBackends().getRedis();
            log.info("Using Redis response cache (keyPrefix={})", redis.getKeyPrefix());
            return new RedisContextCache(
                    new JedisPooled(URI.create(redis.getUrl())),
                    objectMapper,
                    redis.getKeyPrefix(),
                    config.caching().maxEntries());
        }
        log.info("Using in-memory response cache (maxEntries={})", config.caching().maxEntries());
        return new CaffeineContextCache(config.caching().maxEntries());
    }

    @Bean(name = FAN_OUT_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService contextFanOutExecutor(ContextAggregatorProperties properties) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "ctx-fan-out-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getAggregation().getFanOutThreads(), threadFactory);
    }

    /**
     * Registers every adapter bean, initialized with its settings from the startup snapshot.
     *
     * @param adapters adapter beans
     * @param config startup snapshot
     * @return populated registry
     */
    @Bean
    public ContextSourceRegistry contextSourceRegistry(List<ContextSource> adapters, AggregatorConfig config) {
        ContextSourceRegistry registry = new ContextSourceRegistry();
        adapters.forEach(adapter -> registry.register(adapter, config));
        log.info("Registered context sources: {}", registry.registeredSources());
        return registry;
    }

    @Bean
    public ContextAggregatorService contextAggregatorService(
            AggregatorConfig config,
            ContextSourceRegistry registry,
            ContextCache contextCache,
            ChunkEmbeddingService embeddingService,
            ChunkDeduplicator deduplicator,
            ChunkRanker ranker,
            ContextAssembler assembler,
            RequestFingerprint requestFingerprint,
            @Qualifier(FAN_OUT_EXECUTOR) ExecutorService fanOutExecutor,
            Clock clock,
            MeterRegistry meterRegistry) {
        return new ContextAggregatorService(
                config,
                registry,
                contextCache,
                embeddingService,
                deduplicator,
                ranker,
                assembler,
                requestFingerprint,
                fanOutExecutor,
                clock,
                meterRegistry);
    }
}
