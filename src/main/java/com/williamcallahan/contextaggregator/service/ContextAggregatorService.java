package com.williamcallahan.contextaggregator.service;

import com.williamcallahan.contextaggregator.application.context.AggregatorConfigValidator;
import com.williamcallahan.contextaggregator.application.context.AssemblySettings;
import com.williamcallahan.contextaggregator.application.context.BudgetManager;
import com.williamcallahan.contextaggregator.application.context.ChunkDeduplicator;
import com.williamcallahan.contextaggregator.application.context.ChunkDeduplicator.DeduplicationResult;
import com.williamcallahan.contextaggregator.application.context.ChunkRanker;
import com.williamcallahan.contextaggregator.application.context.ContextAssembler;
import com.williamcallahan.contextaggregator.application.context.RequestFingerprint;
import com.williamcallahan.contextaggregator.application.context.RequestPlan;
import com.williamcallahan.contextaggregator.application.context.TokenCounter;
import com.williamcallahan.contextaggregator.domain.context.AggregationStage;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.SourceSettings;
import com.williamcallahan.contextaggregator.domain.context.AssembledContext;
import com.williamcallahan.contextaggregator.domain.context.CacheStats;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.ContextMetrics;
import com.williamcallahan.contextaggregator.domain.context.ContextRequest;
import com.williamcallahan.contextaggregator.domain.context.ContextResponse;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.HealthStatus;
import com.williamcallahan.contextaggregator.domain.context.SourceContribution;
import com.williamcallahan.contextaggregator.domain.context.SourceFilters;
import com.williamcallahan.contextaggregator.domain.context.SourceQuery;
import com.williamcallahan.contextaggregator.domain.context.SourceResult;
import com.williamcallahan.contextaggregator.domain.context.TokenCounterType;
import com.williamcallahan.contextaggregator.domain.errors.ContextConfigurationException;
import com.williamcallahan.contextaggregator.service.cache.ContextCache;
import com.williamcallahan.contextaggregator.service.source.ContextSource;
import com.williamcallahan.contextaggregator.support.SourceErrorClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * Orchestrates one aggregation: validate, check the cache, fan out to sources, merge, deduplicate,
 * rank, assemble under the token budget, then cache the response.
 *
 * <p>Only malformed requests raise. Source failures, timeouts and cache outages degrade the
 * response: every queried source gets a contribution and the caller inspects
 * {@code sourcesSucceeded} against {@code sourcesQueried}.</p>
 *
 * <p>The configuration is an immutable snapshot held in one reference. Each request reads it once,
 * so {@link #configure(AggregatorConfig)} never affects a request already running.</p>
 */
public class ContextAggregatorService {
    private static final Logger log = LoggerFactory.getLogger(ContextAggregatorService.class);

    /** MDC key carrying the request id through pipeline logging. */
    public static final String REQUEST_ID_KEY = "contextRequestId";

    private static final String REQUEST_ID_PREFIX = "ctx-";
    private static final String SOURCE_FAILURES_METRIC = "context.source.failures";
    private static final String CACHE_LOOKUPS_METRIC = "context.cache.lookups";
    private static final String REQUEST_DEADLINE_ERROR = SourceErrorClassifier.CANCELLED + ": request deadline exceeded";

    private final AtomicReference<AggregatorConfig> configSnapshot;
    private final ContextSourceRegistry registry;
    private final ContextCache cache;
    private final ChunkEmbeddingService embeddingService;
    private final ChunkDeduplicator deduplicator;
    private final ChunkRanker ranker;
    private final ContextAssembler assembler;
    private final RequestFingerprint requestFingerprint;
    private final ExecutorService fanOutExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final AtomicLong requestSequence = new AtomicLong();
    private final Map<String, CompletableFuture<ContextResponse>> inFlight = new ConcurrentHashMap<>();
    private final Map<TokenCounterType, TokenCounter> tokenCounters = new ConcurrentHashMap<>();

    public ContextAggregatorService(
            AggregatorConfig initialConfig,
            ContextSourceRegistry registry,
            ContextCache cache,
            ChunkEmbeddingService embeddingService,
            ChunkDeduplicator deduplicator,
            ChunkRanker ranker,
            ContextAssembler assembler,
            RequestFingerprint requestFingerprint,
            ExecutorService fanOutExecutor,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.configSnapshot = new AtomicReference<>(AggregatorConfigValidator.validate(
                Objects.requireNonNull(initialConfig, "initialConfig")));
        this.registry = Objects.requireNonNull(registry, "registry");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
        this.ranker = Objects.requireNonNull(ranker, "ranker");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.requestFingerprint = Objects.requireNonNull(requestFingerprint, "requestFingerprint");
        this.fanOutExecutor = Objects.requireNonNull(fanOutExecutor, "fanOutExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    /**
     * Swaps the configuration snapshot and re-initializes registered adapters with their new settings.
     *
     * @param newConfig replacement snapshot
     * @throws ContextConfigurationException when the snapshot is invalid
     */
    public void configure(AggregatorConfig newConfig) {
        AggregatorConfig validated = AggregatorConfigValidator.validate(Objects.requireNonNull(newConfig, "newConfig"));
        configSnapshot.set(validated);
        registry.reinitialize(validated);
        log.info("Aggregator reconfigured (sources={}, cacheEnabled={})",
                registry.registeredSources(), validated.caching().enabled());
    }

    /**
     * Returns the snapshot new requests will use.
     *
     * @return current configuration
     */
    public AggregatorConfig currentConfig() {
        return configSnapshot.get();
    }

    /**
     * Registers an adapter with settings from the current snapshot.
     *
     * @param adapter adapter to add
     */
    public void registerSource(ContextSource adapter) {
        registry.register(adapter, configSnapshot.get());
    }

    /**
     * Removes and disposes a registered adapter.
     *
     * @param sourceType source to remove
     * @return true when an adapter was removed
     */
    public boolean removeSource(ContextSourceType sourceType) {
        return registry.remove(sourceType);
    }

    /**
     * Aggregates context for a request.
     *
     * @param request caller request
     * @return response, degraded rather than failed when sources or the cache misbehave
     * @throws ContextConfigurationException when the request is malformed
     */
    public ContextResponse getContext(ContextRequest request) {
        long startMillis = clock.millis();
        AggregatorConfig config = configSnapshot.get();
        String requestId = nextRequestId();
        MDC.put(REQUEST_ID_KEY, requestId);
        try {
            stage(requestId, AggregationStage.VALIDATING);
            try {
                validate(request);
            } catch (ContextConfigurationException invalid) {
                stage(requestId, AggregationStage.FAILED);
                throw invalid;
            }
            RequestPlan plan = plan(request, config);

            boolean useCache = config.caching().enabled() && !request.options().resolveSkipCache();
            if (!useCache) {
                return aggregate(requestId, plan, config, startMillis);
            }

            stage(requestId, AggregationStage.CACHE_CHECK);
            String cacheKey = requestFingerprint.cacheKey(plan);
            Optional<ContextResponse> cached = lookup(cacheKey).filter(hit -> fitsBudget(hit, plan, requestId));
            if (cached.isPresent()) {
                stage(requestId, AggregationStage.DONE);
                return cached.get().asCacheHit(requestId, elapsedSince(startMillis));
            }

            CompletableFuture<ContextResponse> ownFlight = new CompletableFuture<>();
            CompletableFuture<ContextResponse> sharedFlight = inFlight.putIfAbsent(cacheKey, ownFlight);
            if (sharedFlight != null) {
                Optional<ContextResponse> shared = awaitShared(sharedFlight, plan.requestTimeout())
                        .filter(joined -> fitsBudget(joined, plan, requestId));
                if (shared.isPresent()) {
                    log.debug("[{}] Joined in-flight aggregation for identical request", requestId);
                    stage(requestId, AggregationStage.DONE);
                    return shared.get().asCacheHit(requestId, elapsedSince(startMillis));
                }
                return aggregate(requestId, plan, config, startMillis);
            }

            try {
                ContextResponse response = aggregate(requestId, plan, config, startMillis);
                store(cacheKey, response, Duration.ofSeconds(config.caching().ttlSeconds()));
                ownFlight.complete(response);
                return response;
            } catch (RuntimeException aggregationFailure) {
                ownFlight.completeExceptionally(aggregationFailure);
                throw aggregationFailure;
            } finally {
                inFlight.remove(cacheKey, ownFlight);
            }
        } finally {
            MDC.remove(REQUEST_ID_KEY);
        }
    }

    /**
     * Streams the included chunks of a request in rank order.
     *
     * <p>Chunks are emitted after every source has settled so that the order matches the assembled
     * context. Validation errors surface as the stream's error signal.</p>
     *
     * @param request caller request
     * @return finite chunk stream
     */
    public Flux<ContextChunk> streamContext(ContextRequest request) {
        return Flux.defer(() -> Flux.fromIterable(getContext(request).context().chunks()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Removes cached responses.
     *
     * @param pattern glob over cache keys, or null for everything
     * @return entries removed, 0 when the cache is unreachable
     */
    public long invalidateCache(String pattern) {
        try {
            return cache.clear(pattern);
        } catch (RuntimeException cacheFailure) {
            log.warn("Cache invalidation failed (exceptionType={})", cacheFailure.getClass().getSimpleName());
            return 0;
        }
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    /**
     * Checks every registered adapter and the cache.
     *
     * @return health snapshot
     */
    public HealthStatus healthCheck() {
        Map<ContextSourceType, HealthStatus.SourceHealth> sourceHealth = new EnumMap<>(ContextSourceType.class);
        for (ContextSourceType sourceType : registry.registeredSources()) {
            Optional<ContextSource> adapter = registry.find(sourceType);
            if (adapter.isEmpty()) {
                continue;
            }
            long checkStart = clock.millis();
            try {
                boolean available = adapter.get().isAvailable();
                sourceHealth.put(sourceType, new HealthStatus.SourceHealth(
                        available, elapsedSince(checkStart), available ? null : "source is not available"));
            } catch (RuntimeException checkFailure) {
                sourceHealth.put(sourceType, new HealthStatus.SourceHealth(
                        false, null, SourceErrorClassifier.describe(checkFailure)));
            }
        }
        boolean cacheHealthy;
        try {
            cacheHealthy = cache.healthCheck();
        } catch (RuntimeException cacheFailure) {
            cacheHealthy = false;
        }
        return HealthStatus.of(sourceHealth, new HealthStatus.CacheHealth(cacheHealthy, cache.provider()));
    }

    /**
     * Disposes every adapter and clears the cache.
     */
    @PreDestroy
    public void dispose() {
        registry.disposeAll();
        invalidateCache(null);
        log.info("Aggregator disposed");
    }

    private ContextResponse aggregate(String requestId, RequestPlan plan, AggregatorConfig config, long startMillis) {
        TokenCounter tokenCounter = plan.assembly().tokenCounter();

        stage(requestId, AggregationStage.FANNING_OUT);
        Map<ContextSourceType, SourceResult> results = fanOut(requestId, plan, config);

        stage(requestId, AggregationStage.MERGING);
        List<SourceContribution> contributions = new ArrayList<>(results.size());
        List<ContextChunk> merged = new ArrayList<>();
        int sourcesSucceeded = 0;
        int sourcesFromBackendCache = 0;
        for (Map.Entry<ContextSourceType, SourceResult> entry : results.entrySet()) {
            ContextSourceType sourceType = entry.getKey();
            SourceResult result = entry.getValue();
            if (!result.isSuccess()) {
                meterRegistry.counter(SOURCE_FAILURES_METRIC, "source", sourceType.wireId()).increment();
                contributions.add(SourceContribution.failed(sourceType, result.error(), result.latencyMs()));
                continue;
            }
            sourcesSucceeded++;
            if (result.cacheHit()) {
                sourcesFromBackendCache++;
            }
            int tokensUsed = 0;
            for (ContextChunk chunk : result.chunks()) {
                ContextChunk counted = chunk.tokenCount() == null
                        ? chunk.withTokenCount(tokenCounter.count(chunk.content()))
                        : chunk;
                tokensUsed += counted.tokenCount();
                merged.add(counted);
            }
            contributions.add(new SourceContribution(
                    sourceType, result.chunks().size(), tokensUsed, result.latencyMs(), result.cacheHit(), null));
        }
        int maxMerged = config.aggregation().maxMergedChunks();
        if (merged.size() > maxMerged) {
            log.debug("[{}] Capping {} merged chunks at {}", requestId, merged.size(), maxMerged);
            merged = new ArrayList<>(ranker.rankByRelevance(merged, plan.priorities()).subList(0, maxMerged));
        }

        stage(requestId, AggregationStage.DEDUPING);
        List<ContextChunk> candidates = merged;
        boolean semanticDedup = plan.deduplicate() && config.deduplication().useSemantic();
        if (semanticDedup || plan.diversify()) {
            candidates = embeddingService.embedMissing(candidates);
        }
        int removed = 0;
        if (plan.deduplicate()) {
            DeduplicationResult deduplication = deduplicator.deduplicate(candidates, config.deduplication());
            candidates = deduplication.chunks();
            removed = deduplication.removedCount();
        }

        stage(requestId, AggregationStage.RANKING);
        List<ContextChunk> ranked = ranker.rank(candidates, plan.priorities(), plan.diversify(), plan.mmrLambda());

        stage(requestId, AggregationStage.ASSEMBLING);
        AssembledContext assembled = assembler.assemble(ranked, plan.effectiveBudget(), plan.assembly());

        int sourcesQueried = plan.sources().size();
        double utilization = plan.effectiveBudget() == 0 ? 0.0 : (double) assembled.tokenCount() / plan.effectiveBudget();
        double dedupRate = merged.isEmpty() ? 0.0 : (double) removed / merged.size();
        double cacheHitRate = sourcesQueried == 0 ? 0.0 : (double) sourcesFromBackendCache / sourcesQueried;
        boolean budgetWarning = utilization < config.budget().warningThreshold();
        ContextMetrics metrics = new ContextMetrics(
                elapsedSince(startMillis),
                assembled.tokenCount(),
                utilization,
                dedupRate,
                cacheHitRate,
                sourcesQueried,
                sourcesSucceeded,
                false,
                budgetWarning);

        stage(requestId, AggregationStage.CACHING);
        log.info("[{}] Aggregated {} chunks ({} tokens, utilization={}) from {}/{} sources in {}ms",
                requestId, assembled.chunks().size(), assembled.tokenCount(),
                String.format(Locale.ROOT, "%.2f", utilization),
                sourcesSucceeded, sourcesQueried, metrics.totalLatencyMs());
        return new ContextResponse(requestId, assembled, contributions, metrics);
    }

    private Map<ContextSourceType, SourceResult> fanOut(String requestId, RequestPlan plan, AggregatorConfig config) {
        Instant fanOutStart = clock.instant();
        Instant outerDeadline = fanOutStart.plus(plan.requestTimeout());
        SourceFilters filters = SourceFilters.fromHints(plan.request().hints());

        Map<ContextSourceType, Future<SourceResult>> pending = new LinkedHashMap<>();
        Map<ContextSourceType, SourceResult> settled = new LinkedHashMap<>();
        for (ContextSourceType sourceType : plan.sources()) {
            Optional<ContextSource> adapter = registry.find(sourceType);
            if (adapter.isEmpty()) {
                settled.put(sourceType, SourceResult.failure(sourceType + " source is not registered", 0));
                continue;
            }
            SourceSettings settings = config.sourceSettings(sourceType);
            Duration sourceTimeout = Duration.ofMillis(settings.timeoutMs());
            Duration callTimeout = sourceTimeout.compareTo(plan.requestTimeout()) < 0 ? sourceTimeout : plan.requestTimeout();
            SourceQuery query = new SourceQuery(
                    plan.request().query(),
                    plan.request().taskType(),
                    settings.maxChunks(),
                    plan.allocation().getOrDefault(sourceType, 0),
                    config.budget().maxChunkTokens(),
                    filters,
                    fanOutStart.plus(callTimeout),
                    settings);
            ContextSource target = adapter.get();
            try {
                pending.put(sourceType, fanOutExecutor.submit(() -> target.retrieve(query)));
            } catch (RejectedExecutionException rejected) {
                settled.put(sourceType, SourceResult.failure("fan-out executor rejected the call", 0));
            }
        }

        boolean interrupted = false;
        for (Map.Entry<ContextSourceType, Future<SourceResult>> entry : pending.entrySet()) {
            ContextSourceType sourceType = entry.getKey();
            Future<SourceResult> future = entry.getValue();
            if (interrupted) {
                future.cancel(true);
                settled.put(sourceType, SourceResult.failure(REQUEST_DEADLINE_ERROR, elapsedSince(fanOutStart)));
                continue;
            }
            Duration remaining = Duration.between(clock.instant(), outerDeadline);
            try {
                long waitMillis = Math.max(0, remaining.toMillis());
                settled.put(sourceType, future.get(waitMillis, TimeUnit.MILLISECONDS));
            } catch (TimeoutException timeout) {
                future.cancel(true);
                log.warn("[{}] {} did not settle before the request deadline", requestId, sourceType);
                settled.put(sourceType, SourceResult.failure(REQUEST_DEADLINE_ERROR, elapsedSince(fanOutStart)));
            } catch (InterruptedException interruptedException) {
                Thread.currentThread().interrupt();
                interrupted = true;
                future.cancel(true);
                settled.put(sourceType, SourceResult.failure(
                        SourceErrorClassifier.CANCELLED + ": request was cancelled", elapsedSince(fanOutStart)));
            } catch (ExecutionException executionException) {
                Throwable cause = executionException.getCause() == null ? executionException : executionException.getCause();
                settled.put(sourceType, SourceResult.failure(
                        SourceErrorClassifier.describe(cause), elapsedSince(fanOutStart)));
            }
        }

        Map<ContextSourceType, SourceResult> ordered = new LinkedHashMap<>();
        for (ContextSourceType sourceType : plan.sources()) {
            ordered.put(sourceType, settled.get(sourceType));
        }
        return ordered;
    }

    private RequestPlan plan(ContextRequest request, AggregatorConfig config) {
        BudgetManager budgetManager = new BudgetManager(config.budget(), config.taskRouting());
        int effectiveBudget = budgetManager.effectiveBudget(request.maxTokens(), request.reservedTokens());

        List<ContextSourceType> requested = request.sources() == null
                ? budgetManager.defaultSources(request.taskType())
                : request.sources();
        List<ContextSourceType> sources = new ArrayList<>();
        for (ContextSourceType sourceType : new LinkedHashSet<>(requested)) {
            if (config.sourceSettings(sourceType).enabled() && registry.find(sourceType).isPresent()) {
                sources.add(sourceType);
            }
        }

        Map<ContextSourceType, Integer> priorities = budgetManager.defaultPriorities(request.taskType());
        priorities.putAll(request.sourcePriorities());
        Map<ContextSourceType, Integer> allocation = budgetManager.allocate(sources, priorities, effectiveBudget);

        TokenCounter tokenCounter = tokenCounters.computeIfAbsent(config.budget().tokenCounter(), TokenCounter::forType);
        AssemblySettings assembly = AssemblySettings.resolve(request.options(), config, tokenCounter);
        Long requestTimeoutMs = request.options().timeoutMs();
        Duration requestTimeout = Duration.ofMillis(requestTimeoutMs == null || requestTimeoutMs == 0
                ? config.aggregation().requestTimeoutMs()
                : requestTimeoutMs);

        return new RequestPlan(
                request,
                effectiveBudget,
                sources,
                priorities,
                allocation,
                assembly,
                request.options().resolveDeduplicate() && config.deduplication().enabled(),
                request.options().resolveDiversify(config.ranking().diversify()),
                config.ranking().mmrLambda(),
                requestTimeout);
    }

    private void validate(ContextRequest request) {
        if (request == null) {
            throw new ContextConfigurationException("Request must not be null");
        }
        if (request.query() == null || request.query().isBlank()) {
            throw new ContextConfigurationException("query must not be blank");
        }
        if (request.taskType() == null) {
            throw new ContextConfigurationException("taskType is required");
        }
        if (request.maxTokens() <= 0) {
            throw new ContextConfigurationException("maxTokens must be greater than 0 (got " + request.maxTokens() + ")");
        }
        if (request.reservedTokens() != null && request.reservedTokens() < 0) {
            throw new ContextConfigurationException(
                    "reservedTokens must be 0 or greater (got " + request.reservedTokens() + ")");
        }
        for (Map.Entry<ContextSourceType, Integer> priority : request.sourcePriorities().entrySet()) {
            if (priority.getValue() == null || priority.getValue() < 0) {
                throw new ContextConfigurationException(
                        "sourcePriorities." + priority.getKey().wireId() + " must be 0 or greater");
            }
        }
        Long timeoutMs = request.options().timeoutMs();
        if (timeoutMs != null && timeoutMs < 0) {
            throw new ContextConfigurationException("options.timeoutMs must be 0 or greater (got " + timeoutMs + ")");
        }
    }

    private Optional<ContextResponse> lookup(String cacheKey) {
        try {
            Optional<ContextResponse> cached = cache.get(cacheKey);
            meterRegistry.counter(CACHE_LOOKUPS_METRIC, "result", cached.isPresent() ? "hit" : "miss").increment();
            return cached;
        } catch (RuntimeException cacheFailure) {
            meterRegistry.counter(CACHE_LOOKUPS_METRIC, "result", "error").increment();
            log.warn("Cache lookup failed; continuing with live retrieval (exceptionType={})",
                    cacheFailure.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    private void store(String cacheKey, ContextResponse response, Duration ttl) {
        try {
            cache.set(cacheKey, response, ttl);
        } catch (RuntimeException cacheFailure) {
            log.warn("Cache store failed; response returned uncached (exceptionType={})",
                    cacheFailure.getClass().getSimpleName());
        }
    }

    /**
     * Rejects a stored or shared response assembled for a larger budget than this request allows.
     * Caller-supplied cache keys are not derived from the budget, so one key can serve different budgets.
     */
    private static boolean fitsBudget(ContextResponse candidate, RequestPlan plan, String requestId) {
        if (candidate.context().tokenCount() <= plan.effectiveBudget()) {
            return true;
        }
        log.debug("[{}] Ignoring cached response of {} tokens; budget is {}",
                requestId, candidate.context().tokenCount(), plan.effectiveBudget());
        return false;
    }

    private Optional<ContextResponse> awaitShared(CompletableFuture<ContextResponse> sharedFlight, Duration timeout) {
        try {
            return Optional.of(sharedFlight.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException | TimeoutException sharedFailure) {
            log.debug("In-flight aggregation unusable ({}); aggregating independently",
                    sharedFailure.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    private String nextRequestId() {
        return REQUEST_ID_PREFIX + clock.millis() + "-" + requestSequence.incrementAndGet();
    }

    private long elapsedSince(long startMillis) {
        return Math.max(0, clock.millis() - startMillis);
    }

    private long elapsedSince(Instant start) {
        return Math.max(0, Duration.between(start, clock.instant()).toMillis());
    }

    private static void stage(String requestId, AggregationStage stage) {
        log.debug("[{}] {}", requestId, stage);
    }
}
