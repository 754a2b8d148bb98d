package com.williamcallahan.contextaggregator.domain.context;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable aggregator configuration snapshot.
 *
 * <p>The aggregator holds one reference to the current snapshot and every request reads it once at
 * start. Reconfiguration swaps the reference; a snapshot is never modified in place.</p>
 *
 * @param sources per-source adapter settings
 * @param budget token budget settings
 * @param deduplication deduplication settings
 * @param caching response cache settings
 * @param optimization assembly optimization flags
 * @param ranking ranking settings
 * @param aggregation request-level settings
 * @param taskRouting per-task-type default sources and priority weights
 */
public record AggregatorConfig(
        Map<ContextSourceType, SourceSettings> sources,
        BudgetSettings budget,
        DeduplicationSettings deduplication,
        CacheSettings caching,
        OptimizationSettings optimization,
        RankingSettings ranking,
        AggregationSettings aggregation,
        Map<TaskType, TaskRouting> taskRouting) {

    public AggregatorConfig {
        Objects.requireNonNull(budget, "budget");
        Objects.requireNonNull(deduplication, "deduplication");
        Objects.requireNonNull(caching, "caching");
        Objects.requireNonNull(optimization, "optimization");
        Objects.requireNonNull(ranking, "ranking");
        Objects.requireNonNull(aggregation, "aggregation");
        sources = immutableEnumMap(sources, ContextSourceType.class);
        taskRouting = immutableEnumMap(taskRouting, TaskType.class);
    }

    /**
     * Returns the settings for a source, falling back to a disabled entry when none is configured.
     *
     * @param sourceType source to look up
     * @return configured settings
     */
    public SourceSettings sourceSettings(ContextSourceType sourceType) {
        SourceSettings settings = sources.get(sourceType);
        return settings == null ? SourceSettings.disabled() : settings;
    }

    /**
     * Returns a copy with a different budget section.
     */
    public AggregatorConfig withBudget(BudgetSettings newBudget) {
        return new AggregatorConfig(
                sources, newBudget, deduplication, caching, optimization, ranking, aggregation, taskRouting);
    }

    /**
     * Returns a copy with a different caching section.
     */
    public AggregatorConfig withCaching(CacheSettings newCaching) {
        return new AggregatorConfig(
                sources, budget, deduplication, newCaching, optimization, ranking, aggregation, taskRouting);
    }

    /**
     * Returns a copy with a different deduplication section.
     */
    public AggregatorConfig withDeduplication(DeduplicationSettings newDeduplication) {
        return new AggregatorConfig(
                sources, budget, newDeduplication, caching, optimization, ranking, aggregation, taskRouting);
    }

    /**
     * Returns a copy with a different aggregation section.
     */
    public AggregatorConfig withAggregation(AggregationSettings newAggregation) {
        return new AggregatorConfig(
                sources, budget, deduplication, caching, optimization, ranking, newAggregation, taskRouting);
    }

    /**
     * Returns a copy with one source's settings replaced.
     */
    public AggregatorConfig withSource(ContextSourceType sourceType, SourceSettings settings) {
        Map<ContextSourceType, SourceSettings> updated = new EnumMap<>(ContextSourceType.class);
        updated.putAll(sources);
        updated.put(sourceType, settings);
        return new AggregatorConfig(
                updated, budget, deduplication, caching, optimization, ranking, aggregation, taskRouting);
    }

    /**
     * Built-in defaults used when no external configuration is supplied.
     *
     * @return default configuration
     */
    public static AggregatorConfig defaults() {
        Map<ContextSourceType, SourceSettings> sourceDefaults = new EnumMap<>(ContextSourceType.class);
        sourceDefaults.put(ContextSourceType.VECTOR_DB, new SourceSettings(true, 2000, 20, 2, 100));
        sourceDefaults.put(ContextSourceType.RAG, new SourceSettings(true, 3000, 15, 2, 100));
        sourceDefaults.put(ContextSourceType.MCP, new SourceSettings(true, 5000, 10, 1, 100));
        sourceDefaults.put(ContextSourceType.WEB_SEARCH, new SourceSettings(true, 5000, 5, 1, 100));
        sourceDefaults.put(ContextSourceType.LIVE_API, new SourceSettings(false, 10000, 5, 0, 100));

        return new AggregatorConfig(
                sourceDefaults,
                new BudgetSettings(8000, 1000, 50, 1000, TokenCounterType.CL100K, 0.5),
                new DeduplicationSettings(true, 0.9, true, true, true),
                new CacheSettings(true, 300, 1000, CacheProvider.MEMORY),
                new OptimizationSettings(true, false, true, true),
                new RankingSettings(false, 0.7),
                new AggregationSettings(10000, 200),
                defaultTaskRouting());
    }

    private static Map<TaskType, TaskRouting> defaultTaskRouting() {
        ContextSourceType vectorDb = ContextSourceType.VECTOR_DB;
        ContextSourceType rag = ContextSourceType.RAG;
        ContextSourceType mcp = ContextSourceType.MCP;
        ContextSourceType webSearch = ContextSourceType.WEB_SEARCH;

        Map<TaskType, TaskRouting> routing = new EnumMap<>(TaskType.class);
        routing.put(TaskType.ANALYSIS, TaskRouting.of(
                List.of(vectorDb, rag), weights(vectorDb, 3, rag, 2, mcp, 1, webSearch, 1)));
        routing.put(TaskType.PLANNING, TaskRouting.of(
                List.of(rag, vectorDb), weights(vectorDb, 2, rag, 3, mcp, 1, webSearch, 1)));
        routing.put(TaskType.IMPLEMENTATION, TaskRouting.of(
                List.of(vectorDb, rag, mcp, webSearch), weights(vectorDb, 4, rag, 3, mcp, 2, webSearch, 1)));
        routing.put(TaskType.REVIEW, TaskRouting.of(
                List.of(vectorDb, rag), weights(vectorDb, 3, rag, 2, mcp, 1, webSearch, 1)));
        routing.put(TaskType.TESTING, TaskRouting.of(
                List.of(vectorDb, rag, mcp), weights(vectorDb, 3, rag, 2, mcp, 2, webSearch, 1)));
        routing.put(TaskType.DOCUMENTATION, TaskRouting.of(
                List.of(rag, webSearch, vectorDb), weights(vectorDb, 2, rag, 3, mcp, 1, webSearch, 4)));
        return routing;
    }

    private static Map<ContextSourceType, Integer> weights(
            ContextSourceType first, int firstWeight,
            ContextSourceType second, int secondWeight,
            ContextSourceType third, int thirdWeight,
            ContextSourceType fourth, int fourthWeight) {
        Map<ContextSourceType, Integer> weights = new EnumMap<>(ContextSourceType.class);
        weights.put(first, firstWeight);
        weights.put(second, secondWeight);
        weights.put(third, thirdWeight);
        weights.put(fourth, fourthWeight);
        return weights;
    }

    private static <K extends Enum<K>, V> Map<K, V> immutableEnumMap(Map<K, V> source, Class<K> keyType) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        EnumMap<K, V> copy = new EnumMap<>(keyType);
        copy.putAll(source);
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Adapter settings for one source.
     *
     * @param enabled whether requests may fan out to the source
     * @param timeoutMs per-call timeout
     * @param maxChunks chunk ceiling per call
     * @param retryAttempts retries after the first attempt for transient failures
     * @param retryBackoffMs initial backoff between attempts
     */
    public record SourceSettings(
            boolean enabled, long timeoutMs, int maxChunks, int retryAttempts, long retryBackoffMs) {

        public static SourceSettings disabled() {
            return new SourceSettings(false, 5000, 10, 0, 100);
        }
    }

    /**
     * Token budget settings.
     *
     * @param defaultMaxTokens budget used when a caller does not supply one
     * @param reservedTokens tokens held back when a request does not specify its own reservation
     * @param minChunkTokens per-source allocation floor and minimum size worth truncating into
     * @param maxChunkTokens advisory single-chunk ceiling passed to backends
     * @param tokenCounter counting strategy
     * @param warningThreshold utilization below which a budget warning is raised
     */
    public record BudgetSettings(
            int defaultMaxTokens,
            int reservedTokens,
            int minChunkTokens,
            int maxChunkTokens,
            TokenCounterType tokenCounter,
            double warningThreshold) {

        public BudgetSettings {
            tokenCounter = tokenCounter == null ? TokenCounterType.CL100K : tokenCounter;
        }
    }

    /**
     * Deduplication settings.
     *
     * @param enabled master switch
     * @param similarityThreshold cosine similarity at or above which two chunks are near-duplicates
     * @param useSemantic run the embedding-based pass
     * @param useContentHash run the fingerprint pass
     * @param mergeOverlapping run the same-file line-overlap pass
     */
    public record DeduplicationSettings(
            boolean enabled,
            double similarityThreshold,
            boolean useSemantic,
            boolean useContentHash,
            boolean mergeOverlapping) {}

    /**
     * Response cache settings.
     *
     * @param enabled master switch
     * @param ttlSeconds entry time-to-live
     * @param maxEntries entry bound for the in-process provider
     * @param provider backing technology
     */
    public record CacheSettings(boolean enabled, long ttlSeconds, int maxEntries, CacheProvider provider) {

        public CacheSettings {
            provider = provider == null ? CacheProvider.MEMORY : provider;
        }
    }

    /**
     * Assembly optimization flags.
     *
     * @param compressLargeChunks default for the request {@code compress} option
     * @param summarizeContent default for the request {@code summarize} option
     * @param smartTruncation cut at line boundaries instead of word boundaries
     * @param preserveStructure append a truncation marker to truncated chunks
     */
    public record OptimizationSettings(
            boolean compressLargeChunks, boolean summarizeContent, boolean smartTruncation, boolean preserveStructure) {}

    /**
     * Ranking settings.
     *
     * @param diversify default for the request {@code diversify} option
     * @param mmrLambda relevance weight in maximal marginal relevance, in [0, 1]
     */
    public record RankingSettings(boolean diversify, double mmrLambda) {}

    /**
     * Request-level settings.
     *
     * @param requestTimeoutMs outer deadline applied when a request sets none
     * @param maxMergedChunks cap on merged chunks entering deduplication
     */
    public record AggregationSettings(long requestTimeoutMs, int maxMergedChunks) {}

    /**
     * Default sources and weights for one task type.
     *
     * @param sources sources queried when the request names none
     * @param priorities budget weights per source
     */
    public record TaskRouting(List<ContextSourceType> sources, Map<ContextSourceType, Integer> priorities) {

        public TaskRouting {
            sources = sources == null ? List.of() : List.copyOf(sources);
            priorities = priorities == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(priorities));
        }

        public static TaskRouting of(List<ContextSourceType> sources, Map<ContextSourceType, Integer> priorities) {
            return new TaskRouting(sources, priorities);
        }
    }
}
