package com.williamcallahan.contextaggregator.config;

import com.williamcallahan.contextaggregator.application.context.AggregatorConfigValidator;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.AggregationSettings;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.BudgetSettings;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.CacheSettings;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.DeduplicationSettings;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.OptimizationSettings;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.RankingSettings;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.SourceSettings;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.TaskRouting;
import com.williamcallahan.contextaggregator.domain.context.CacheProvider;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.TaskType;
import com.williamcallahan.contextaggregator.domain.context.TokenCounterType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Externalized aggregator settings bound from {@code app.context.*}.
 *
 * <p>Spring binds into these mutable holders; {@link #toAggregatorConfig()} converts them into the
 * immutable snapshot the aggregator reads. Task routing entries override the built-in defaults per
 * task type.</p>
 */
@Component
@ConfigurationProperties(prefix = "app.context")
public class ContextAggregatorProperties {
    private static final String TASK_ROUTING_KEY = "app.context.task-routing";
    private static final String FAN_OUT_KEY = "app.context.aggregation.fan-out-threads";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String UNKNOWN_ID_FMT = "%s has an unknown entry: %s";

    private Sources sources = new Sources();
    private Budget budget = new Budget();
    private Deduplication deduplication = new Deduplication();
    private Cache cache = new Cache();
    private Optimization optimization = new Optimization();
    private Ranking ranking = new Ranking();
    private Aggregation aggregation = new Aggregation();
    private Map<String, TaskRoutingProperties> taskRouting = new LinkedHashMap<>();
    private Backends backends = new Backends();

    /**
     * Validates the bound settings by building a snapshot from them.
     *
     * @throws IllegalArgumentException when any setting is out of range
     */
    public void validateConfiguration() {
        if (aggregation.getFanOutThreads() <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, FAN_OUT_KEY));
        }
        toAggregatorConfig();
    }

    /**
     * Converts the bound settings into a validated immutable snapshot.
     *
     * @return aggregator configuration
     * @throws IllegalArgumentException when any setting is out of range or names an unknown id
     */
    public AggregatorConfig toAggregatorConfig() {
        AggregatorConfig defaults = AggregatorConfig.defaults();

        Map<ContextSourceType, SourceSettings> sourceSettings = new EnumMap<>(ContextSourceType.class);
        sourceSettings.put(ContextSourceType.VECTOR_DB, sources.getVectorDb().toSettings());
        sourceSettings.put(ContextSourceType.RAG, sources.getRag().toSettings());
        sourceSettings.put(ContextSourceType.MCP, sources.getMcp().toSettings());
        sourceSettings.put(ContextSourceType.WEB_SEARCH, sources.getWebSearch().toSettings());
        sourceSettings.put(ContextSourceType.LIVE_API, sources.getLiveApi().toSettings());

        Map<TaskType, TaskRouting> routing = new EnumMap<>(TaskType.class);
        routing.putAll(defaults.taskRouting());
        for (Map.Entry<String, TaskRoutingProperties> entry : taskRouting.entrySet()) {
            TaskType taskType = parseId(TASK_ROUTING_KEY, entry.getKey(), TaskType::fromId);
            TaskRouting fallback = routing.get(taskType);
            routing.put(taskType, entry.getValue().toRouting(taskType, fallback));
        }

        AggregatorConfig config = new AggregatorConfig(
                sourceSettings,
                new BudgetSettings(
                        budget.getDefaultMaxTokens(),
                        budget.getReservedTokens(),
                        budget.getMinChunkTokens(),
                        budget.getMaxChunkTokens(),
                        budget.getTokenCounter(),
                        budget.getWarningThreshold()),
                new DeduplicationSettings(
                        deduplication.isEnabled(),
                        deduplication.getSimilarityThreshold(),
                        deduplication.isUseSemantic(),
                        deduplication.isUseContentHash(),
                        deduplication.isMergeOverlapping()),
                new CacheSettings(cache.isEnabled(), cache.getTtlSeconds(), cache.getMaxEntries(), cache.getProvider()),
                new OptimizationSettings(
                        optimization.isCompressLargeChunks(),
                        optimization.isSummarizeContent(),
                        optimization.isSmartTruncation(),
                        optimization.isPreserveStructure()),
                new RankingSettings(ranking.isDiversify(), ranking.getMmrLambda()),
                new AggregationSettings(aggregation.getRequestTimeoutMs(), aggregation.getMaxMergedChunks()),
                routing);
        return AggregatorConfigValidator.validate(config);
    }

    private static <T> T parseId(String key, String rawId, Function<String, T> parser) {
        try {
            return parser.apply(rawId);
        } catch (IllegalArgumentException unknown) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, UNKNOWN_ID_FMT, key, rawId), unknown);
        }
    }

    public Sources getSources() { return sources; }
    public void setSources(Sources sources) { this.sources = sources; }

    public Budget getBudget() { return budget; }
    public void setBudget(Budget budget) { this.budget = budget; }

    public Deduplication getDeduplication() { return deduplication; }
    public void setDeduplication(Deduplication deduplication) { this.deduplication = deduplication; }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public Optimization getOptimization() { return optimization; }
    public void setOptimization(Optimization optimization) { this.optimization = optimization; }

    public Ranking getRanking() { return ranking; }
    public void setRanking(Ranking ranking) { this.ranking = ranking; }

    public Aggregation getAggregation() { return aggregation; }
    public void setAggregation(Aggregation aggregation) { this.aggregation = aggregation; }

    public Map<String, TaskRoutingProperties> getTaskRouting() { return taskRouting; }
    public void setTaskRouting(Map<String, TaskRoutingProperties> taskRouting) { this.taskRouting = taskRouting; }

    public Backends getBackends() { return backends; }
    public void setBackends(Backends backends) { this.backends = backends; }

    /**
     * Per-source adapter settings.
     */
    public static class Sources {
        private Source vectorDb = new Source(true, 2000, 20, 2);
        private Source rag = new Source(true, 3000, 15, 2);
        private Source mcp = new Source(true, 5000, 10, 1);
        private Source webSearch = new Source(true, 5000, 5, 1);
        private Source liveApi = new Source(false, 10000, 5, 0);

        public Source getVectorDb() { return vectorDb; }
        public void setVectorDb(Source vectorDb) { this.vectorDb = vectorDb; }

        public Source getRag() { return rag; }
        public void setRag(Source rag) { this.rag = rag; }

        public Source getMcp() { return mcp; }
        public void setMcp(Source mcp) { this.mcp = mcp; }

        public Source getWebSearch() { return webSearch; }
        public void setWebSearch(Source webSearch) { this.webSearch = webSearch; }

        public Source getLiveApi() { return liveApi; }
        public void setLiveApi(Source liveApi) { this.liveApi = liveApi; }
    }

    public static class Source {
        private boolean enabled;
        private long timeoutMs;
        private int maxChunks;
        private int retryAttempts;
        private long retryBackoffMs = 100;

        public Source() {
            this(true, 5000, 10, 1);
        }

        Source(boolean enabled, long timeoutMs, int maxChunks, int retryAttempts) {
            this.enabled = enabled;
            this.timeoutMs = timeoutMs;
            this.maxChunks = maxChunks;
            this.retryAttempts = retryAttempts;
        }

        SourceSettings toSettings() {
            return new SourceSettings(enabled, timeoutMs, maxChunks, retryAttempts, retryBackoffMs);
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getMaxChunks() { return maxChunks; }
        public void setMaxChunks(int maxChunks) { this.maxChunks = maxChunks; }

        public int getRetryAttempts() { return retryAttempts; }
        public void setRetryAttempts(int retryAttempts) { this.retryAttempts = retryAttempts; }

        public long getRetryBackoffMs() { return retryBackoffMs; }
        public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }
    }

    public static class Budget {
        private int defaultMaxTokens = 8000;
        private int reservedTokens = 1000;
        private int minChunkTokens = 50;
        private int maxChunkTokens = 1000;
        private TokenCounterType tokenCounter = TokenCounterType.CL100K;
        private double warningThreshold = 0.5;

        public int getDefaultMaxTokens() { return defaultMaxTokens; }
        public void setDefaultMaxTokens(int defaultMaxTokens) { this.defaultMaxTokens = defaultMaxTokens; }

        public int getReservedTokens() { return reservedTokens; }
        public void setReservedTokens(int reservedTokens) { this.reservedTokens = reservedTokens; }

        public int getMinChunkTokens() { return minChunkTokens; }
        public void setMinChunkTokens(int minChunkTokens) { this.minChunkTokens = minChunkTokens; }

        public int getMaxChunkTokens() { return maxChunkTokens; }
        public void setMaxChunkTokens(int maxChunkTokens) { this.maxChunkTokens = maxChunkTokens; }

        public TokenCounterType getTokenCounter() { return tokenCounter; }
        public void setTokenCounter(TokenCounterType tokenCounter) { this.tokenCounter = tokenCounter; }

        public double getWarningThreshold() { return warningThreshold; }
        public void setWarningThreshold(double warningThreshold) { this.warningThreshold = warningThreshold; }
    }

    public static class Deduplication {
        private boolean enabled = true;
        private double similarityThreshold = 0.9;
        private boolean useSemantic = true;
        private boolean useContentHash = true;
        private boolean mergeOverlapping = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getSimilarityThreshold() { return similarityThreshold; }
        public void setSimilarityThreshold(double similarityThreshold) { this.similarityThreshold = similarityThreshold; }

        public boolean isUseSemantic() { return useSemantic; }
        public void setUseSemantic(boolean useSemantic) { this.useSemantic = useSemantic; }

        public boolean isUseContentHash() { return useContentHash; }
        public void setUseContentHash(boolean useContentHash) { this.useContentHash = useContentHash; }

        public boolean isMergeOverlapping() { return mergeOverlapping; }
        public void setMergeOverlapping(boolean mergeOverlapping) { this.mergeOverlapping = mergeOverlapping; }
    }

    public static class Cache {
        private boolean enabled = true;
        private long ttlSeconds = 300;
        private int maxEntries = 1000;
        private CacheProvider provider = CacheProvider.MEMORY;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        public CacheProvider getProvider() { return provider; }
        public void setProvider(CacheProvider provider) { this.provider = provider; }
    }

    public static class Optimization {
        private boolean compressLargeChunks = true;
        private boolean summarizeContent = false;
        private boolean smartTruncation = true;
        private boolean preserveStructure = true;

        public boolean isCompressLargeChunks() { return compressLargeChunks; }
        public void setCompressLargeChunks(boolean compressLargeChunks) { this.compressLargeChunks = compressLargeChunks; }

        public boolean isSummarizeContent() { return summarizeContent; }
        public void setSummarizeContent(boolean summarizeContent) { this.summarizeContent = summarizeContent; }

        public boolean isSmartTruncation() { return smartTruncation; }
        public void setSmartTruncation(boolean smartTruncation) { this.smartTruncation = smartTruncation; }

        public boolean isPreserveStructure() { return preserveStructure; }
        public void setPreserveStructure(boolean preserveStructure) { this.preserveStructure = preserveStructure; }
    }

    public static class Ranking {
        private boolean diversify = false;
        private double mmrLambda = 0.7;

        public boolean isDiversify() { return diversify; }
        public void setDiversify(boolean diversify) { this.diversify = diversify; }

        public double getMmrLambda() { return mmrLambda; }
        public void setMmrLambda(double mmrLambda) { this.mmrLambda = mmrLambda; }
    }

    public static class Aggregation {
        private long requestTimeoutMs = 10000;
        private int maxMergedChunks = 200;
        private int fanOutThreads = 8;

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public int getMaxMergedChunks() { return maxMergedChunks; }
        public void setMaxMergedChunks(int maxMergedChunks) { this.maxMergedChunks = maxMergedChunks; }

        public int getFanOutThreads() { return fanOutThreads; }
        public void setFanOutThreads(int fanOutThreads) { this.fanOutThreads = fanOutThreads; }
    }

    /**
     * Override for one task type. Unset parts keep the built-in routing.
     */
    public static class TaskRoutingProperties {
        private List<String> sources = new ArrayList<>();
        private Map<String, Integer> priorities = new LinkedHashMap<>();

        TaskRouting toRouting(TaskType taskType, TaskRouting fallback) {
            String key = TASK_ROUTING_KEY + "." + taskType.wireId();
            List<ContextSourceType> parsedSources = new ArrayList<>();
            for (String rawSource : sources) {
                parsedSources.add(parseId(key + ".sources", rawSource, ContextSourceType::fromId));
            }
            Map<ContextSourceType, Integer> parsedPriorities = new EnumMap<>(ContextSourceType.class);
            for (Map.Entry<String, Integer> entry : priorities.entrySet()) {
                parsedPriorities.put(
                        parseId(key + ".priorities", entry.getKey(), ContextSourceType::fromId), entry.getValue());
            }
            if (fallback != null) {
                if (parsedSources.isEmpty()) {
                    parsedSources.addAll(fallback.sources());
                }
                Map<ContextSourceType, Integer> merged = new EnumMap<>(ContextSourceType.class);
                merged.putAll(fallback.priorities());
                merged.putAll(parsedPriorities);
                parsedPriorities = merged;
            }
            return TaskRouting.of(parsedSources, parsedPriorities);
        }

        public List<String> getSources() { return sources; }
        public void setSources(List<String> sources) { this.sources = sources; }

        public Map<String, Integer> getPriorities() { return priorities; }
        public void setPriorities(Map<String, Integer> priorities) { this.priorities = priorities; }
    }

    /**
     * Connection settings for the concrete backends behind each adapter.
     */
    public static class Backends {
        private VectorStoreBackend vectorStore = new VectorStoreBackend();
        private HttpBackend rag = new HttpBackend("", "/query");
        private McpBackend mcp = new McpBackend();
        private WebSearchBackend webSearch = new WebSearchBackend();
        private RedisBackend redis = new RedisBackend();

        public VectorStoreBackend getVectorStore() { return vectorStore; }
        public void setVectorStore(VectorStoreBackend vectorStore) { this.vectorStore = vectorStore; }

        public HttpBackend getRag() { return rag; }
        public void setRag(HttpBackend rag) { this.rag = rag; }

        public McpBackend getMcp() { return mcp; }
        public void setMcp(McpBackend mcp) { this.mcp = mcp; }

        public WebSearchBackend getWebSearch() { return webSearch; }
        public void setWebSearch(WebSearchBackend webSearch) { this.webSearch = webSearch; }

        public RedisBackend getRedis() { return redis; }
        public void setRedis(RedisBackend redis) { this.redis = redis; }
    }

    public static class VectorStoreBackend {
        private double similarityThreshold = 0.0;
        private boolean filterByLanguage = true;

        public double getSimilarityThreshold() { return similarityThreshold; }
        public void setSimilarityThreshold(double similarityThreshold) { this.similarityThreshold = similarityThreshold; }

        public boolean isFilterByLanguage() { return filterByLanguage; }
        public void setFilterByLanguage(boolean filterByLanguage) { this.filterByLanguage = filterByLanguage; }
    }

    public static class HttpBackend {
        private String baseUrl;
        private String path;
        private String apiKey = "";

        public HttpBackend() {
            this("", "/");
        }

        HttpBackend(String baseUrl, String path) {
            this.baseUrl = baseUrl;
            this.path = path;
        }

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank();
        }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }

    public static class McpBackend extends HttpBackend {
        private String toolName = "search_context";

        public McpBackend() {
            super("", "/mcp");
        }

        public String getToolName() { return toolName; }
        public void setToolName(String toolName) { this.toolName = toolName; }
    }

    public static class WebSearchBackend extends HttpBackend {
        public WebSearchBackend() {
            super("https://api.search.brave.com", "/res/v1/web/search");
        }

        /**
         * Brave requires a subscription token, so a base URL alone is not enough.
         */
        @Override
        public boolean isConfigured() {
            return super.isConfigured() && getApiKey() != null && !getApiKey().isBlank();
        }
    }

    public static class RedisBackend {
        private String url = "redis://localhost:6379";
        private String keyPrefix = "context-aggregator:";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }
    }
}
