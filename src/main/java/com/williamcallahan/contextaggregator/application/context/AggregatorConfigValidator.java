package com.williamcallahan.contextaggregator.application.context;

import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.SourceSettings;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.TaskRouting;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.TaskType;
import com.williamcallahan.contextaggregator.domain.errors.ContextConfigurationException;
import java.util.Locale;
import java.util.Map;

/**
 * Rejects configuration snapshots that would break budget or timing invariants.
 */
public final class AggregatorConfigValidator {
    private static final String POSITIVE_FMT = "%s must be greater than 0 (got %s).";
    private static final String NON_NEG_FMT = "%s must be 0 or greater (got %s).";
    private static final String RANGE_FMT = "%s must be between %s and %s (got %s).";

    private AggregatorConfigValidator() {}

    /**
     * Validates a snapshot.
     *
     * @param config snapshot to check
     * @return the same snapshot
     * @throws ContextConfigurationException naming the first offending setting
     */
    public static AggregatorConfig validate(AggregatorConfig config) {
        for (Map.Entry<ContextSourceType, SourceSettings> entry : config.sources().entrySet()) {
            String prefix = "sources." + entry.getKey().wireId();
            SourceSettings settings = entry.getValue();
            requirePositive(prefix + ".timeoutMs", settings.timeoutMs());
            requirePositive(prefix + ".maxChunks", settings.maxChunks());
            requireNonNegative(prefix + ".retryAttempts", settings.retryAttempts());
            requireNonNegative(prefix + ".retryBackoffMs", settings.retryBackoffMs());
        }

        AggregatorConfig.BudgetSettings budget = config.budget();
        requirePositive("budget.defaultMaxTokens", budget.defaultMaxTokens());
        requireNonNegative("budget.reservedTokens", budget.reservedTokens());
        requireNonNegative("budget.minChunkTokens", budget.minChunkTokens());
        requirePositive("budget.maxChunkTokens", budget.maxChunkTokens());
        requireRange("budget.warningThreshold", budget.warningThreshold(), 0.0, 1.0);
        if (budget.reservedTokens() >= budget.defaultMaxTokens()) {
            throw new ContextConfigurationException(String.format(Locale.ROOT,
                    "budget.reservedTokens must be less than budget.defaultMaxTokens (got %d >= %d).",
                    budget.reservedTokens(), budget.defaultMaxTokens()));
        }

        requireRange("deduplication.similarityThreshold", config.deduplication().similarityThreshold(), 0.0, 1.0);
        requirePositive("cache.ttlSeconds", config.caching().ttlSeconds());
        requirePositive("cache.maxEntries", config.caching().maxEntries());
        requireRange("ranking.mmrLambda", config.ranking().mmrLambda(), 0.0, 1.0);
        requirePositive("aggregation.requestTimeoutMs", config.aggregation().requestTimeoutMs());
        requirePositive("aggregation.maxMergedChunks", config.aggregation().maxMergedChunks());

        for (Map.Entry<TaskType, TaskRouting> entry : config.taskRouting().entrySet()) {
            for (Map.Entry<ContextSourceType, Integer> weight : entry.getValue().priorities().entrySet()) {
                requireNonNegative(
                        "taskRouting." + entry.getKey().wireId() + ".priorities." + weight.getKey().wireId(),
                        weight.getValue());
            }
        }
        return config;
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new ContextConfigurationException(String.format(Locale.ROOT, POSITIVE_FMT, key, value));
        }
    }

    private static void requireNonNegative(String key, long value) {
        if (value < 0) {
            throw new ContextConfigurationException(String.format(Locale.ROOT, NON_NEG_FMT, key, value));
        }
    }

    private static void requireRange(String key, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new ContextConfigurationException(String.format(Locale.ROOT, RANGE_FMT, key, min, max, value));
        }
    }
}
