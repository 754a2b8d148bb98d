package com.williamcallahan.contextaggregator.domain.context;

import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.SourceSettings;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Query handed to one source adapter, derived from the request and that source's allocation.
 *
 * @param text query text
 * @param taskType task type of the originating request
 * @param maxChunks chunk ceiling for this source
 * @param maxTokens token allocation for this source
 * @param maxChunkTokens advisory ceiling for a single chunk
 * @param filters optional narrowing
 * @param deadline instant after which the source result is discarded
 * @param settings source settings from the request's configuration snapshot, or null to use the
 *     adapter's initialized settings
 */
public record SourceQuery(
        String text,
        TaskType taskType,
        int maxChunks,
        int maxTokens,
        int maxChunkTokens,
        SourceFilters filters,
        Instant deadline,
        SourceSettings settings) {

    public SourceQuery {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(deadline, "deadline");
        filters = filters == null ? SourceFilters.none() : filters;
        if (maxChunks < 0 || maxTokens < 0 || maxChunkTokens < 0) {
            throw new IllegalArgumentException("Source query limits must not be negative");
        }
    }

    /**
     * Creates a query that runs with the adapter's initialized settings.
     */
    public SourceQuery(
            String text,
            TaskType taskType,
            int maxChunks,
            int maxTokens,
            int maxChunkTokens,
            SourceFilters filters,
            Instant deadline) {
        this(text, taskType, maxChunks, maxTokens, maxChunkTokens, filters, deadline, null);
    }

    /**
     * Returns the time left before the deadline, never negative.
     *
     * @param now current instant
     * @return remaining time
     */
    public Duration remaining(Instant now) {
        Duration remaining = Duration.between(now, deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
