package com.williamcallahan.contextaggregator.service.source;

import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.SourceSettings;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.SourceQuery;
import com.williamcallahan.contextaggregator.domain.context.SourceResult;

/**
 * Uniform retrieval contract every backend adapter satisfies.
 *
 * <p>{@link #retrieve(SourceQuery)} never throws: backend, protocol and timeout failures come back as
 * a {@link SourceResult} with an error and no chunks. Retries happen inside the adapter.</p>
 */
public interface ContextSource {

    /**
     * Identifies which backend this adapter wraps.
     *
     * @return source type
     */
    ContextSourceType type();

    /**
     * Applies default settings, used by availability checks and by queries that carry none. Called on
     * registration and again on reconfiguration; queries built by the aggregator carry their own.
     *
     * @param settings timeout, chunk cap and retry policy
     */
    void initialize(SourceSettings settings);

    /**
     * Reports whether the adapter is initialized, enabled and has a configured backend.
     *
     * @return availability
     */
    boolean isAvailable();

    /**
     * Retrieves chunks for a query before its deadline.
     *
     * @param query per-source query
     * @return chunks or an error, never null
     */
    SourceResult retrieve(SourceQuery query);

    /**
     * Releases resources; the adapter is unavailable afterwards.
     */
    void dispose();
}
