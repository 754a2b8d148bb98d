package com.williamcallahan.contextaggregator.service.source;

import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.SourceSettings;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.SourceQuery;
import com.williamcallahan.contextaggregator.domain.context.SourceResult;
import com.williamcallahan.contextaggregator.support.RetrySupport;
import com.williamcallahan.contextaggregator.support.SourceErrorClassifier;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared adapter policy: availability, deadline race, bounded retries, chunk cap and conversion of every
 * failure into an error result.
 *
 * <p>Subclasses implement {@link #fetch(SourceQuery)} and only translate between the backend protocol
 * and {@link ContextChunk}s. The fetch runs on an adapter-owned thread so it can be interrupted when
 * the deadline passes or the caller is cancelled.</p>
 */
public abstract class AbstractContextSource implements ContextSource {
    private static final Logger log = LoggerFactory.getLogger(AbstractContextSource.class);

    private final ContextSourceType sourceType;
    private final Clock clock;
    private final ExecutorService fetchExecutor;
    private volatile SourceSettings settings;
    private volatile boolean disposed;

    protected AbstractContextSource(ContextSourceType sourceType, Clock clock) {
        this.sourceType = Objects.requireNonNull(sourceType, "sourceType");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.fetchExecutor = Executors.newCachedThreadPool(fetchThreadFactory(sourceType));
    }

    /**
     * Performs one backend call. May throw; the caller classifies, retries and converts failures.
     *
     * @param query per-source query
     * @return fetched chunks
     */
    protected abstract SourceFetch fetch(SourceQuery query);

    /**
     * Reports whether the backend collaborator is configured. Checked on every availability check.
     *
     * @return true when the backend can be called
     */
    protected boolean isBackendConfigured() {
        return true;
    }

    @Override
    public final ContextSourceType type() {
        return sourceType;
    }

    @Override
    public void initialize(SourceSettings sourceSettings) {
        this.settings = Objects.requireNonNull(sourceSettings, "sourceSettings");
        log.info("Initialized {} source (enabled={}, timeoutMs={}, maxChunks={}, retryAttempts={})",
                sourceType, sourceSettings.enabled(), sourceSettings.timeoutMs(),
                sourceSettings.maxChunks(), sourceSettings.retryAttempts());
    }

    @Override
    public boolean isAvailable() {
        return isAvailable(settings);
    }

    /**
     * Runs one retrieval. Settings carried on the query win over the initialized ones, so a request
     * keeps the enablement and retry policy of the snapshot it started with.
     */
    @Override
    public final SourceResult retrieve(SourceQuery query) {
        long startMillis = clock.millis();
        SourceSettings current = query.settings() != null ? query.settings() : settings;
        if (!isAvailable(current)) {
            return SourceResult.failure(sourceType + " source is not available", 0);
        }

        Duration remaining = query.remaining(clock.instant());
        if (remaining.isZero()) {
            return SourceResult.failure(SourceErrorClassifier.TIMEOUT + ": deadline passed before the call started", 0);
        }

        Future<SourceFetch> pending;
        try {
            pending = fetchExecutor.submit(() -> RetrySupport.executeWithRetry(
                    () -> fetch(query),
                    sourceType + " retrieval",
                    current.retryAttempts() + 1,
                    Duration.ofMillis(current.retryBackoffMs()),
                    query.deadline(),
                    clock));
        } catch (RejectedExecutionException rejected) {
            return SourceResult.failure(sourceType + " source is shut down", elapsedSince(startMillis));
        }

        try {
            SourceFetch fetched = pending.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
            List<ContextChunk> capped = cap(fetched.chunks(), query.maxChunks());
            return SourceResult.success(capped, elapsedSince(startMillis), fetched.cacheHit());
        } catch (TimeoutException timeout) {
            pending.cancel(true);
            log.warn("[{}] Retrieval timed out after {}ms", sourceType, remaining.toMillis());
            return SourceResult.failure(
                    SourceErrorClassifier.TIMEOUT + ": exceeded " + remaining.toMillis() + "ms", elapsedSince(startMillis));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            log.warn("[{}] Retrieval cancelled", sourceType);
            return SourceResult.failure(SourceErrorClassifier.CANCELLED + ": retrieval was cancelled", elapsedSince(startMillis));
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause() == null ? executionException : executionException.getCause();
            String description = SourceErrorClassifier.describe(cause);
            log.warn("[{}] Retrieval failed (exceptionType={}): {}",
                    sourceType, cause.getClass().getSimpleName(), description);
            return SourceResult.failure(description, elapsedSince(startMillis));
        }
    }

    @Override
    public void dispose() {
        disposed = true;
        fetchExecutor.shutdownNow();
        log.info("Disposed {} source", sourceType);
    }

    protected Clock clock() {
        return clock;
    }

    private boolean isAvailable(SourceSettings candidate) {
        return !disposed && candidate != null && candidate.enabled() && isBackendConfigured();
    }

    private long elapsedSince(long startMillis) {
        return Math.max(0, clock.millis() - startMillis);
    }

    private static List<ContextChunk> cap(List<ContextChunk> chunks, int maxChunks) {
        if (chunks.size() <= maxChunks) {
            return chunks;
        }
        return List.copyOf(chunks.subList(0, maxChunks));
    }

    private static ThreadFactory fetchThreadFactory(ContextSourceType sourceType) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ctx-source-" + sourceType.wireId() + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Chunks returned by one backend call.
     *
     * @param chunks translated chunks
     * @param cacheHit whether the backend reported serving from its own cache
     */
    protected record SourceFetch(List<ContextChunk> chunks, boolean cacheHit) {

        public SourceFetch {
            chunks = chunks == null ? List.of() : List.copyOf(chunks);
        }

        public static SourceFetch of(List<ContextChunk> chunks) {
            return new SourceFetch(chunks, false);
        }
    }
}
