package com.williamcallahan.contextaggregator.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry with exponential backoff for transient source failures.
 *
 * <p>Only failures that {@link SourceErrorClassifier#isTransient(Throwable)} accepts are retried, and
 * no backoff sleep is started that would end past the caller's deadline.</p>
 */
public final class RetrySupport {

    private static final Logger log = LoggerFactory.getLogger(RetrySupport.class);

    /** Backoff multiplier between attempts. */
    public static final double DEFAULT_MULTIPLIER = 2.0;
    /** Maximum backoff duration to prevent excessive waits. */
    public static final Duration MAX_BACKOFF = Duration.ofSeconds(5);

    private RetrySupport() {}

    /**
     * Executes a supplier, retrying transient failures.
     *
     * @param operation the operation to execute
     * @param operationName name for logging purposes
     * @param maxAttempts total attempts, at least 1
     * @param initialBackoff backoff before the second attempt
     * @param deadline instant after which no further attempt starts
     * @param clock clock used to check the deadline
     * @param <T> return type
     * @return the result of the operation
     * @throws RuntimeException the last failure once retries are exhausted or a non-transient error occurs
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation,
            String operationName,
            int maxAttempts,
            Duration initialBackoff,
            Instant deadline,
            Clock clock) {

        int attempts = Math.max(1, maxAttempts);
        RuntimeException lastException = null;
        Duration currentBackoff = initialBackoff;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException exception) {
                lastException = exception;

                if (!SourceErrorClassifier.isTransient(exception)) {
                    log.warn("{} failed with non-transient error on attempt {}/{}, not retrying",
                            operationName, attempt, attempts);
                    throw exception;
                }
                if (attempt == attempts) {
                    log.warn("{} failed after {} attempts, giving up", operationName, attempts);
                    break;
                }
                if (!clock.instant().plus(currentBackoff).isBefore(deadline)) {
                    log.warn("{} failed on attempt {}/{} with no time left before the deadline",
                            operationName, attempt, attempts);
                    break;
                }

                log.info("{} failed with transient error on attempt {}/{}, retrying in {}ms",
                        operationName, attempt, attempts, currentBackoff.toMillis());
                try {
                    Thread.sleep(currentBackoff.toMillis());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Retry interrupted", interrupted);
                }

                long nextBackoffMillis = (long) (currentBackoff.toMillis() * DEFAULT_MULTIPLIER);
                currentBackoff = Duration.ofMillis(Math.min(nextBackoffMillis, MAX_BACKOFF.toMillis()));
            }
        }

        throw lastException;
    }
}
