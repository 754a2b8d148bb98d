package com.williamcallahan.contextaggregator.support;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Classifies source failures into stable labels and decides which ones are worth retrying.
 */
public final class SourceErrorClassifier {

    public static final String TIMEOUT = "Timeout";
    public static final String CANCELLED = "Cancelled";
    public static final String CONNECTION_ERROR = "Connection Error";
    public static final String RATE_LIMITED = "429 Rate Limited";
    public static final String SERVICE_UNAVAILABLE = "503 Service Unavailable";
    public static final String NOT_FOUND = "404 Not Found";
    public static final String UNAUTHORIZED = "401 Unauthorized";
    public static final String FORBIDDEN = "403 Forbidden";
    public static final String SERVER_ERROR = "5xx Server Error";
    public static final String UNKNOWN = "Unknown Error";

    private static final int MAX_FAILURE_DETAIL_LENGTH = 240;

    private SourceErrorClassifier() {}

    /**
     * Determine a stable error category from exception types, HTTP statuses and messages along the
     * cause chain.
     *
     * @param error failure raised by a backend call
     * @return normalized error category label
     */
    public static String determineErrorType(Throwable error) {
        StringBuilder messageBuilder = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException || current instanceof SocketTimeoutException) {
                return TIMEOUT;
            }
            if (current instanceof CancellationException || current instanceof InterruptedException) {
                return CANCELLED;
            }
            if (current instanceof ConnectException || current instanceof WebClientRequestException) {
                return CONNECTION_ERROR;
            }
            if (current instanceof WebClientResponseException responseException) {
                return fromStatus(responseException.getStatusCode().value());
            }
            String currentMessage = current.getMessage();
            if (currentMessage != null && !currentMessage.isBlank()) {
                if (messageBuilder.length() > 0) {
                    messageBuilder.append(' ');
                }
                messageBuilder.append(currentMessage);
            }
            current = current.getCause();
        }

        String message = messageBuilder.toString().toLowerCase(Locale.ROOT);
        if (message.contains("429") || message.contains("too many requests")) {
            return RATE_LIMITED;
        } else if (message.contains("503") || message.contains("service unavailable")) {
            return SERVICE_UNAVAILABLE;
        } else if (message.contains("timed out") || message.contains("timeout")) {
            return TIMEOUT;
        } else if (message.contains("connection") || message.contains("reset by peer")) {
            return CONNECTION_ERROR;
        } else if (message.contains("404") || message.contains("not found")) {
            return NOT_FOUND;
        } else if (message.contains("401") || message.contains("unauthorized")) {
            return UNAUTHORIZED;
        } else if (message.contains("403") || message.contains("forbidden")) {
            return FORBIDDEN;
        }
        if (hasCause(error, IOException.class)) {
            return CONNECTION_ERROR;
        }
        return UNKNOWN;
    }

    private static String fromStatus(int statusCode) {
        return switch (statusCode) {
            case 429 -> RATE_LIMITED;
            case 503 -> SERVICE_UNAVAILABLE;
            case 404 -> NOT_FOUND;
            case 401 -> UNAUTHORIZED;
            case 403 -> FORBIDDEN;
            default -> statusCode >= 500 ? SERVER_ERROR : "HTTP " + statusCode;
        };
    }

    /**
     * Decides whether a failed backend call may succeed if repeated.
     *
     * <p>Connection resets, timeouts, rate limits and 503 responses are transient. Cancellation, client
     * errors and programming errors are not.</p>
     *
     * @param error the failure to classify
     * @return true when a retry is appropriate
     */
    public static boolean isTransient(Throwable error) {
        String errorType = determineErrorType(error);
        return CONNECTION_ERROR.equals(errorType)
                || TIMEOUT.equals(errorType)
                || RATE_LIMITED.equals(errorType)
                || SERVICE_UNAVAILABLE.equals(errorType);
    }

    /**
     * Builds the contribution error string: category plus a flattened, length-capped message.
     *
     * @param error failure to describe
     * @return description safe to return to callers
     */
    public static String describe(Throwable error) {
        String errorType = determineErrorType(error);
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String details = sanitizeFailureDetails(root.getMessage());
        return details.isEmpty() ? errorType : errorType + ": " + details;
    }

    static String sanitizeFailureDetails(String failureDetails) {
        if (failureDetails == null || failureDetails.isBlank()) {
            return "";
        }
        String flattenedFailure = failureDetails.replace('\n', ' ').replace('\r', ' ').trim();
        if (flattenedFailure.length() <= MAX_FAILURE_DETAIL_LENGTH) {
            return flattenedFailure;
        }
        return flattenedFailure.substring(0, MAX_FAILURE_DETAIL_LENGTH) + "...";
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
