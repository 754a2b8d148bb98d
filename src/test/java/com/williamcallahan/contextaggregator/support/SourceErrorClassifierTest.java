package com.williamcallahan.contextaggregator.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Verifies failure categories and which of them are retried.
 */
class SourceErrorClassifierTest {

    @Test
    void classifiesByExceptionTypeAlongCauseChain() {
        assertEquals(SourceErrorClassifier.TIMEOUT,
                SourceErrorClassifier.determineErrorType(new IllegalStateException("wrapped", new TimeoutException())));
        assertEquals(SourceErrorClassifier.CONNECTION_ERROR,
                SourceErrorClassifier.determineErrorType(new RuntimeException(new ConnectException("refused"))));
        assertEquals(SourceErrorClassifier.CANCELLED,
                SourceErrorClassifier.determineErrorType(new CancellationException()));
    }

    @Test
    void classifiesByHttpStatus() {
        assertEquals(SourceErrorClassifier.RATE_LIMITED, SourceErrorClassifier.determineErrorType(response(429)));
        assertEquals(SourceErrorClassifier.NOT_FOUND, SourceErrorClassifier.determineErrorType(response(404)));
        assertEquals(SourceErrorClassifier.SERVER_ERROR, SourceErrorClassifier.determineErrorType(response(502)));
        assertEquals("HTTP 400", SourceErrorClassifier.determineErrorType(response(400)));
    }

    @Test
    void classifiesByMessageWhenTypeIsGeneric() {
        assertEquals(SourceErrorClassifier.SERVICE_UNAVAILABLE,
                SourceErrorClassifier.determineErrorType(new RuntimeException("503 Service Unavailable")));
        assertEquals(SourceErrorClassifier.CONNECTION_ERROR,
                SourceErrorClassifier.determineErrorType(new RuntimeException("Connection reset by peer")));
        assertEquals(SourceErrorClassifier.UNKNOWN,
                SourceErrorClassifier.determineErrorType(new IllegalArgumentException("bad input")));
    }

    @Test
    void retriesOnlyTransientFailures() {
        assertTrue(SourceErrorClassifier.isTransient(response(503)));
        assertTrue(SourceErrorClassifier.isTransient(new TimeoutException("slow")));
        assertFalse(SourceErrorClassifier.isTransient(response(401)));
        assertFalse(SourceErrorClassifier.isTransient(new CancellationException()));
        assertFalse(SourceErrorClassifier.isTransient(new NullPointerException()));
    }

    @Test
    void describeFlattensAndCapsRootMessage() {
        String longMessage = "line one\nline two " + "x".repeat(400);

        String description = SourceErrorClassifier.describe(new RuntimeException("outer", new RuntimeException(longMessage)));

        assertTrue(description.startsWith(SourceErrorClassifier.UNKNOWN + ": line one line two"));
        assertTrue(description.endsWith("..."));
        assertFalse(description.contains("\n"));
    }

    private static WebClientResponseException response(int status) {
        return WebClientResponseException.create(
                status, "status " + status, new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);
    }
}
