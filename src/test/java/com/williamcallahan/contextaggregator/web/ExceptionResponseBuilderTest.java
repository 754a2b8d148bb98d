package com.williamcallahan.contextaggregator.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.contextaggregator.domain.errors.ApiErrorResponse;
import com.williamcallahan.contextaggregator.domain.errors.ApiResponse;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Verifies exception descriptions include upstream HTTP details when available.
 */
class ExceptionResponseBuilderTest {
    private static final String RESPONSE_BODY_PROBLEM = "problem";

    @Test
    void describeException_includesHttpStatusAndBody() {
        WebClientResponseException exception = WebClientResponseException.create(
                HttpStatus.BAD_REQUEST.value(),
                "Bad Request",
                new HttpHeaders(),
                RESPONSE_BODY_PROBLEM.getBytes(StandardCharsets.UTF_8),
                StandardCharsets.UTF_8);

        String details = new ExceptionResponseBuilder().describeException(exception);

        assertTrue(details.startsWith("WebClientResponseException: "), details);
        assertTrue(details.contains("[HTTP 400]"), details);
        assertTrue(details.endsWith(RESPONSE_BODY_PROBLEM), details);
    }

    @Test
    void describeException_truncatesLongBodies() {
        String body = "x".repeat(500);
        WebClientResponseException exception = WebClientResponseException.create(
                HttpStatus.BAD_GATEWAY.value(),
                "Bad Gateway",
                new HttpHeaders(),
                body.getBytes(StandardCharsets.UTF_8),
                StandardCharsets.UTF_8);

        String details = new ExceptionResponseBuilder().describeException(exception);

        assertTrue(details.endsWith("x".repeat(200) + "..."), details);
        assertTrue(!details.contains("x".repeat(201)), details);
    }

    @Test
    void describeException_handlesPlainAndMissingExceptions() {
        ExceptionResponseBuilder builder = new ExceptionResponseBuilder();

        assertEquals("IllegalStateException: closed", builder.describeException(new IllegalStateException("closed")));
        assertNull(builder.describeException(null));
    }

    @Test
    void buildErrorResponse_carriesStatusAndDetails() {
        ResponseEntity<ApiResponse> response = new ExceptionResponseBuilder()
                .buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed context request", new IllegalArgumentException("eof"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        ApiErrorResponse body = assertInstanceOf(ApiErrorResponse.class, response.getBody());
        assertEquals("error", body.status());
        assertEquals("IllegalArgumentException: eof", body.details());
    }
}
