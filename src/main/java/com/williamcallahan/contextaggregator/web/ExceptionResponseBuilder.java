package com.williamcallahan.contextaggregator.web;

import com.williamcallahan.contextaggregator.domain.errors.ApiErrorResponse;
import com.williamcallahan.contextaggregator.domain.errors.ApiResponse;
import com.williamcallahan.contextaggregator.domain.errors.ApiSuccessResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Builds the error and success envelopes every controller returns.
 */
@Component
public class ExceptionResponseBuilder {
    private static final int MAX_BODY_PREVIEW = 200;

    /**
     * Builds an error response with a status and message.
     *
     * @param status HTTP status
     * @param message error message
     * @return error response
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds an error response that carries the exception description as details.
     *
     * @param status HTTP status
     * @param message error message
     * @param exception cause
     * @return error response
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    /**
     * Describes an exception, including the upstream status and a body preview for HTTP client failures.
     *
     * @param exception exception to describe, may be null
     * @return description or null
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        String description = exception.getClass().getSimpleName() + ": " + exception.getMessage();
        if (exception instanceof WebClientResponseException responseException) {
            String body = responseException.getResponseBodyAsString();
            String preview = body.length() > MAX_BODY_PREVIEW ? body.substring(0, MAX_BODY_PREVIEW) + "..." : body;
            description += " [HTTP " + responseException.getStatusCode().value() + "]"
                    + (preview.isBlank() ? "" : " " + preview);
        }
        return description;
    }
}
