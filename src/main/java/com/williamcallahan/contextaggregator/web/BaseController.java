package com.williamcallahan.contextaggregator.web;

import com.williamcallahan.contextaggregator.domain.errors.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Shared error handling for controllers.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Handles service exceptions with a 500 response.
     *
     * @param e exception that occurred
     * @param operation description of the operation that failed
     * @return error response
     */
    protected ResponseEntity<ApiResponse> handleServiceException(Exception e, String operation) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to " + operation + ": " + e.getMessage(), e);
    }

    /**
     * Handles validation exceptions with a 400 response.
     *
     * @param validationException validation failure
     * @return error response
     */
    protected ResponseEntity<ApiResponse> handleValidationException(IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }

    protected ResponseEntity<ApiResponse> createSuccessResponse(String message) {
        return exceptionBuilder.buildSuccessResponse(message);
    }

    protected String describeException(Exception exception) {
        return exceptionBuilder.describeException(exception);
    }
}
