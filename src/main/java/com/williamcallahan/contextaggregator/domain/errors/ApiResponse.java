package com.williamcallahan.contextaggregator.domain.errors;

/**
 * Status envelope shared by the cache and administration endpoints.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse {

    /**
     * Returns the status indicator, {@code "success"} or {@code "error"}.
     *
     * @return response status
     */
    String status();
}
