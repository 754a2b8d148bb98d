package com.williamcallahan.contextaggregator.web;

import com.williamcallahan.contextaggregator.domain.context.CacheStats;
import com.williamcallahan.contextaggregator.domain.context.ContextRequest;
import com.williamcallahan.contextaggregator.domain.context.ContextResponse;
import com.williamcallahan.contextaggregator.domain.context.HealthStatus;
import com.williamcallahan.contextaggregator.domain.errors.ApiErrorResponse;
import com.williamcallahan.contextaggregator.domain.errors.ApiResponse;
import com.williamcallahan.contextaggregator.domain.errors.ContextConfigurationException;
import com.williamcallahan.contextaggregator.service.ContextAggregatorService;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * HTTP surface for context aggregation and cache administration.
 */
@RestController
@RequestMapping("/api/context")
public class ContextController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(ContextController.class);

    /** SSE event type for a ranked chunk. */
    static final String EVENT_CHUNK = "chunk";
    /** SSE event type for a terminal failure. */
    static final String EVENT_ERROR = "error";

    private final ContextAggregatorService aggregatorService;

    public ContextController(ContextAggregatorService aggregatorService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.aggregatorService = aggregatorService;
    }

    /**
     * POST /api/context - aggregates context for a request.
     */
    @PostMapping
    public ContextResponse getContext(@RequestBody ContextRequest request) {
        return aggregatorService.getContext(request);
    }

    /**
     * POST /api/context/stream - streams the included chunks in rank order.
     */
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> streamContext(
            @RequestBody ContextRequest request, HttpServletResponse response) {
        response.addHeader("X-Accel-Buffering", "no");
        response.addHeader(HttpHeaders.CACHE_CONTROL, "no-cache, no-transform");
        return aggregatorService.streamContext(request)
                .map(chunk -> ServerSentEvent.<Object>builder(chunk).id(chunk.id()).event(EVENT_CHUNK).build())
                .onErrorResume(streamFailure -> {
                    log.warn("Context stream failed (exceptionType={})", streamFailure.getClass().getSimpleName());
                    ApiErrorResponse error = streamFailure instanceof ContextConfigurationException
                            ? ApiErrorResponse.error(streamFailure.getMessage())
                            : ApiErrorResponse.error("Context stream failed", streamFailure.getMessage());
                    return Flux.just(ServerSentEvent.<Object>builder(error).event(EVENT_ERROR).build());
                });
    }

    /**
     * DELETE /api/context/cache - removes cached responses, optionally by key pattern.
     */
    @DeleteMapping("/cache")
    public ResponseEntity<ApiResponse> invalidateCache(@RequestParam(required = false) String pattern) {
        long removed = aggregatorService.invalidateCache(pattern);
        return createSuccessResponse("Removed " + removed + " cached responses");
    }

    @GetMapping("/cache/stats")
    public CacheStats getCacheStats() {
        return aggregatorService.getCacheStats();
    }

    @GetMapping("/health")
    public HealthStatus healthCheck() {
        return aggregatorService.healthCheck();
    }

    @ExceptionHandler(ContextConfigurationException.class)
    public ResponseEntity<ApiResponse> handleInvalidRequest(ContextConfigurationException invalidRequest) {
        return handleValidationException(invalidRequest);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse> handleUnreadableRequest(HttpMessageNotReadableException unreadable) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.BAD_REQUEST, "Malformed context request", unreadable);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiResponse> handleUnexpected(RuntimeException unexpected) {
        log.error("Context request failed", unexpected);
        return handleServiceException(unexpected, "aggregate context");
    }
}
