package com.williamcallahan.contextaggregator.web;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.contextaggregator.domain.context.AssembledContext;
import com.williamcallahan.contextaggregator.domain.context.CacheProvider;
import com.williamcallahan.contextaggregator.domain.context.CacheStats;
import com.williamcallahan.contextaggregator.domain.context.ChunkMetadata;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.ContextFormat;
import com.williamcallahan.contextaggregator.domain.context.ContextMetrics;
import com.williamcallahan.contextaggregator.domain.context.ContextRequest;
import com.williamcallahan.contextaggregator.domain.context.ContextResponse;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.HealthStatus;
import com.williamcallahan.contextaggregator.domain.context.HealthStatus.CacheHealth;
import com.williamcallahan.contextaggregator.domain.context.HealthStatus.SourceHealth;
import com.williamcallahan.contextaggregator.domain.errors.ContextConfigurationException;
import com.williamcallahan.contextaggregator.service.ContextAggregatorService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import reactor.core.publisher.Flux;

/**
 * Verifies the context endpoints map requests, responses and failures onto HTTP.
 */
@WebMvcTest(controllers = ContextController.class)
@Import(ExceptionResponseBuilder.class)
class ContextControllerTest {
    private static final String VALID_REQUEST =
            "{\"query\":\"how is auth wired\",\"taskType\":\"analysis\",\"maxTokens\":4000}";

    @Autowired
    MockMvc mvc;

    @MockitoBean
    ContextAggregatorService aggregatorService;

    @Test
    void postReturnsAggregatedContext() throws Exception {
        ContextChunk chunk = ContextChunk.of(
                "vec-1", "class AuthFilter {}", ContextSourceType.VECTOR_DB, 0.9, ChunkMetadata.empty());
        ContextResponse response = new ContextResponse(
                "ctx-1-1",
                new AssembledContext("class AuthFilter {}", List.of(chunk), 5, ContextFormat.XML),
                List.of(),
                new ContextMetrics(12, 5, 0.0015, 0.0, 0.0, 1, 1, false, true));
        when(aggregatorService.getContext(any(ContextRequest.class))).thenReturn(response);

        mvc.perform(post("/api/context").contentType(MediaType.APPLICATION_JSON).content(VALID_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requestId").value("ctx-1-1"))
                .andExpect(jsonPath("$.context.tokenCount").value(5))
                .andExpect(jsonPath("$.context.chunks[0].source").value("vector_db"))
                .andExpect(jsonPath("$.metrics.budgetWarning").value(true));
    }

    @Test
    void invalidRequestMapsToBadRequest() throws Exception {
        when(aggregatorService.getContext(any(ContextRequest.class)))
                .thenThrow(new ContextConfigurationException("query must not be blank"));

        mvc.perform(post("/api/context").contentType(MediaType.APPLICATION_JSON).content(VALID_REQUEST))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("query must not be blank"));
    }

    @Test
    void malformedBodyMapsToBadRequest() throws Exception {
        mvc.perform(post("/api/context").contentType(MediaType.APPLICATION_JSON).content("{\"query\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed context request"));
    }

    @Test
    void unexpectedFailureMapsToServerError() throws Exception {
        when(aggregatorService.getContext(any(ContextRequest.class))).thenThrow(new IllegalStateException("boom"));

        mvc.perform(post("/api/context").contentType(MediaType.APPLICATION_JSON).content(VALID_REQUEST))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Failed to aggregate context: boom"));
    }

    @Test
    void streamEmitsChunkEvents() throws Exception {
        ContextChunk chunk = ContextChunk.of(
                "rag-7", "Auth docs", ContextSourceType.RAG, 0.8, ChunkMetadata.empty());
        when(aggregatorService.streamContext(any(ContextRequest.class))).thenReturn(Flux.just(chunk));

        MvcResult pending = mvc.perform(post("/api/context/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .content(VALID_REQUEST))
                .andExpect(request().asyncStarted())
                .andExpect(header().string("X-Accel-Buffering", "no"))
                .andReturn();

        mvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("event:chunk")))
                .andExpect(content().string(containsString("\"id\":\"rag-7\"")));
    }

    @Test
    void streamFailureEmitsErrorEvent() throws Exception {
        when(aggregatorService.streamContext(any(ContextRequest.class)))
                .thenReturn(Flux.error(new ContextConfigurationException("maxTokens must be greater than 0")));

        MvcResult pending = mvc.perform(post("/api/context/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .content(VALID_REQUEST))
                .andExpect(request().asyncStarted())
                .andReturn();

        mvc.perform(asyncDispatch(pending))
                .andExpect(content().string(containsString("event:error")))
                .andExpect(content().string(containsString("maxTokens must be greater than 0")));
    }

    @Test
    void cacheInvalidationReportsRemovedCount() throws Exception {
        when(aggregatorService.invalidateCache("ctx:*")).thenReturn(3L);

        mvc.perform(delete("/api/context/cache").param("pattern", "ctx:*"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.message").value("Removed 3 cached responses"));
    }

    @Test
    void cacheInvalidationWithoutPatternClearsEverything() throws Exception {
        when(aggregatorService.invalidateCache(null)).thenReturn(0L);

        mvc.perform(delete("/api/context/cache")).andExpect(status().isOk());

        verify(aggregatorService).invalidateCache(isNull());
    }

    @Test
    void cacheStatsAreExposed() throws Exception {
        when(aggregatorService.getCacheStats()).thenReturn(CacheStats.of(3, 1, 2, 100));

        mvc.perform(get("/api/context/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hits").value(3))
                .andExpect(jsonPath("$.hitRate").value(0.75));
    }

    @Test
    void healthIsAlwaysOkAndCarriesSourceState() throws Exception {
        when(aggregatorService.healthCheck()).thenReturn(HealthStatus.of(
                Map.of(ContextSourceType.MCP, new SourceHealth(false, null, "timeout")),
                new CacheHealth(true, CacheProvider.MEMORY)));

        mvc.perform(get("/api/context/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.healthy").value(false))
                .andExpect(jsonPath("$.sources.mcp.error").value("timeout"))
                .andExpect(jsonPath("$.cache.provider").value("memory"));
    }
}
