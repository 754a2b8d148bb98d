package com.williamcallahan.contextaggregator.service.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.contextaggregator.config.ContextAggregatorProperties;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.SourceSettings;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.SourceQuery;
import com.williamcallahan.contextaggregator.domain.context.SourceResult;
import com.williamcallahan.contextaggregator.domain.context.TaskType;
import java.time.Clock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;

/**
 * Verifies the RAG pipeline request shape and mapping of its chunk payload.
 */
class RagPipelineContextSourceTest {
    private static final String RESPONSE = """
            {
              "cacheHit": true,
              "chunks": [
                {"id": "guide-1", "content": "Use records for DTOs.", "relevance": 0.72,
                 "metadata": {"url": "https://docs.example.com/records", "title": "Records"}},
                {"content": "Sealed types restrict inheritance.", "score": 0.4},
                {"id": "blank", "content": "   "}
              ]
            }
            """;

    private final Clock clock = Clock.systemUTC();
    private RagPipelineContextSource source;

    @AfterEach
    void tearDown() {
        if (source != null) {
            source.dispose();
        }
    }

    @Test
    void postsQueryAndMapsChunks() {
        HttpSourceStubs stubs = new HttpSourceStubs(HttpStatus.OK, RESPONSE);
        source = newSource(stubs, "secret");

        SourceResult result = source.retrieve(query());

        assertTrue(result.isSuccess());
        assertTrue(result.cacheHit());
        assertEquals(2, result.chunks().size());
        ContextChunk first = result.chunks().get(0);
        assertEquals("guide-1", first.id());
        assertEquals(0.72, first.relevance(), 1e-9);
        assertEquals("Records", first.metadata().title());
        assertEquals("rag-1", result.chunks().get(1).id());
        assertEquals(0.4, result.chunks().get(1).relevance(), 1e-9);

        ClientRequest request = stubs.requests().get(0);
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("http://rag.internal:9000/query", request.url().toString());
        assertEquals("Bearer secret", request.headers().getFirst("Authorization"));
    }

    @Test
    void responseWithoutChunksArrayIsAnError() {
        source = newSource(new HttpSourceStubs(HttpStatus.OK, "{\"results\": []}"), null);

        SourceResult result = source.retrieve(query());

        assertFalse(result.isSuccess());
        assertTrue(result.error().contains("no chunks array"));
    }

    @Test
    void serverErrorBecomesErrorResult() {
        source = newSource(new HttpSourceStubs(HttpStatus.BAD_REQUEST, "{}"), null);

        SourceResult result = source.retrieve(query());

        assertFalse(result.isSuccess());
        assertTrue(result.error().startsWith("HTTP 400"));
    }

    @Test
    void unavailableWithoutBaseUrl() {
        source = new RagPipelineContextSource(
                new HttpSourceStubs(HttpStatus.OK, RESPONSE).builder(),
                new ObjectMapper(),
                new ContextAggregatorProperties(),
                clock);
        source.initialize(new SourceSettings(true, 2000, 10, 0, 10));

        assertFalse(source.isAvailable());
    }

    private RagPipelineContextSource newSource(HttpSourceStubs stubs, String apiKey) {
        ContextAggregatorProperties properties = new ContextAggregatorProperties();
        properties.getBackends().getRag().setBaseUrl("http://rag.internal:9000");
        properties.getBackends().getRag().setApiKey(apiKey);
        RagPipelineContextSource created =
                new RagPipelineContextSource(stubs.builder(), new ObjectMapper(), properties, clock);
        created.initialize(new SourceSettings(true, 2000, 10, 0, 10));
        return created;
    }

    private SourceQuery query() {
        return new SourceQuery("records vs classes", TaskType.DOCUMENTATION, 10, 1000, 400, null,
                clock.instant().plusSeconds(2));
    }
}
