package com.williamcallahan.contextaggregator.service.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.contextaggregator.config.ContextAggregatorProperties;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.SourceSettings;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.SourceQuery;
import com.williamcallahan.contextaggregator.domain.context.SourceResult;
import com.williamcallahan.contextaggregator.domain.context.TaskType;
import java.time.Clock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;

/**
 * Verifies web search results become ranked chunks and the subscription token is required.
 */
class WebSearchContextSourceTest {
    private static final String RESPONSE = """
            {"web": {"results": [
              {"title": "Java Records", "description": "Records are transparent carriers.", "url": "https://example.com/records"},
              {"title": "", "description": ""},
              {"title": "Pattern Matching", "description": "Switch patterns in Java 21.", "url": "https://example.com/patterns"}
            ]}}
            """;

    private final Clock clock = Clock.systemUTC();
    private WebSearchContextSource source;

    @AfterEach
    void tearDown() {
        if (source != null) {
            source.dispose();
        }
    }

    @Test
    void mapsResultsWithDecayingRelevance() {
        HttpSourceStubs stubs = new HttpSourceStubs(HttpStatus.OK, RESPONSE);
        source = newSource(stubs, "brave-token");

        SourceResult result = source.retrieve(query(50));

        assertTrue(result.isSuccess());
        assertEquals(2, result.chunks().size());
        ContextChunk first = result.chunks().get(0);
        assertEquals("web-0", first.id());
        assertEquals("Java Records\nRecords are transparent carriers.", first.content());
        assertEquals("https://example.com/records", first.metadata().url());
        assertEquals(0.9, result.chunks().get(1).relevance(), 1e-9);

        ClientRequest request = stubs.requests().get(0);
        assertEquals("brave-token", request.headers().getFirst("X-Subscription-Token"));
        assertTrue(request.url().getQuery().contains("count=20"));
        assertTrue(request.url().getQuery().contains("q=java records"));
    }

    @Test
    void unavailableWithoutApiKey() {
        source = newSource(new HttpSourceStubs(HttpStatus.OK, RESPONSE), "");

        assertFalse(source.isAvailable());
    }

    private WebSearchContextSource newSource(HttpSourceStubs stubs, String apiKey) {
        ContextAggregatorProperties properties = new ContextAggregatorProperties();
        properties.getBackends().getWebSearch().setApiKey(apiKey);
        WebSearchContextSource created = new WebSearchContextSource(stubs.builder(), properties, clock);
        created.initialize(new SourceSettings(true, 2000, 50, 0, 10));
        return created;
    }

    private SourceQuery query(int maxChunks) {
        return new SourceQuery("java records", TaskType.DOCUMENTATION, maxChunks, 1000, 400, null,
                clock.instant().plusSeconds(2));
    }
}
