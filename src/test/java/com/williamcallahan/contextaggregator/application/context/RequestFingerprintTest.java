package com.williamcallahan.contextaggregator.application.context;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig;
import com.williamcallahan.contextaggregator.domain.context.ContextHints;
import com.williamcallahan.contextaggregator.domain.context.ContextOptions;
import com.williamcallahan.contextaggregator.domain.context.ContextRequest;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.TaskType;
import com.williamcallahan.contextaggregator.support.ContentHasher;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies that cache keys ignore ordering and spacing but track anything that changes the output.
 */
class RequestFingerprintTest {
    private static final ContextSourceType VECTOR_DB = ContextSourceType.VECTOR_DB;
    private static final ContextSourceType RAG = ContextSourceType.RAG;

    private final RequestFingerprint fingerprint = new RequestFingerprint(new ContentHasher());

    @Test
    void keyIgnoresSourceOrderAndQuerySpacing() {
        ContextRequest spaced = request("  find   the parser ", List.of(RAG, VECTOR_DB), List.of("b.java", "a.java"), null);
        ContextRequest compact = request("find the parser", List.of(VECTOR_DB, RAG), List.of("a.java", "b.java"), null);

        String first = fingerprint.cacheKey(plan(spaced, List.of(RAG, VECTOR_DB)));
        String second = fingerprint.cacheKey(plan(compact, List.of(VECTOR_DB, RAG)));

        assertEquals(first, second);
        assertTrue(first.startsWith(RequestFingerprint.KEY_PREFIX));
    }

    @Test
    void keyChangesWithQuery() {
        ContextRequest parser = request("find the parser", List.of(VECTOR_DB), List.of(), null);
        ContextRequest lexer = request("find the lexer", List.of(VECTOR_DB), List.of(), null);

        assertNotEquals(
                fingerprint.cacheKey(plan(parser, List.of(VECTOR_DB))),
                fingerprint.cacheKey(plan(lexer, List.of(VECTOR_DB))));
    }

    @Test
    void callerSuppliedKeyWins() {
        ContextRequest custom = request("find the parser", List.of(VECTOR_DB), List.of(), "session-42");

        assertEquals("session-42", fingerprint.cacheKey(plan(custom, List.of(VECTOR_DB))));
    }

    private static ContextRequest request(
            String query, List<ContextSourceType> sources, List<String> relatedFiles, String cacheKey) {
        ContextHints hints = new ContextHints(relatedFiles, List.of(), "java", null, List.of());
        ContextOptions options = new ContextOptions(null, null, null, null, null, null, null, cacheKey, null, null);
        return new ContextRequest(query, TaskType.IMPLEMENTATION, 4000, 500, sources, Map.of(), hints, options);
    }

    private static RequestPlan plan(ContextRequest request, List<ContextSourceType> sources) {
        AssemblySettings assembly = AssemblySettings.resolve(
                request.options(), AggregatorConfig.defaults(), new HeuristicTokenCounter());
        return new RequestPlan(
                request,
                3500,
                sources,
                Map.of(VECTOR_DB, 4, RAG, 3),
                Map.of(),
                assembly,
                true,
                false,
                0.7,
                Duration.ofSeconds(10));
    }
}
