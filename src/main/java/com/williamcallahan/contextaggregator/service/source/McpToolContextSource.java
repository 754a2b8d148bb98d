package com.williamcallahan.contextaggregator.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.contextaggregator.config.ContextAggregatorProperties;
import com.williamcallahan.contextaggregator.domain.context.ChunkMetadata;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.SourceQuery;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Calls a single configured tool on an MCP server using JSON-RPC 2.0 {@code tools/call} over HTTP.
 *
 * <p>Each {@code text} item of the tool result becomes one chunk. A JSON-RPC error or a result flagged
 * {@code isError} fails the call.</p>
 */
@Component
public class McpToolContextSource extends AbstractContextSource {
    private static final String JSON_RPC_VERSION = "2.0";
    private static final String TOOLS_CALL = "tools/call";
    private static final String TEXT_CONTENT = "text";

    private final WebClient webClient;
    private final ContextAggregatorProperties.McpBackend backend;
    private final AtomicLong requestIds = new AtomicLong();

    public McpToolContextSource(
            WebClient.Builder webClientBuilder, ContextAggregatorProperties properties, Clock clock) {
        super(ContextSourceType.MCP, clock);
        this.backend = properties.getBackends().getMcp();
        this.webClient = webClientBuilder.clone().build();
    }

    @Override
    protected boolean isBackendConfigured() {
        return backend.isConfigured() && backend.getToolName() != null && !backend.getToolName().isBlank();
    }

    @Override
    protected SourceFetch fetch(SourceQuery query) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("query", query.text());
        arguments.put("maxResults", query.maxChunks());
        if (query.taskType() != null) {
            arguments.put("taskType", query.taskType().wireId());
        }
        if (!query.filters().filePaths().isEmpty()) {
            arguments.put("filePaths", query.filters().filePaths());
        }
        if (!query.filters().languages().isEmpty()) {
            arguments.put("languages", query.filters().languages());
        }
        Map<String, Object> rpcRequest = Map.of(
                "jsonrpc", JSON_RPC_VERSION,
                "id", requestIds.incrementAndGet(),
                "method", TOOLS_CALL,
                "params", Map.of("name", backend.getToolName(), "arguments", arguments));

        WebClient.RequestBodySpec request = webClient.post()
                .uri(backend.getBaseUrl() + backend.getPath())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON);
        if (backend.getApiKey() != null && !backend.getApiKey().isBlank()) {
            request = request.header("Authorization", "Bearer " + backend.getApiKey());
        }
        JsonNode response = request.bodyValue(rpcRequest)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(query.remaining(clock().instant()))
                .block();
        if (response == null) {
            throw new SourceRetrievalException("MCP server returned an empty body");
        }
        if (response.hasNonNull("error")) {
            JsonNode error = response.get("error");
            throw new SourceRetrievalException("MCP error " + error.path("code").asText("?")
                    + ": " + error.path("message").asText("unknown"));
        }
        JsonNode result = response.path("result");
        if (result.path("isError").asBoolean(false)) {
            throw new SourceRetrievalException("MCP tool " + backend.getToolName() + " reported an error");
        }

        List<ContextChunk> chunks = new ArrayList<>();
        ChunkMetadata metadata = ChunkMetadata.builder().title(backend.getToolName()).build();
        int position = 0;
        for (JsonNode item : result.path("content")) {
            if (!TEXT_CONTENT.equals(item.path("type").asText())) {
                continue;
            }
            String text = item.path("text").asText("");
            if (!text.isBlank()) {
                chunks.add(ContextChunk.of(
                        "mcp-" + backend.getToolName() + "-" + position,
                        text,
                        ContextSourceType.MCP,
                        RankDecay.relevanceAt(position),
                        metadata));
                position++;
            }
        }
        return SourceFetch.of(chunks);
    }
}
