package com.williamcallahan.contextaggregator.service.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.contextaggregator.config.ContextAggregatorProperties;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.SourceQuery;
import com.williamcallahan.contextaggregator.support.ChunkMetadataMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Documentation and knowledge-base retrieval through an external RAG pipeline service.
 *
 * <p>Posts the query to {@code {baseUrl}{path}} and maps the {@code chunks} array of the JSON
 * response. A top-level {@code cacheHit} flag in the response is passed through.</p>
 */
@Component
public class RagPipelineContextSource extends AbstractContextSource {
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ContextAggregatorProperties.HttpBackend backend;

    public RagPipelineContextSource(
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            ContextAggregatorProperties properties,
            Clock clock) {
        super(ContextSourceType.RAG, clock);
        this.backend = properties.getBackends().getRag();
        this.webClient = webClientBuilder.clone().build();
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean isBackendConfigured() {
        return backend.isConfigured();
    }

    @Override
    protected SourceFetch fetch(SourceQuery query) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query.text());
        body.put("taskType", query.taskType() == null ? null : query.taskType().wireId());
        body.put("maxChunks", query.maxChunks());
        body.put("maxTokens", query.maxTokens());
        body.put("maxChunkTokens", query.maxChunkTokens());
        if (!query.filters().isEmpty()) {
            Map<String, Object> filters = new LinkedHashMap<>();
            filters.put("filePaths", query.filters().filePaths());
            filters.put("languages", query.filters().languages());
            body.put("filters", filters);
        }

        WebClient.RequestBodySpec request = webClient.post()
                .uri(backend.getBaseUrl() + backend.getPath())
                .contentType(MediaType.APPLICATION_JSON);
        if (backend.getApiKey() != null && !backend.getApiKey().isBlank()) {
            request = request.header("Authorization", "Bearer " + backend.getApiKey());
        }
        JsonNode response = request.bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(query.remaining(clock().instant()))
                .block();
        if (response == null) {
            throw new SourceRetrievalException("RAG pipeline returned an empty body");
        }
        JsonNode chunkNodes = response.path("chunks");
        if (!chunkNodes.isArray()) {
            throw new SourceRetrievalException("RAG pipeline response has no chunks array");
        }

        List<ContextChunk> chunks = new ArrayList<>(chunkNodes.size());
        int position = 0;
        for (JsonNode chunkNode : chunkNodes) {
            String content = chunkNode.path("content").asText("");
            if (!content.isBlank()) {
                chunks.add(toChunk(chunkNode, content, position));
            }
            position++;
        }
        return new SourceFetch(chunks, response.path("cacheHit").asBoolean(false));
    }

    private ContextChunk toChunk(JsonNode chunkNode, String content, int position) {
        String chunkId = chunkNode.hasNonNull("id") ? chunkNode.get("id").asText() : "rag-" + position;
        double relevance = chunkNode.has("relevance")
                ? chunkNode.get("relevance").asDouble()
                : chunkNode.has("score") ? chunkNode.get("score").asDouble() : RankDecay.relevanceAt(position);
        Map<String, Object> metadata = chunkNode.has("metadata") && chunkNode.get("metadata").isObject()
                ? objectMapper.convertValue(chunkNode.get("metadata"), METADATA_TYPE)
                : Map.of();
        return ContextChunk.of(
                chunkId, content, ContextSourceType.RAG, relevance, ChunkMetadataMapper.fromMap(metadata));
    }
}
