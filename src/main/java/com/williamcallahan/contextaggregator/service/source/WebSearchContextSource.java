package com.williamcallahan.contextaggregator.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.contextaggregator.config.ContextAggregatorProperties;
import com.williamcallahan.contextaggregator.domain.context.ChunkMetadata;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.SourceQuery;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Brave Search web results as context.
 *
 * <p>Each result becomes one chunk holding its title and description, with the result URL in the
 * metadata. Relevance decays with rank since the API returns no score.</p>
 */
@Component
public class WebSearchContextSource extends AbstractContextSource {
    private static final String TOKEN_HEADER = "X-Subscription-Token";
    private static final int MAX_COUNT = 20;

    private final WebClient webClient;
    private final ContextAggregatorProperties.WebSearchBackend backend;

    public WebSearchContextSource(
            WebClient.Builder webClientBuilder, ContextAggregatorProperties properties, Clock clock) {
        super(ContextSourceType.WEB_SEARCH, clock);
        this.backend = properties.getBackends().getWebSearch();
        this.webClient = webClientBuilder.clone().build();
    }

    @Override
    protected boolean isBackendConfigured() {
        return backend.isConfigured();
    }

    @Override
    protected SourceFetch fetch(SourceQuery query) {
        int count = Math.max(1, Math.min(MAX_COUNT, query.maxChunks()));
        JsonNode response = webClient.get()
                .uri(backend.getBaseUrl() + backend.getPath() + "?q={q}&count={count}", query.text(), count)
                .accept(MediaType.APPLICATION_JSON)
                .header(TOKEN_HEADER, backend.getApiKey())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(query.remaining(clock().instant()))
                .block();
        if (response == null) {
            throw new SourceRetrievalException("Web search returned an empty body");
        }

        List<ContextChunk> chunks = new ArrayList<>();
        int rank = 0;
        for (JsonNode result : response.path("web").path("results")) {
            String title = result.path("title").asText("");
            String description = result.path("description").asText("");
            String url = result.path("url").asText("");
            if (description.isBlank() && title.isBlank()) {
                continue;
            }
            String content = title.isBlank() ? description : title + "\n" + description;
            chunks.add(ContextChunk.of(
                    "web-" + rank,
                    content.strip(),
                    ContextSourceType.WEB_SEARCH,
                    RankDecay.relevanceAt(rank),
                    ChunkMetadata.builder().url(url.isBlank() ? null : url).title(title.isBlank() ? null : title).build()));
            rank++;
        }
        return SourceFetch.of(chunks);
    }
}
