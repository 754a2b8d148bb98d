package com.williamcallahan.contextaggregator.domain.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonKey;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Closed set of retrieval backends the aggregator knows how to route to.
 *
 * <p>Wire ids are the snake_case names used in requests, cache keys and rendered payloads.
 * {@link #LIVE_API} ships without a built-in adapter and is disabled by default.</p>
 */
public enum ContextSourceType {
    VECTOR_DB("vector_db"),
    RAG("rag"),
    MCP("mcp"),
    WEB_SEARCH("web_search"),
    LIVE_API("live_api");

    private final String wireId;

    ContextSourceType(String wireId) {
        this.wireId = wireId;
    }

    /**
     * Returns the snake_case identifier used on the wire.
     *
     * @return wire identifier
     */
    @JsonKey
    @JsonValue
    public String wireId() {
        return wireId;
    }

    /**
     * Resolves a source type from its wire id, enum name or a relaxed-binding variant
     * such as {@code vector-db} or {@code vectordb}.
     *
     * @param identifier raw identifier
     * @return matching source type
     * @throws IllegalArgumentException when the identifier names no known source
     */
    @JsonCreator
    public static ContextSourceType fromId(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Source identifier must not be blank");
        }
        String normalized = normalize(identifier);
        for (ContextSourceType sourceType : values()) {
            if (normalize(sourceType.wireId).equals(normalized)) {
                return sourceType;
            }
        }
        throw new IllegalArgumentException("Unknown context source: " + identifier);
    }

    private static String normalize(String identifier) {
        return identifier.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    @Override
    public String toString() {
        return wireId;
    }
}
