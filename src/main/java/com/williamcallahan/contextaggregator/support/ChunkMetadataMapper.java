package com.williamcallahan.contextaggregator.support;

import com.williamcallahan.contextaggregator.domain.context.ChunkMetadata;
import com.williamcallahan.contextaggregator.domain.context.SymbolType;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Maps loosely typed backend metadata into {@link ChunkMetadata}.
 *
 * <p>Backends disagree on key style, so each field is looked up under its camelCase and snake_case
 * names. Values of the wrong type are ignored rather than failing the chunk.</p>
 */
public final class ChunkMetadataMapper {

    private ChunkMetadataMapper() {}

    /**
     * Builds metadata from a backend map.
     *
     * @param raw backend metadata, may be null
     * @return mapped metadata
     */
    public static ChunkMetadata fromMap(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return ChunkMetadata.empty();
        }
        return ChunkMetadata.builder()
                .filePath(text(raw, "filePath", "file_path"))
                .lines(integer(raw, "startLine", "start_line"), integer(raw, "endLine", "end_line"))
                .language(text(raw, "language", "lang"))
                .symbol(text(raw, "symbolName", "symbol_name"), symbolType(text(raw, "symbolType", "symbol_type")))
                .url(text(raw, "url", "source_url"))
                .title(text(raw, "title", "title"))
                .date(instant(text(raw, "date", "last_modified")))
                .hash(text(raw, "hash", "content_hash"))
                .build();
    }

    static String text(Map<String, ?> raw, String camelKey, String snakeKey) {
        Object value = raw.containsKey(camelKey) ? raw.get(camelKey) : raw.get(snakeKey);
        if (value == null) {
            return null;
        }
        String asText = value.toString();
        return asText.isBlank() ? null : asText;
    }

    static Integer integer(Map<String, ?> raw, String camelKey, String snakeKey) {
        Object value = raw.containsKey(camelKey) ? raw.get(camelKey) : raw.get(snakeKey);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String asText) {
            try {
                return Integer.valueOf(asText.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    private static SymbolType symbolType(String value) {
        if (value == null) {
            return null;
        }
        try {
            return SymbolType.fromId(value);
        } catch (IllegalArgumentException unknown) {
            return null;
        }
    }

    private static Instant instant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException unparseable) {
            return null;
        }
    }
}
