package com.williamcallahan.contextaggregator.domain.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Provenance attached to a retrieved chunk. Every field is optional.
 *
 * @param filePath repository-relative file path
 * @param startLine first line of the excerpt (1-based)
 * @param endLine last line of the excerpt, inclusive
 * @param language source language of the excerpt
 * @param symbolName enclosing symbol, if known
 * @param symbolType kind of the enclosing symbol
 * @param url origin URL for web or documentation content
 * @param title human-readable title
 * @param date timestamp reported by the backend
 * @param hash backend-provided content hash
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChunkMetadata(
        String filePath,
        Integer startLine,
        Integer endLine,
        String language,
        String symbolName,
        SymbolType symbolType,
        String url,
        String title,
        Instant date,
        String hash) {

    private static final ChunkMetadata EMPTY = builder().build();

    /**
     * Returns metadata with no provenance fields set.
     *
     * @return empty metadata
     */
    public static ChunkMetadata empty() {
        return EMPTY;
    }

    /**
     * Reports whether this chunk carries a file path with a complete line range.
     *
     * @return true when file path, start line and end line are all present
     */
    public boolean hasLineRange() {
        return filePath != null && !filePath.isBlank() && startLine != null && endLine != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable builder used by source adapters while translating backend payloads.
     */
    public static final class Builder {
        private String filePath;
        private Integer startLine;
        private Integer endLine;
        private String language;
        private String symbolName;
        private SymbolType symbolType;
        private String url;
        private String title;
        private Instant date;
        private String hash;

        private Builder() {}

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder lines(Integer startLine, Integer endLine) {
            this.startLine = startLine;
            this.endLine = endLine;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder symbol(String symbolName, SymbolType symbolType) {
            this.symbolName = symbolName;
            this.symbolType = symbolType;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder date(Instant date) {
            this.date = date;
            return this;
        }

        public Builder hash(String hash) {
            this.hash = hash;
            return this;
        }

        public ChunkMetadata build() {
            return new ChunkMetadata(
                    filePath, startLine, endLine, language, symbolName, symbolType, url, title, date, hash);
        }
    }
}
