package com.williamcallahan.contextaggregator.domain.context;

import java.util.List;
import java.util.Objects;

/**
 * Final payload: rendered text plus the chunks it was built from.
 *
 * @param text rendered payload
 * @param chunks included chunks in rank order
 * @param tokenCount sum of the included chunks' token counts
 * @param format rendering used
 */
public record AssembledContext(String text, List<ContextChunk> chunks, int tokenCount, ContextFormat format) {

    public AssembledContext {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(format, "format");
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static AssembledContext empty(ContextFormat format) {
        return new AssembledContext("", List.of(), 0, format);
    }
}
