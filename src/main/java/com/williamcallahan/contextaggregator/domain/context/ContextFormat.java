package com.williamcallahan.contextaggregator.domain.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Rendering used for the assembled context payload.
 */
public enum ContextFormat {
    XML,
    MARKDOWN,
    PLAIN;

    @JsonValue
    public String wireId() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ContextFormat fromId(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return XML;
        }
        return ContextFormat.valueOf(identifier.trim().toUpperCase(Locale.ROOT));
    }
}
