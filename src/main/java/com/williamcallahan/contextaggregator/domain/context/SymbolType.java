package com.williamcallahan.contextaggregator.domain.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Code construct a chunk was cut from, when the backend knows it.
 */
public enum SymbolType {
    FUNCTION,
    CLASS,
    INTERFACE,
    MODULE,
    BLOCK;

    @JsonValue
    public String wireId() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SymbolType fromId(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return null;
        }
        return SymbolType.valueOf(identifier.trim().toUpperCase(Locale.ROOT));
    }
}
