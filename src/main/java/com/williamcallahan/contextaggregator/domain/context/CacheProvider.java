package com.williamcallahan.contextaggregator.domain.context;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Backing technology for the response cache.
 */
public enum CacheProvider {
    MEMORY,
    REDIS;

    @JsonValue
    public String wireId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
