package com.williamcallahan.contextaggregator.domain.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kind of agent work a context request supports; drives default sources and priority weights.
 */
public enum TaskType {
    ANALYSIS,
    PLANNING,
    IMPLEMENTATION,
    REVIEW,
    TESTING,
    DOCUMENTATION;

    /**
     * Returns the lower-case identifier used on the wire.
     *
     * @return wire identifier
     */
    @JsonValue
    public String wireId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a task type case-insensitively.
     *
     * @param identifier raw identifier
     * @return matching task type
     * @throws IllegalArgumentException when the identifier names no known task type
     */
    @JsonCreator
    public static TaskType fromId(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Task type must not be blank");
        }
        String normalized = identifier.trim().toUpperCase(Locale.ROOT);
        for (TaskType taskType : values()) {
            if (taskType.name().equals(normalized)) {
                return taskType;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + identifier);
    }
}
