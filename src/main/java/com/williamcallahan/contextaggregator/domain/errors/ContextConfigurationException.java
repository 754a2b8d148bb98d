package com.williamcallahan.contextaggregator.domain.errors;

/**
 * Raised for a malformed context request or an invalid aggregator configuration.
 *
 * <p>This is the only failure the aggregator surfaces to callers; it is thrown before any
 * backend is contacted.</p>
 */
public class ContextConfigurationException extends IllegalArgumentException {

    public ContextConfigurationException(String message) {
        super(message);
    }
}
