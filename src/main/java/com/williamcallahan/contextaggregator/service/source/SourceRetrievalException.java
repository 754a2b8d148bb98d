package com.williamcallahan.contextaggregator.service.source;

/**
 * Backend failure raised inside an adapter. It never leaves {@link AbstractContextSource#retrieve}.
 */
public class SourceRetrievalException extends RuntimeException {

    public SourceRetrievalException(String message) {
        super(message);
    }

    public SourceRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
