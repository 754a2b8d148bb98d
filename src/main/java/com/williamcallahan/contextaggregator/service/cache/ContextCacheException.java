package com.williamcallahan.contextaggregator.service.cache;

/**
 * Raised when the cache backing store fails.
 */
public class ContextCacheException extends RuntimeException {

    public ContextCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
