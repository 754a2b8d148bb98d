package com.williamcallahan.contextaggregator.domain.context;

/**
 * Token counting strategy applied consistently within a request.
 */
public enum TokenCounterType {
    /** Exact count with the {@code cl100k_base} encoding. */
    CL100K,
    /** Whitespace word count weighted by word length. */
    HEURISTIC
}
