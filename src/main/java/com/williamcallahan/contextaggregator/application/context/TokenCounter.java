package com.williamcallahan.contextaggregator.application.context;

import com.williamcallahan.contextaggregator.domain.context.TokenCounterType;

/**
 * Counts tokens for budget accounting. One implementation is used for a whole request.
 */
public interface TokenCounter {

    /**
     * Counts tokens in the given text.
     *
     * @param text text to count; null counts as empty
     * @return non-negative token count
     */
    int count(String text);

    /**
     * Identifies the strategy for diagnostics.
     *
     * @return counter type
     */
    TokenCounterType type();

    /**
     * Creates the counter for a configured strategy.
     *
     * @param type configured strategy
     * @return token counter
     */
    static TokenCounter forType(TokenCounterType type) {
        return switch (type) {
            case CL100K -> new Cl100kTokenCounter();
            case HEURISTIC -> new HeuristicTokenCounter();
        };
    }
}
