package com.williamcallahan.contextaggregator.application.context;

import com.williamcallahan.contextaggregator.domain.context.TokenCounterType;

/**
 * Cheap length-based estimate: each whitespace-separated word costs {@code max(1, ceil(length / 4))}.
 *
 * <p>Counts are additive across whitespace, so joining words with any whitespace never changes the
 * total.</p>
 */
public class HeuristicTokenCounter implements TokenCounter {
    private static final int CHARS_PER_TOKEN = 4;

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int tokens = 0;
        int wordLength = 0;
        for (int index = 0; index < text.length(); index++) {
            if (Character.isWhitespace(text.charAt(index))) {
                tokens += wordCost(wordLength);
                wordLength = 0;
            } else {
                wordLength++;
            }
        }
        return tokens + wordCost(wordLength);
    }

    private static int wordCost(int wordLength) {
        if (wordLength == 0) {
            return 0;
        }
        return Math.max(1, (wordLength + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }

    @Override
    public TokenCounterType type() {
        return TokenCounterType.HEURISTIC;
    }
}
