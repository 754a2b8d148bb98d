package com.williamcallahan.contextaggregator.service.source;

/**
 * Synthesized relevance for backends that return ordered results without scores.
 */
final class RankDecay {
    private static final double TOP_SCORE = 1.0;
    private static final double STEP = 0.1;
    private static final double FLOOR = 0.1;

    private RankDecay() {}

    /**
     * Returns {@code 1.0} for the first result and {@code 0.1} less per position, never below {@code 0.1}.
     *
     * @param rank zero-based position
     * @return relevance in [0.1, 1]
     */
    static double relevanceAt(int rank) {
        return Math.max(FLOOR, TOP_SCORE - STEP * Math.max(0, rank));
    }
}
