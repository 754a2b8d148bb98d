package com.williamcallahan.contextaggregator.support;

/**
 * Vector math shared by semantic deduplication and diversity ranking.
 */
public final class VectorSimilarity {
    private VectorSimilarity() {}

    /**
     * Cosine similarity of two vectors; 0 for null, empty, mismatched or zero-norm input.
     *
     * @param left first vector
     * @param right second vector
     * @return similarity in [-1, 1]
     */
    public static double cosine(float[] left, float[] right) {
        if (left == null || right == null || left.length == 0 || left.length != right.length) {
            return 0.0;
        }
        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (int i = 0; i < left.length; i++) {
            dot += (double) left[i] * right[i];
            leftNorm += (double) left[i] * left[i];
            rightNorm += (double) right[i] * right[i];
        }
        double denominator = Math.sqrt(leftNorm) * Math.sqrt(rightNorm);
        return denominator == 0.0 ? 0.0 : dot / denominator;
    }
}
