package com.williamcallahan.contextaggregator.application.context;

import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.support.VectorSimilarity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Orders deduplicated chunks for assembly. Budget is not consulted here.
 *
 * <p>Primary order: relevance descending, then source priority descending, then retrieval order.
 * Diversity mode re-picks from that order with maximal marginal relevance so that barely-distinct
 * variants do not crowd the head of the list.</p>
 */
@Component
public class ChunkRanker {
    private static final int DEFAULT_PRIORITY = 1;

    /**
     * Ranks chunks in primary or diversity order.
     *
     * @param chunks deduplicated chunks in retrieval order
     * @param priorities source weights used as the first tie-break
     * @param diversify use maximal marginal relevance
     * @param mmrLambda relevance weight for diversity mode
     * @return ranked chunks
     */
    public List<ContextChunk> rank(
            List<ContextChunk> chunks, Map<ContextSourceType, Integer> priorities, boolean diversify, double mmrLambda) {
        List<ContextChunk> primary = rankByRelevance(chunks, priorities);
        return diversify ? diversify(primary, mmrLambda) : primary;
    }

    /**
     * Sorts by relevance, then source priority, then original position.
     *
     * @param chunks chunks in retrieval order
     * @param priorities source weights; missing sources weigh 1
     * @return new list in primary order
     */
    public List<ContextChunk> rankByRelevance(List<ContextChunk> chunks, Map<ContextSourceType, Integer> priorities) {
        Objects.requireNonNull(chunks, "chunks");
        Map<ContextSourceType, Integer> weights = priorities == null ? Map.of() : priorities;

        List<Positioned> positioned = new ArrayList<>(chunks.size());
        for (int index = 0; index < chunks.size(); index++) {
            positioned.add(new Positioned(index, chunks.get(index)));
        }
        positioned.sort(Comparator
                .comparingDouble((Positioned entry) -> entry.chunk().relevance()).reversed()
                .thenComparing(Comparator.comparingInt(
                        (Positioned entry) -> weights.getOrDefault(entry.chunk().source(), DEFAULT_PRIORITY))
                        .reversed())
                .thenComparingInt(Positioned::index));
        return positioned.stream().map(Positioned::chunk).toList();
    }

    /**
     * Re-orders a primary-ordered list with maximal marginal relevance.
     *
     * <p>Each pick maximizes {@code lambda * relevance - (1 - lambda) * maxSimilarity(selected)}.
     * Chunks without embeddings have similarity 0 to everything; ties go to the earlier primary
     * position.</p>
     *
     * @param primaryOrder chunks already in primary order
     * @param lambda relevance weight in [0, 1]
     * @return diversified order containing every input chunk
     */
    public List<ContextChunk> diversify(List<ContextChunk> primaryOrder, double lambda) {
        if (primaryOrder.size() <= 2) {
            return List.copyOf(primaryOrder);
        }
        double relevanceWeight = Math.max(0.0, Math.min(1.0, lambda));

        List<ContextChunk> remaining = new ArrayList<>(primaryOrder);
        List<float[]> remainingVectors = new ArrayList<>(primaryOrder.size());
        for (ContextChunk chunk : primaryOrder) {
            remainingVectors.add(chunk.embedding());
        }
        List<ContextChunk> selected = new ArrayList<>(primaryOrder.size());
        List<float[]> selectedVectors = new ArrayList<>(primaryOrder.size());
        selected.add(remaining.remove(0));
        selectedVectors.add(remainingVectors.remove(0));

        while (!remaining.isEmpty()) {
            int bestIndex = 0;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int index = 0; index < remaining.size(); index++) {
                double redundancy = maxSimilarity(remainingVectors.get(index), selectedVectors);
                double score = relevanceWeight * remaining.get(index).relevance() - (1.0 - relevanceWeight) * redundancy;
                if (score > bestScore) {
                    bestScore = score;
                    bestIndex = index;
                }
            }
            selected.add(remaining.remove(bestIndex));
            selectedVectors.add(remainingVectors.remove(bestIndex));
        }
        return List.copyOf(selected);
    }

    private static double maxSimilarity(float[] candidate, List<float[]> selected) {
        if (candidate == null) {
            return 0.0;
        }
        double max = 0.0;
        for (float[] chosen : selected) {
            if (chosen != null) {
                max = Math.max(max, VectorSimilarity.cosine(candidate, chosen));
            }
        }
        return max;
    }

    private record Positioned(int index, ContextChunk chunk) {}
}
