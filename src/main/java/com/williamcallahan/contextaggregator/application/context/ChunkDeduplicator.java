package com.williamcallahan.contextaggregator.application.context;

import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.DeduplicationSettings;
import com.williamcallahan.contextaggregator.domain.context.ChunkMetadata;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.support.ContentHasher;
import com.williamcallahan.contextaggregator.support.VectorSimilarity;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Removes exact and near-duplicate chunks from the merged result set.
 *
 * <p>Up to three passes run in order, each behind its own switch:
 * <ol>
 *   <li>fingerprint: first occurrence of each whitespace-normalized content hash wins</li>
 *   <li>overlap merge: chunks from the same file whose line ranges overlap by at least half of the
 *       smaller range collapse to the more relevant one</li>
 *   <li>semantic: chunks whose embeddings reach the similarity threshold against a group seed collapse
 *       to the most relevant member</li>
 * </ol>
 *
 * <p>Survivors keep their input order and relevance ties go to the lower input index, so the output
 * is a pure function of the input list.</p>
 */
@Component
public class ChunkDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(ChunkDeduplicator.class);
    private static final double OVERLAP_RATIO = 0.5;

    private final ContentHasher contentHasher;

    public ChunkDeduplicator(ContentHasher contentHasher) {
        this.contentHasher = Objects.requireNonNull(contentHasher, "contentHasher");
    }

    /**
     * Runs the enabled passes over the merged chunk list.
     *
     * @param chunks merged chunks in retrieval order
     * @param settings deduplication settings
     * @return surviving chunks and removal counts
     */
    public DeduplicationResult deduplicate(List<ContextChunk> chunks, DeduplicationSettings settings) {
        Objects.requireNonNull(chunks, "chunks");
        Objects.requireNonNull(settings, "settings");
        if (!settings.enabled() || chunks.size() <= 1) {
            return new DeduplicationResult(chunks, 0, 0, 0);
        }

        List<IndexedChunk> survivors = new ArrayList<>(chunks.size());
        for (int index = 0; index < chunks.size(); index++) {
            survivors.add(new IndexedChunk(index, chunks.get(index)));
        }

        int hashRemoved = 0;
        if (settings.useContentHash()) {
            int before = survivors.size();
            survivors = removeExactDuplicates(survivors);
            hashRemoved = before - survivors.size();
        }

        int overlapRemoved = 0;
        if (settings.mergeOverlapping()) {
            int before = survivors.size();
            survivors = mergeOverlappingRanges(survivors);
            overlapRemoved = before - survivors.size();
        }

        int semanticRemoved = 0;
        if (settings.useSemantic()) {
            int before = survivors.size();
            survivors = removeNearDuplicates(survivors, settings.similarityThreshold());
            semanticRemoved = before - survivors.size();
        }

        log.debug("Deduplicated {} chunks (hash={}, overlap={}, semantic={})",
                chunks.size(), hashRemoved, overlapRemoved, semanticRemoved);
        return new DeduplicationResult(
                survivors.stream().map(IndexedChunk::chunk).toList(), hashRemoved, overlapRemoved, semanticRemoved);
    }

    private List<IndexedChunk> removeExactDuplicates(List<IndexedChunk> candidates) {
        Set<String> seenFingerprints = new HashSet<>();
        List<IndexedChunk> unique = new ArrayList<>(candidates.size());
        for (IndexedChunk candidate : candidates) {
            if (seenFingerprints.add(contentHasher.fingerprint(candidate.chunk().content()))) {
                unique.add(candidate);
            }
        }
        return unique;
    }

    private List<IndexedChunk> mergeOverlappingRanges(List<IndexedChunk> candidates) {
        Map<String, List<IndexedChunk>> rangedByFile = new LinkedHashMap<>();
        for (IndexedChunk candidate : candidates) {
            ChunkMetadata metadata = candidate.chunk().metadata();
            if (metadata.hasLineRange()) {
                rangedByFile.computeIfAbsent(metadata.filePath(), path -> new ArrayList<>()).add(candidate);
            }
        }

        Set<Integer> dropped = new HashSet<>();
        for (List<IndexedChunk> fileChunks : rangedByFile.values()) {
            if (fileChunks.size() < 2) {
                continue;
            }
            fileChunks.sort(Comparator
                    .comparingInt((IndexedChunk candidate) -> candidate.chunk().metadata().startLine())
                    .thenComparingInt(IndexedChunk::index));
            BitSet merged = new BitSet(fileChunks.size());
            for (int i = 0; i < fileChunks.size(); i++) {
                if (merged.get(i)) {
                    continue;
                }
                merged.set(i);
                IndexedChunk best = fileChunks.get(i);
                for (int j = i + 1; j < fileChunks.size(); j++) {
                    if (merged.get(j)) {
                        continue;
                    }
                    IndexedChunk other = fileChunks.get(j);
                    if (overlapsSubstantially(best.chunk().metadata(), other.chunk().metadata())) {
                        merged.set(j);
                        IndexedChunk winner = moreRelevant(best, other);
                        dropped.add(winner == best ? other.index() : best.index());
                        best = winner;
                    }
                }
            }
        }

        if (dropped.isEmpty()) {
            return candidates;
        }
        return candidates.stream().filter(candidate -> !dropped.contains(candidate.index())).toList();
    }

    private static boolean overlapsSubstantially(ChunkMetadata left, ChunkMetadata right) {
        int overlapStart = Math.max(left.startLine(), right.startLine());
        int overlapEnd = Math.min(left.endLine(), right.endLine());
        int overlapLines = Math.max(0, overlapEnd - overlapStart + 1);
        int smallerSpan = Math.min(
                left.endLine() - left.startLine() + 1,
                right.endLine() - right.startLine() + 1);
        return overlapLines > 0 && overlapLines >= smallerSpan * OVERLAP_RATIO;
    }

    private List<IndexedChunk> removeNearDuplicates(List<IndexedChunk> candidates, double threshold) {
        List<IndexedChunk> embedded = candidates.stream()
                .filter(candidate -> candidate.chunk().hasEmbedding())
                .toList();
        if (embedded.size() < 2) {
            return candidates;
        }
        List<float[]> vectors = embedded.stream().map(candidate -> candidate.chunk().embedding()).toList();

        Set<Integer> dropped = new HashSet<>();
        BitSet grouped = new BitSet(embedded.size());
        for (int i = 0; i < embedded.size(); i++) {
            if (grouped.get(i)) {
                continue;
            }
            grouped.set(i);
            IndexedChunk winner = embedded.get(i);
            for (int j = i + 1; j < embedded.size(); j++) {
                if (grouped.get(j)) {
                    continue;
                }
                IndexedChunk other = embedded.get(j);
                double similarity = VectorSimilarity.cosine(vectors.get(i), vectors.get(j));
                if (similarity >= threshold) {
                    grouped.set(j);
                    IndexedChunk preferred = moreRelevant(winner, other);
                    dropped.add(preferred == winner ? other.index() : winner.index());
                    winner = preferred;
                }
            }
        }

        if (dropped.isEmpty()) {
            return candidates;
        }
        return candidates.stream().filter(candidate -> !dropped.contains(candidate.index())).toList();
    }

    private static IndexedChunk moreRelevant(IndexedChunk left, IndexedChunk right) {
        int byRelevance = Double.compare(left.chunk().relevance(), right.chunk().relevance());
        if (byRelevance != 0) {
            return byRelevance > 0 ? left : right;
        }
        return left.index() <= right.index() ? left : right;
    }

    private record IndexedChunk(int index, ContextChunk chunk) {}

    /**
     * Surviving chunks plus how many each pass removed.
     *
     * @param chunks survivors in input order
     * @param hashRemoved removed by the fingerprint pass
     * @param overlapRemoved removed by the overlap merge
     * @param semanticRemoved removed by the semantic pass
     */
    public record DeduplicationResult(List<ContextChunk> chunks, int hashRemoved, int overlapRemoved, int semanticRemoved) {

        public DeduplicationResult {
            chunks = chunks == null ? List.of() : List.copyOf(chunks);
        }

        public int removedCount() {
            return hashRemoved + overlapRemoved + semanticRemoved;
        }
    }
}
