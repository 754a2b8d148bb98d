package com.williamcallahan.contextaggregator.application.context;

import com.williamcallahan.contextaggregator.domain.context.AssembledContext;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.support.ContentHasher;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Selects ranked chunks under the effective budget and renders them into one payload.
 *
 * <p>Selection walks the ranked list and stops at the first chunk that would overflow the budget.
 * Only when nothing has been selected yet, compression is on, and at least the minimum truncation
 * budget remains, is that chunk truncated to fit. A chunk whose fingerprint was already selected is
 * skipped, so the payload never repeats content even when deduplication was turned off.</p>
 */
@Component
public class ContextAssembler {
    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private final ChunkCompactor chunkCompactor;
    private final ContextRenderer contextRenderer;
    private final ContentHasher contentHasher;

    public ContextAssembler(ChunkCompactor chunkCompactor, ContextRenderer contextRenderer, ContentHasher contentHasher) {
        this.chunkCompactor = Objects.requireNonNull(chunkCompactor, "chunkCompactor");
        this.contextRenderer = Objects.requireNonNull(contextRenderer, "contextRenderer");
        this.contentHasher = Objects.requireNonNull(contentHasher, "contentHasher");
    }

    /**
     * Assembles ranked chunks under a budget.
     *
     * @param rankedChunks chunks in rank order
     * @param effectiveBudget token ceiling for the included chunks
     * @param settings resolved assembly settings
     * @return assembled context whose token count never exceeds the budget
     */
    public AssembledContext assemble(List<ContextChunk> rankedChunks, int effectiveBudget, AssemblySettings settings) {
        Objects.requireNonNull(rankedChunks, "rankedChunks");
        Objects.requireNonNull(settings, "settings");
        if (rankedChunks.isEmpty() || effectiveBudget <= 0) {
            return AssembledContext.empty(settings.format());
        }

        TokenCounter tokenCounter = settings.tokenCounter();
        List<ContextChunk> selected = new ArrayList<>();
        Set<String> selectedFingerprints = new HashSet<>();
        int usedTokens = 0;

        for (ContextChunk candidate : rankedChunks) {
            String content = settings.summarize() ? chunkCompactor.summarize(candidate.content()) : candidate.content();
            if (content.isBlank()) {
                continue;
            }
            String fingerprint = contentHasher.fingerprint(content);
            if (selectedFingerprints.contains(fingerprint)) {
                continue;
            }
            int tokens = settings.summarize() || candidate.tokenCount() == null
                    ? tokenCounter.count(content)
                    : candidate.tokenCount();
            int remaining = effectiveBudget - usedTokens;

            if (tokens <= remaining) {
                selected.add(finish(candidate, content, tokens, settings));
                selectedFingerprints.add(fingerprint);
                usedTokens += tokens;
                continue;
            }

            if (selected.isEmpty() && settings.compress() && remaining >= settings.minTruncationTokens()) {
                String truncated = chunkCompactor.truncate(
                        content, remaining, tokenCounter, settings.smartTruncation(), settings.preserveStructure());
                if (!truncated.isEmpty()) {
                    int truncatedTokens = tokenCounter.count(truncated);
                    selected.add(finish(candidate, truncated, truncatedTokens, settings));
                    usedTokens += truncatedTokens;
                    log.debug("Truncated chunk {} from {} to {} tokens", candidate.id(), tokens, truncatedTokens);
                }
            }
            break;
        }

        String text = contextRenderer.render(selected, settings.format(), settings.includeMetadata());
        return new AssembledContext(text, selected, usedTokens, settings.format());
    }

    private static ContextChunk finish(ContextChunk candidate, String content, int tokens, AssemblySettings settings) {
        ContextChunk counted = candidate.withContent(content, tokens);
        return settings.includeEmbeddings() ? counted : counted.withoutEmbedding();
    }
}
