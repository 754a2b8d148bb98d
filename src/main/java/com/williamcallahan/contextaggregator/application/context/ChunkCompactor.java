package com.williamcallahan.contextaggregator.application.context;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Shrinks chunk text: comment stripping for summaries and boundary-aware truncation.
 */
@Component
public class ChunkCompactor {

    /** Line appended to a truncated chunk when structure preservation is on. */
    public static final String TRUNCATION_MARKER = "// ... (truncated)";

    private static final Pattern COMMENT_LINE = Pattern.compile("^(//|/\\*|\\*/|\\*\\s|\\*$)");
    private static final Pattern WORD_BOUNDARY = Pattern.compile("(?<=\\s)(?=\\S)");

    /**
     * Drops comment-only lines (keeping TODO and FIXME notes) and collapses blank-line runs to one line.
     *
     * @param content chunk text
     * @return summarized text
     */
    public String summarize(String content) {
        String[] lines = content.split("\n", -1);
        List<String> kept = new ArrayList<>(lines.length);
        int consecutiveBlanks = 0;
        for (String line : lines) {
            String trimmed = line.trim();
            if (COMMENT_LINE.matcher(trimmed).find() && !trimmed.contains("TODO") && !trimmed.contains("FIXME")) {
                continue;
            }
            if (trimmed.isEmpty()) {
                consecutiveBlanks++;
                if (consecutiveBlanks <= 1) {
                    kept.add(line);
                }
                continue;
            }
            consecutiveBlanks = 0;
            kept.add(line);
        }
        return String.join("\n", kept);
    }

    /**
     * Truncates text so that its token count, marker included, fits {@code maxTokens}.
     *
     * <p>Smart mode keeps whole leading lines and falls back to word boundaries only when even the
     * first line is too long. Otherwise the cut is at the last whole word that fits.</p>
     *
     * @param content text to truncate
     * @param maxTokens token ceiling for the result
     * @param tokenCounter counter used for the budget
     * @param smartTruncation cut at line boundaries
     * @param appendMarker append {@link #TRUNCATION_MARKER} on its own line
     * @return truncated text, or an empty string when nothing fits
     */
    public String truncate(
            String content, int maxTokens, TokenCounter tokenCounter, boolean smartTruncation, boolean appendMarker) {
        if (maxTokens <= 0 || content.isEmpty()) {
            return "";
        }
        if (tokenCounter.count(content) <= maxTokens) {
            return content;
        }
        String suffix = appendMarker ? "\n" + TRUNCATION_MARKER : "";
        int contentBudget = maxTokens - tokenCounter.count(suffix);
        if (contentBudget <= 0) {
            return "";
        }

        List<String> pieces = smartTruncation
                ? List.of(content.split("\n", -1))
                : List.of(WORD_BOUNDARY.split(content));
        String separator = smartTruncation ? "\n" : "";

        String kept = fitPieces(pieces, separator, contentBudget, maxTokens, tokenCounter, suffix);
        if (kept.isEmpty() && smartTruncation) {
            kept = fitPieces(
                    List.of(WORD_BOUNDARY.split(pieces.get(0))), "", contentBudget, maxTokens, tokenCounter, suffix);
        }
        if (kept.isEmpty()) {
            return "";
        }
        return kept + suffix;
    }

    private static String fitPieces(
            List<String> pieces,
            String separator,
            int estimateBudget,
            int limit,
            TokenCounter tokenCounter,
            String suffix) {
        // Per-piece counts give a cheap running estimate; the exact count of the joined text decides.
        int estimated = 0;
        int count = 0;
        for (String piece : pieces) {
            int pieceTokens = tokenCounter.count(piece) + (count > 0 && !separator.isEmpty() ? 1 : 0);
            if (estimated + pieceTokens > estimateBudget) {
                break;
            }
            estimated += pieceTokens;
            count++;
        }
        while (count > 0) {
            String candidate = String.join(separator, pieces.subList(0, count)).stripTrailing();
            if (!candidate.isEmpty() && tokenCounter.count(candidate + suffix) <= limit) {
                return candidate;
            }
            count--;
        }
        return "";
    }
}
