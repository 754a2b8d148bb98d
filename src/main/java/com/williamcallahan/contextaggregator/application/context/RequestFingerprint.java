package com.williamcallahan.contextaggregator.application.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.williamcallahan.contextaggregator.domain.context.ContextHints;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.support.ContentHasher;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Derives the response cache key from a normalized request.
 *
 * <p>Normalization trims and collapses whitespace in the query, sorts sources, priorities and hint
 * lists, and includes only the resolved values that change the assembled output. Two requests that
 * differ only in ordering or spacing therefore share a key.</p>
 */
@Component
public class RequestFingerprint {

    /** Prefix for every generated key; invalidation patterns can target it. */
    public static final String KEY_PREFIX = "ctx:";

    private final ObjectMapper canonicalMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    private final ContentHasher contentHasher;

    public RequestFingerprint(ContentHasher contentHasher) {
        this.contentHasher = Objects.requireNonNull(contentHasher, "contentHasher");
    }

    /**
     * Returns the cache key for a plan, honoring a caller-supplied key when present.
     *
     * @param plan resolved request plan
     * @return cache key
     */
    public String cacheKey(RequestPlan plan) {
        String customKey = plan.request().options().customCacheKey();
        if (customKey != null) {
            return customKey;
        }
        return KEY_PREFIX + contentHasher.sha256(canonicalForm(plan));
    }

    String canonicalForm(RequestPlan plan) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("query", ContentHasher.normalizeWhitespace(plan.request().query()));
        canonical.put("taskType", plan.request().taskType().wireId());
        canonical.put("budget", plan.effectiveBudget());
        canonical.put("sources", plan.sources().stream().map(ContextSourceType::wireId).sorted().toList());
        Map<String, Integer> priorities = new TreeMap<>();
        plan.priorities().forEach((source, weight) -> priorities.put(source.wireId(), weight));
        canonical.put("priorities", priorities);
        canonical.put("hints", canonicalHints(plan.request().hints()));

        AssemblySettings assembly = plan.assembly();
        Map<String, Object> processing = new TreeMap<>();
        processing.put("format", assembly.format().wireId());
        processing.put("deduplicate", plan.deduplicate());
        processing.put("diversify", plan.diversify());
        processing.put("compress", assembly.compress());
        processing.put("summarize", assembly.summarize());
        processing.put("includeMetadata", assembly.includeMetadata());
        processing.put("includeEmbeddings", assembly.includeEmbeddings());
        processing.put("tokenCounter", assembly.tokenCounter().type().name());
        canonical.put("processing", processing);

        try {
            return canonicalMapper.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize request fingerprint", e);
        }
    }

    private static Map<String, Object> canonicalHints(ContextHints hints) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("relatedFiles", sorted(hints.relatedFiles()));
        canonical.put("relatedIssues", sorted(hints.relatedIssues()));
        canonical.put("recentCommits", sorted(hints.recentCommits()));
        canonical.put("language", hints.language() == null ? "" : hints.language().trim());
        canonical.put("framework", hints.framework() == null ? "" : hints.framework().trim());
        return canonical;
    }

    private static List<String> sorted(List<String> values) {
        return values.stream().map(String::trim).sorted().toList();
    }
}
