package com.williamcallahan.contextaggregator.domain.context;

import java.util.List;

/**
 * Retrieval hints supplied by the caller to narrow what backends search for.
 *
 * @param relatedFiles file paths the task is known to touch
 * @param relatedIssues issue references related to the task
 * @param language primary programming language
 * @param framework primary framework
 * @param recentCommits recent commit identifiers or messages
 */
public record ContextHints(
        List<String> relatedFiles,
        List<String> relatedIssues,
        String language,
        String framework,
        List<String> recentCommits) {

    public ContextHints {
        relatedFiles = relatedFiles == null ? List.of() : List.copyOf(relatedFiles);
        relatedIssues = relatedIssues == null ? List.of() : List.copyOf(relatedIssues);
        recentCommits = recentCommits == null ? List.of() : List.copyOf(recentCommits);
    }

    public static ContextHints none() {
        return new ContextHints(List.of(), List.of(), null, null, List.of());
    }
}
