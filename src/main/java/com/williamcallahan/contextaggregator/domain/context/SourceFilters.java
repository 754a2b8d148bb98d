package com.williamcallahan.contextaggregator.domain.context;

import java.time.Instant;
import java.util.List;

/**
 * Optional narrowing passed to a backend alongside the query text.
 *
 * @param filePaths restrict to these paths
 * @param languages restrict to these languages
 * @param from earliest content date
 * @param to latest content date
 */
public record SourceFilters(List<String> filePaths, List<String> languages, Instant from, Instant to) {

    public SourceFilters {
        filePaths = filePaths == null ? List.of() : List.copyOf(filePaths);
        languages = languages == null ? List.of() : List.copyOf(languages);
    }

    public static SourceFilters none() {
        return new SourceFilters(List.of(), List.of(), null, null);
    }

    /**
     * Derives filters from request hints: the hint language and related files.
     *
     * @param hints request hints
     * @return filters, possibly empty
     */
    public static SourceFilters fromHints(ContextHints hints) {
        if (hints == null) {
            return none();
        }
        List<String> languages = hints.language() == null || hints.language().isBlank()
                ? List.of()
                : List.of(hints.language());
        return new SourceFilters(hints.relatedFiles(), languages, null, null);
    }

    public boolean isEmpty() {
        return filePaths.isEmpty() && languages.isEmpty() && from == null && to == null;
    }
}
