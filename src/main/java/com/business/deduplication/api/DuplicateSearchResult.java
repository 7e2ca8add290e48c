package com.business.deduplication.api;

import com.business.deduplication.core.model.MatchResult;

import java.util.List;
import java.util.Optional;

/**
 * Result of a single-record duplicate search.
 *
 * @param duplicates matches at or above the threshold, best first
 * @param config     the options the search ran with
 * @param error      why the query record could not be searched, or {@code null}
 */
public record DuplicateSearchResult(
        List<MatchResult> duplicates,
        DeduplicationOptions config,
        String error
) {
    public DuplicateSearchResult {
        duplicates = duplicates != null ? List.copyOf(duplicates) : List.of();
    }

    public static DuplicateSearchResult of(List<MatchResult> duplicates, DeduplicationOptions config) {
        return new DuplicateSearchResult(duplicates, config, null);
    }

    public static DuplicateSearchResult error(String error, DeduplicationOptions config) {
        return new DuplicateSearchResult(List.of(), config, error);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean hasDuplicates() {
        return !duplicates.isEmpty();
    }

    public Optional<MatchResult> best() {
        return duplicates.isEmpty() ? Optional.empty() : Optional.of(duplicates.get(0));
    }
}
