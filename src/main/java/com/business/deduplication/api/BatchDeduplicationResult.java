package com.business.deduplication.api;

import com.business.deduplication.core.model.DuplicateGroup;
import com.business.deduplication.core.model.MergedRecord;
import com.business.deduplication.core.model.RecordIssue;

import java.util.List;

/**
 * Result of a batch deduplication run.
 *
 * <p>{@code uniqueBusinesses == groups.size()} and
 * {@code duplicatesFound == totalProcessed - uniqueBusinesses}. Skipped records are
 * not part of {@code totalProcessed}.</p>
 *
 * @param totalProcessed   valid records compared
 * @param duplicatesFound  records folded into another record's group
 * @param uniqueBusinesses number of groups, singletons included
 * @param groups           groups in order of their first member's position
 * @param merged           one merged record per multi-member group when auto-merge is on
 * @param issues           records excluded for data quality problems
 */
public record BatchDeduplicationResult(
        int totalProcessed,
        int duplicatesFound,
        int uniqueBusinesses,
        List<DuplicateGroup> groups,
        List<MergedRecord> merged,
        List<RecordIssue> issues
) {
    public BatchDeduplicationResult {
        groups = groups != null ? List.copyOf(groups) : List.of();
        merged = merged != null ? List.copyOf(merged) : List.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
        if (uniqueBusinesses != groups.size()) {
            throw new IllegalArgumentException("uniqueBusinesses must equal the number of groups");
        }
        if (duplicatesFound != totalProcessed - uniqueBusinesses) {
            throw new IllegalArgumentException("duplicatesFound must equal totalProcessed - uniqueBusinesses");
        }
    }

    public int skipped() {
        return issues.size();
    }

    /**
     * Groups with more than one member.
     */
    public List<DuplicateGroup> duplicateGroups() {
        return groups.stream().filter(g -> !g.isSingleton()).toList();
    }
}
