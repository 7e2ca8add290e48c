package com.business.deduplication.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A cluster of batch records judged to describe one business.
 *
 * @param memberIds       member ids in input order
 * @param canonicalId     the representative member
 * @param evidence        pairwise matches that joined the members
 * @param indexedMatchIds ids of previously indexed records that matched a member
 */
public record DuplicateGroup(
        List<String> memberIds,
        String canonicalId,
        List<Link> evidence,
        List<String> indexedMatchIds
) {
    public DuplicateGroup {
        memberIds = List.copyOf(memberIds);
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        if (!memberIds.contains(canonicalId)) {
            throw new IllegalArgumentException("canonicalId must be a member: " + canonicalId);
        }
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        indexedMatchIds = indexedMatchIds != null ? List.copyOf(indexedMatchIds) : List.of();
    }

    public int size() {
        return memberIds.size();
    }

    public boolean isSingleton() {
        return memberIds.size() == 1;
    }

    public boolean contains(String recordId) {
        return memberIds.contains(recordId);
    }

    /**
     * Ids of the non-canonical members.
     */
    public List<String> duplicateIds() {
        return memberIds.stream().filter(id -> !id.equals(canonicalId)).toList();
    }

    /**
     * One pairwise match between two members.
     */
    public record Link(String leftId, String rightId, MatchResult match) {
    }
}
