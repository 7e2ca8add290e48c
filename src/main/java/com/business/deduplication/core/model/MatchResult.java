package com.business.deduplication.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of comparing a record against one candidate.
 *
 * <p>{@code matchDetails} holds one score per field that had data on both sides,
 * keyed by {@link RecordField#detailKey()}. Fields missing on either side are
 * absent from the map.</p>
 */
public record MatchResult(
        String candidateId,
        double score,
        MatchConfidence confidence,
        MatchAlgorithm algorithm,
        Map<String, Double> matchDetails,
        MergeAction suggestedAction,
        String scorerNote
) {
    public MatchResult {
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
        Objects.requireNonNull(confidence, "confidence is required");
        Objects.requireNonNull(algorithm, "algorithm is required");
        Objects.requireNonNull(suggestedAction, "suggestedAction is required");
        matchDetails = matchDetails != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(matchDetails))
                : Map.of();
    }

    /**
     * Returns the score reported for a field, or {@code null} if the field was not compared.
     */
    public Double detail(RecordField field) {
        return matchDetails.get(field.detailKey());
    }

    public boolean hasDetail(RecordField field) {
        return matchDetails.containsKey(field.detailKey());
    }

    /**
     * Returns true if the external scorer failed or timed out for this pair.
     */
    public boolean hasScorerFallback() {
        return scorerNote != null;
    }

    /**
     * Copy of this result attributed to a different candidate id.
     */
    public MatchResult withCandidateId(String newCandidateId) {
        return new MatchResult(newCandidateId, score, confidence, algorithm, matchDetails,
                suggestedAction, scorerNote);
    }

    @Override
    public String toString() {
        return String.format("MatchResult{candidate=%s, score=%.4f, confidence=%s, algorithm=%s, action=%s, details=%s}",
                candidateId, score, confidence, algorithm, suggestedAction, matchDetails);
    }
}
