package com.business.deduplication.scorer;

/**
 * Result of one bounded external scorer call: either a score, or a note explaining
 * why algorithmic scoring was used instead.
 */
public record ScorerOutcome(Double score, String note) {

    public static ScorerOutcome success(double score) {
        return new ScorerOutcome(score, null);
    }

    public static ScorerOutcome fallback(String note) {
        return new ScorerOutcome(null, note);
    }

    public boolean isSuccess() {
        return score != null;
    }
}
