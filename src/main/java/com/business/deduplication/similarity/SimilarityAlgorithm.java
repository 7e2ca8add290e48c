package com.business.deduplication.similarity;

/**
 * Scores two already-normalized field values in [0.0, 1.0].
 *
 * <p>Implementations must be stateless and symmetric: identical non-blank values score 1.0,
 * and a blank or missing value on either side scores 0.0.</p>
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    /**
     * Short label used in match details and log lines.
     */
    String getName();

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
