package com.business.deduplication.similarity;

/**
 * 1.0 on equal normalized values, otherwise 0.0. Used for strong identifiers.
 */
public class ExactFieldSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (SimilarityAlgorithm.isBlank(s1) || SimilarityAlgorithm.isBlank(s2)) {
            return 0.0;
        }
        return s1.equals(s2) ? 1.0 : 0.0;
    }

    @Override
    public String getName() {
        return "field-exact";
    }
}
