package com.business.deduplication.similarity;

import java.util.List;

/**
 * Detects a name written as the initials of another, e.g. {@code ibm} and
 * {@code international business machines}.
 */
public class AbbreviationMatcher {

    static final double ABBREVIATION_SCORE = 0.9;

    /**
     * Returns 0.9 if either name is the initials of the other, otherwise 0.0.
     */
    public double compute(String name1, String name2) {
        if (SimilarityAlgorithm.isBlank(name1) || SimilarityAlgorithm.isBlank(name2) || name1.equals(name2)) {
            return 0.0;
        }
        return isAbbreviation(name1, name2) || isAbbreviation(name2, name1) ? ABBREVIATION_SCORE : 0.0;
    }

    /**
     * True if {@code shortForm}, ignoring spaces, spells the first letters of the
     * tokens of {@code longForm}, which must have at least two tokens.
     */
    public boolean isAbbreviation(String shortForm, String longForm) {
        List<String> tokens = List.of(longForm.trim().split("\\s+"));
        String letters = shortForm.replaceAll("\\s", "");
        if (tokens.size() < 2 || letters.length() != tokens.size()) {
            return false;
        }
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).isEmpty() || tokens.get(i).charAt(0) != letters.charAt(i)) {
                return false;
            }
        }
        return true;
    }
}
