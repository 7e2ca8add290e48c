package com.business.deduplication.similarity;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard similarity over whitespace tokens, insensitive to token order and repetition.
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (SimilarityAlgorithm.isBlank(s1) || SimilarityAlgorithm.isBlank(s2)) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        return jaccard(tokenize(s1), tokenize(s2));
    }

    @Override
    public String getName() {
        return "token";
    }

    /**
     * {@code |A ∩ B| / |A ∪ B|}; 0.0 when either set is empty.
     */
    public static double jaccard(Collection<String> a, Collection<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> left = a instanceof Set<String> s ? s : new HashSet<>(a);
        Set<String> right = b instanceof Set<String> s ? s : new HashSet<>(b);

        int intersection = 0;
        for (String token : left) {
            if (right.contains(token)) {
                intersection++;
            }
        }
        int union = left.size() + right.size() - intersection;
        return (double) intersection / union;
    }

    static Set<String> tokenize(String s) {
        Set<String> tokens = new HashSet<>();
        for (String token : s.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
