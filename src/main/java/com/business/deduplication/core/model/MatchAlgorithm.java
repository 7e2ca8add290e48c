package com.business.deduplication.core.model;

import java.util.Arrays;

/**
 * Scorer families that can produce a field score. The key is the name used in
 * the {@code algorithms} option and in {@link MatchResult#algorithm()}.
 */
public enum MatchAlgorithm {
    /**
     * Edit-distance similarity, plus contact-field partial credit.
     */
    STRING("string", true),

    /**
     * Token-set (Jaccard) similarity, order insensitive.
     */
    TOKEN("token", true),

    /**
     * Double Metaphone / Soundex code comparison.
     */
    PHONETIC("phonetic", true),

    /**
     * Component-weighted address comparison.
     */
    ADDRESS("address", true),

    /**
     * Exact equality of a normalized strong identifier.
     */
    FIELD_EXACT("field-exact", true),

    /**
     * The injected external scorer, used in deep-check mode.
     */
    ML("ml", true),

    /**
     * A caller-supplied comparator. Not selectable through the options.
     */
    CUSTOM("custom", false);

    private final String key;
    private final boolean selectable;

    MatchAlgorithm(String key, boolean selectable) {
        this.key = key;
        this.selectable = selectable;
    }

    public String key() {
        return key;
    }

    public boolean isSelectable() {
        return selectable;
    }

    /**
     * Resolves a selectable algorithm from its option key.
     *
     * @throws IllegalArgumentException for an unknown or non-selectable name
     */
    public static MatchAlgorithm fromKey(String key) {
        for (MatchAlgorithm algorithm : values()) {
            if (algorithm.selectable && algorithm.key.equals(key)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown algorithm: '" + key + "'. Known algorithms: "
                + Arrays.toString(Arrays.stream(values())
                .filter(MatchAlgorithm::isSelectable)
                .map(MatchAlgorithm::key)
                .toArray()));
    }

    @Override
    public String toString() {
        return key;
    }
}
