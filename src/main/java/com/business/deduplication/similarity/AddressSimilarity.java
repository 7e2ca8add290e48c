package com.business.deduplication.similarity;

import com.business.deduplication.rules.NormalizedRecord;

/**
 * Component-weighted address comparison over normalized addresses.
 *
 * <p>Only components present on both sides count; the score is their weighted mean:
 * street 0.40 (best of token and edit similarity), city 0.20, province 0.15 (exact),
 * postal code 0.25 (exact 1.0, same forward sortation area 0.5).</p>
 */
public class AddressSimilarity {

    static final double STREET_WEIGHT = 0.40;
    static final double CITY_WEIGHT = 0.20;
    static final double PROVINCE_WEIGHT = 0.15;
    static final double POSTAL_WEIGHT = 0.25;
    static final int FSA_LENGTH = 3;

    private final LevenshteinSimilarity levenshtein;
    private final TokenSetSimilarity tokens;

    public AddressSimilarity() {
        this(new LevenshteinSimilarity(), new TokenSetSimilarity());
    }

    public AddressSimilarity(LevenshteinSimilarity levenshtein, TokenSetSimilarity tokens) {
        this.levenshtein = levenshtein;
        this.tokens = tokens;
    }

    /**
     * Returns the weighted mean, or 0.0 when the addresses share no populated component.
     */
    public double compute(NormalizedRecord a, NormalizedRecord b) {
        double total = 0.0;
        double weights = 0.0;

        if (both(a.street(), b.street())) {
            total += STREET_WEIGHT * Math.max(
                    levenshtein.compute(a.street(), b.street()),
                    tokens.compute(a.street(), b.street()));
            weights += STREET_WEIGHT;
        }
        if (both(a.city(), b.city())) {
            total += CITY_WEIGHT * levenshtein.compute(a.city(), b.city());
            weights += CITY_WEIGHT;
        }
        if (both(a.province(), b.province())) {
            total += PROVINCE_WEIGHT * (a.province().equals(b.province()) ? 1.0 : 0.0);
            weights += PROVINCE_WEIGHT;
        }
        if (both(a.postalCode(), b.postalCode())) {
            total += POSTAL_WEIGHT * postalCode(a.postalCode(), b.postalCode());
            weights += POSTAL_WEIGHT;
        }
        return weights == 0.0 ? 0.0 : total / weights;
    }

    /**
     * Returns true if at least one address component is populated on both sides.
     */
    public boolean comparable(NormalizedRecord a, NormalizedRecord b) {
        return both(a.street(), b.street()) || both(a.city(), b.city())
                || both(a.province(), b.province()) || both(a.postalCode(), b.postalCode());
    }

    double postalCode(String p1, String p2) {
        if (p1.equals(p2)) {
            return 1.0;
        }
        if (p1.length() >= FSA_LENGTH && p2.length() >= FSA_LENGTH
                && p1.substring(0, FSA_LENGTH).equals(p2.substring(0, FSA_LENGTH))) {
            return 0.5;
        }
        return 0.0;
    }

    private static boolean both(String s1, String s2) {
        return !s1.isEmpty() && !s2.isEmpty();
    }
}
