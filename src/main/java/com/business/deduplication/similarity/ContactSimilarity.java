package com.business.deduplication.similarity;

/**
 * Partial-credit comparison of normalized contact fields.
 * Inputs are expected in {@code FieldNormalizer} form.
 */
public class ContactSimilarity {

    static final double SAME_DOMAIN_BASE = 0.5;
    static final double SUBDOMAIN = 0.9;
    static final double WEBSITE_BASE_FACTOR = 0.8;
    static final double PHONE_CONTAINED = 0.9;
    static final double PHONE_SAME_LOCAL = 0.8;
    static final int PHONE_LOCAL_DIGITS = 7;

    private final LevenshteinSimilarity levenshtein;

    public ContactSimilarity() {
        this(new LevenshteinSimilarity());
    }

    public ContactSimilarity(LevenshteinSimilarity levenshtein) {
        this.levenshtein = levenshtein;
    }

    /**
     * Same domain scores {@code 0.5 + 0.5 * localPartSimilarity}; different domains score 0.
     */
    public double email(String email1, String email2) {
        if (SimilarityAlgorithm.isBlank(email1) || SimilarityAlgorithm.isBlank(email2)) {
            return 0.0;
        }
        if (email1.equals(email2)) {
            return 1.0;
        }
        int at1 = email1.lastIndexOf('@');
        int at2 = email2.lastIndexOf('@');
        if (at1 < 0 || at2 < 0) {
            return 0.0;
        }
        String domain1 = email1.substring(at1 + 1);
        String domain2 = email2.substring(at2 + 1);
        if (domain1.isEmpty() || !domain1.equals(domain2)) {
            return 0.0;
        }
        double local = levenshtein.compute(email1.substring(0, at1), email2.substring(0, at2));
        return SAME_DOMAIN_BASE + SAME_DOMAIN_BASE * local;
    }

    /**
     * Hosts in a subdomain relation score 0.9; otherwise 0.8 times the similarity
     * of the host labels before the first dot.
     */
    public double website(String host1, String host2) {
        if (SimilarityAlgorithm.isBlank(host1) || SimilarityAlgorithm.isBlank(host2)) {
            return 0.0;
        }
        if (host1.equals(host2)) {
            return 1.0;
        }
        if (host1.endsWith("." + host2) || host2.endsWith("." + host1)) {
            return SUBDOMAIN;
        }
        return WEBSITE_BASE_FACTOR * levenshtein.compute(firstLabel(host1), firstLabel(host2));
    }

    /**
     * Digit strings where one contains the other score 0.9 (extensions); same last
     * seven digits score 0.8.
     */
    public double phone(String digits1, String digits2) {
        if (SimilarityAlgorithm.isBlank(digits1) || SimilarityAlgorithm.isBlank(digits2)) {
            return 0.0;
        }
        if (digits1.equals(digits2)) {
            return 1.0;
        }
        String shorter = digits1.length() <= digits2.length() ? digits1 : digits2;
        String longer = shorter == digits1 ? digits2 : digits1;
        if (shorter.length() >= PHONE_LOCAL_DIGITS && longer.contains(shorter)) {
            return PHONE_CONTAINED;
        }
        if (shorter.length() >= PHONE_LOCAL_DIGITS
                && lastDigits(digits1).equals(lastDigits(digits2))) {
            return PHONE_SAME_LOCAL;
        }
        return 0.0;
    }

    private static String firstLabel(String host) {
        int dot = host.indexOf('.');
        return dot < 0 ? host : host.substring(0, dot);
    }

    private static String lastDigits(String digits) {
        return digits.substring(digits.length() - PHONE_LOCAL_DIGITS);
    }
}
