package com.business.deduplication.similarity;

import com.business.deduplication.core.model.RecordField;

/**
 * Per-field weights of the weighted mean used for match scoring.
 *
 * <p>Weights are relative: the scorer divides by the sum of the weights of the
 * fields actually compared, so they need not sum to 1.0.</p>
 */
public record FieldWeights(
        double name,
        double businessNumber,
        double phone,
        double email,
        double website,
        double address,
        double industry
) {
    public FieldWeights {
        double[] all = {name, businessNumber, phone, email, website, address, industry};
        double sum = 0.0;
        for (double w : all) {
            if (w < 0 || Double.isNaN(w) || Double.isInfinite(w)) {
                throw new IllegalArgumentException("Weights must be finite and non-negative, got " + w);
            }
            sum += w;
        }
        if (sum <= 0.0) {
            throw new IllegalArgumentException("At least one weight must be positive");
        }
    }

    /**
     * Business number 0.30, name 0.25, phone 0.15, email 0.10, website 0.10,
     * address 0.05, industry 0.05.
     */
    public static FieldWeights defaultWeights() {
        return new FieldWeights(0.25, 0.30, 0.15, 0.10, 0.10, 0.05, 0.05);
    }

    /**
     * Returns the weight of a comparable field.
     *
     * @throws IllegalArgumentException if the field does not take part in scoring
     */
    public double weightOf(RecordField field) {
        return switch (field) {
            case NAME -> name;
            case BUSINESS_NUMBER -> businessNumber;
            case PHONE -> phone;
            case EMAIL -> email;
            case WEBSITE -> website;
            case ADDRESS -> address;
            case INDUSTRY -> industry;
            default -> throw new IllegalArgumentException("Field " + field.key() + " has no weight");
        };
    }
}
