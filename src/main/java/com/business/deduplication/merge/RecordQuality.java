package com.business.deduplication.merge;

import com.business.deduplication.core.model.BusinessRecord;

/**
 * Completeness and quality scoring of records, used to pick canonical records and
 * to rank field values in the quality strategy.
 */
public final class RecordQuality {

    /**
     * Highest possible completeness score.
     */
    public static final int MAX_COMPLETENESS = 8;

    private static final int VERIFIED_BONUS = 10;

    private RecordQuality() {
    }

    /**
     * Name 1, business number 2, phone 1, email 1, website 1, street 1, description 1.
     */
    public static int completeness(BusinessRecord record) {
        int score = 0;
        if (record.getName() != null) score += 1;
        if (record.getBusinessNumber() != null) score += 2;
        if (record.getPhone() != null) score += 1;
        if (record.getEmail() != null) score += 1;
        if (record.getWebsite() != null) score += 1;
        if (record.getAddress() != null && record.getAddress().street() != null) score += 1;
        if (record.getDescription() != null) score += 1;
        return score;
    }

    /**
     * Rank of a record as the canonical member of a group. A verified record outranks
     * any unverified one; completeness decides otherwise.
     */
    public static int canonicalRank(BusinessRecord record) {
        return (record.isVerified() ? VERIFIED_BONUS : 0) + completeness(record);
    }

    public static double completenessRatio(BusinessRecord record) {
        return (double) completeness(record) / MAX_COMPLETENESS;
    }

    /**
     * The record's own confidence when present, otherwise its completeness ratio.
     */
    public static double qualityScore(BusinessRecord record) {
        return record.getConfidence() != null ? record.getConfidence() : completenessRatio(record);
    }
}
