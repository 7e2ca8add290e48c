package com.business.deduplication.core.model;

/**
 * A data quality problem that excluded a record from comparison.
 *
 * @param position zero-based position of the record in the submitted list
 * @param recordId the record id, or {@code null} if the record had none
 * @param reason   human-readable reason
 */
public record RecordIssue(int position, String recordId, String reason) {

    @Override
    public String toString() {
        return "RecordIssue{position=" + position + ", recordId=" + recordId + ", reason='" + reason + "'}";
    }
}
