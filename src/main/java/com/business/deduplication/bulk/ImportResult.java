package com.business.deduplication.bulk;

import java.util.List;

/**
 * Result of a bulk record import.
 *
 * @param totalRecords number of records read from the input
 * @param imported     number of records stored
 * @param replaced     number of stored records that replaced an existing id
 * @param errors       records that could not be imported
 */
public record ImportResult(
        long totalRecords,
        long imported,
        long replaced,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record that failed to import.
     *
     * @param lineNumber 1-based line of the record in the input, or 0 for stream-level errors
     * @param recordId   the record id if it could be read
     * @param message    the error message
     */
    public record ImportError(long lineNumber, String recordId, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", imported=" + imported +
                ", replaced=" + replaced +
                ", errors=" + errors.size() + '}';
    }
}
