package com.business.deduplication.bulk;

/**
 * Receives progress of long-running work: an import every 100 records and once when the
 * input is exhausted, a batch deduplication after each chunk of comparisons.
 */
@FunctionalInterface
public interface ProgressCallback {

    ProgressCallback NOOP = (processed, total, message) -> {};

    /**
     * @param processed records handled so far, failed ones included
     * @param total     records in the input, or -1 while it is still being read
     */
    void onProgress(long processed, long total, String message);
}
