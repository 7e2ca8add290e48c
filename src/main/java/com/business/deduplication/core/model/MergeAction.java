package com.business.deduplication.core.model;

/**
 * Action suggested for a scored pair.
 */
public enum MergeAction {
    /**
     * Score at or above the auto-merge threshold.
     */
    MERGE,

    /**
     * Duplicate with moderate confidence; link the records but keep both.
     */
    MARK_DUPLICATE,

    /**
     * Strong identifiers disagree; a person should decide.
     */
    MANUAL_REVIEW,

    /**
     * Not a duplicate.
     */
    KEEP_BOTH
}
