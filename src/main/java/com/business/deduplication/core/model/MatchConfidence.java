package com.business.deduplication.core.model;

/**
 * Tiered confidence label of a match.
 */
public enum MatchConfidence {
    HIGH,
    MEDIUM,
    LOW;

    public String key() {
        return name().toLowerCase();
    }
}
