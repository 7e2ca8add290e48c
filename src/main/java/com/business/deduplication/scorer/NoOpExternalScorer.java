package com.business.deduplication.scorer;

import com.business.deduplication.core.model.BusinessRecord;

/**
 * Scorer used when no model is configured. It is never available, so deep checks
 * run on algorithmic scoring alone.
 */
public class NoOpExternalScorer implements ExternalScorer {

    @Override
    public double score(BusinessRecord first, BusinessRecord second) {
        throw new UnsupportedOperationException("No external scorer configured");
    }

    @Override
    public String name() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
