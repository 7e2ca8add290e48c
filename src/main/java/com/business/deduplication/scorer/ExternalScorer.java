package com.business.deduplication.scorer;

import com.business.deduplication.core.model.BusinessRecord;

/**
 * A pluggable scorer, typically backed by a trained model, consulted in deep-check mode.
 *
 * <p>Implementations must be thread-safe. The engine bounds every call with a timeout
 * and falls back to algorithmic scoring when the scorer fails, times out or returns a
 * value outside [0,1]. It always passes the two records in ascending id order.</p>
 */
public interface ExternalScorer {

    /**
     * Scores the likelihood that two records describe the same business.
     *
     * @return a value between 0.0 and 1.0
     */
    double score(BusinessRecord first, BusinessRecord second);

    /**
     * Returns the name of this scorer, used in logs and result notes.
     */
    String name();

    /**
     * Checks if the scorer is configured and ready.
     */
    default boolean isAvailable() {
        return true;
    }
}
