package com.business.deduplication.index;

import com.business.deduplication.rules.NormalizedRecord;

import java.util.Set;

/**
 * Strategy for generating blocking keys from a normalized record.
 *
 * <p>Records that share at least one key are candidates for full comparison. Keys
 * should be coarse enough to keep likely duplicates together and fine enough to
 * keep the candidate set small.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * Generates the blocking keys of a record.
     *
     * @return set of keys (never null, may be empty)
     */
    Set<String> generateKeys(NormalizedRecord record);
}
