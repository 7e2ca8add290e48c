package com.business.deduplication.cache;

import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.rules.NormalizedRecord;

import java.util.function.Function;

/**
 * Cache of normalized snapshots, keyed by record value. A changed record is a new key,
 * so entries never go stale; invalidation only frees memory.
 */
public interface NormalizationCache {

    /**
     * Returns the cached snapshot of the record, computing it with {@code normalizer} on a miss.
     */
    NormalizedRecord get(BusinessRecord record, Function<BusinessRecord, NormalizedRecord> normalizer);

    /**
     * Drops every entry for the given record id.
     */
    void invalidate(String recordId);

    void invalidateAll();

    CacheStats getStats();
}
