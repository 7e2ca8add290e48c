package com.business.deduplication.cache;

import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.rules.NormalizedRecord;

import java.util.function.Function;

/**
 * Cache that always recomputes. Used when caching is disabled.
 */
public class NoOpNormalizationCache implements NormalizationCache {

    @Override
    public NormalizedRecord get(BusinessRecord record, Function<BusinessRecord, NormalizedRecord> normalizer) {
        return normalizer.apply(record);
    }

    @Override
    public void invalidate(String recordId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
