package com.business.deduplication.cache;

/**
 * Point-in-time counters of a normalization cache.
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    private static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0);

    public long requestCount() {
        return hitCount + missCount;
    }

    /**
     * Share of lookups served from the cache; 0.0 before the first lookup.
     */
    public double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) hitCount / requests;
    }

    public static CacheStats empty() {
        return EMPTY;
    }
}
