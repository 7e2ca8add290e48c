package com.business.deduplication.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing of the normalization cache.
 *
 * @param maxEntries      entries kept before Caffeine starts evicting
 * @param expireAfterIdle entries untouched for this long are dropped
 * @param enabled         false selects the pass-through cache
 */
public record CacheConfig(long maxEntries, Duration expireAfterIdle, boolean enabled) {

    public CacheConfig {
        Objects.requireNonNull(expireAfterIdle, "expireAfterIdle is required");
        if (enabled && maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        if (enabled && (expireAfterIdle.isZero() || expireAfterIdle.isNegative())) {
            throw new IllegalArgumentException("expireAfterIdle must be positive, got " + expireAfterIdle);
        }
    }

    /**
     * An enabled cache of {@code maxEntries} entries that expire after {@code idleSeconds}.
     */
    public static CacheConfig of(long maxEntries, long idleSeconds) {
        return new CacheConfig(maxEntries, Duration.ofSeconds(idleSeconds), true);
    }

    /**
     * 50,000 snapshots, ten idle minutes.
     */
    public static CacheConfig defaults() {
        return of(50_000, 600);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(0, Duration.ZERO, false);
    }
}
