package com.business.deduplication.cache;

import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.metrics.MetricsService;
import com.business.deduplication.metrics.NoOpMetricsService;
import com.business.deduplication.rules.NormalizedRecord;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Caffeine-backed normalization cache with a record id index for targeted invalidation.
 */
public class CaffeineNormalizationCache implements NormalizationCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineNormalizationCache.class);

    private final Cache<BusinessRecord, NormalizedRecord> cache;
    private final ConcurrentMap<String, Set<BusinessRecord>> keysById = new ConcurrentHashMap<>();
    private final MetricsService metrics;

    public CaffeineNormalizationCache(CacheConfig config) {
        this(config, new NoOpMetricsService());
    }

    public CaffeineNormalizationCache(CacheConfig config, MetricsService metrics) {
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxEntries())
                .expireAfterAccess(config.expireAfterIdle())
                .recordStats()
                .evictionListener((BusinessRecord key, NormalizedRecord value, RemovalCause cause) -> {
                    if (key != null && key.getId() != null) {
                        keysById.computeIfPresent(key.getId(), (id, keys) -> {
                            keys.remove(key);
                            return keys.isEmpty() ? null : keys;
                        });
                    }
                })
                .build();
        log.info("cache.initialized type=normalization maxEntries={} expireAfterIdle={}",
                config.maxEntries(), config.expireAfterIdle());
    }

    @Override
    public NormalizedRecord get(BusinessRecord record, Function<BusinessRecord, NormalizedRecord> normalizer) {
        boolean[] loaded = {false};
        NormalizedRecord result = cache.get(record, r -> {
            loaded[0] = true;
            return normalizer.apply(r);
        });
        if (loaded[0]) {
            metrics.recordCacheMiss();
            if (record.getId() != null) {
                keysById.computeIfAbsent(record.getId(), k -> ConcurrentHashMap.newKeySet()).add(record);
            }
        } else {
            metrics.recordCacheHit();
        }
        return result;
    }

    @Override
    public void invalidate(String recordId) {
        Set<BusinessRecord> keys = keysById.remove(recordId);
        if (keys != null) {
            cache.invalidateAll(keys);
            log.debug("cache.invalidated recordId={} entries={}", recordId, keys.size());
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        keysById.clear();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
