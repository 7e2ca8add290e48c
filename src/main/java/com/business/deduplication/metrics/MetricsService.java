package com.business.deduplication.metrics;

import com.business.deduplication.core.model.MergeAction;

import java.time.Duration;

/**
 * Interface for recording deduplication metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordSearchDuration(Duration duration);

    void recordBatchDuration(Duration duration);

    void recordCandidateCount(int count);

    void recordSimilarityScore(double score);

    void incrementDuplicateFound(MergeAction action);

    void incrementRecordsMerged(String strategy);

    void incrementRecordsSkipped();

    void incrementScorerFallback(String reason);

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
