package com.business.deduplication.metrics;

import com.business.deduplication.core.model.MergeAction;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSearchDuration(Duration duration) {
    }

    @Override
    public void recordBatchDuration(Duration duration) {
    }

    @Override
    public void recordCandidateCount(int count) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void incrementDuplicateFound(MergeAction action) {
    }

    @Override
    public void incrementRecordsMerged(String strategy) {
    }

    @Override
    public void incrementRecordsSkipped() {
    }

    @Override
    public void incrementScorerFallback(String reason) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
