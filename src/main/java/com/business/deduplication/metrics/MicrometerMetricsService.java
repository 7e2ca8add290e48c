package com.business.deduplication.metrics;

import com.business.deduplication.core.model.MergeAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dedup.search.duration}: Timer</li>
 *   <li>{@code dedup.batch.duration}: Timer</li>
 *   <li>{@code dedup.candidates}: DistributionSummary of candidates per search</li>
 *   <li>{@code dedup.similarity.score}: DistributionSummary</li>
 *   <li>{@code dedup.duplicates.found}: Counter (tag: action)</li>
 *   <li>{@code dedup.records.merged}: Counter (tag: strategy)</li>
 *   <li>{@code dedup.records.skipped}: Counter</li>
 *   <li>{@code dedup.scorer.fallback}: Counter (tag: reason)</li>
 *   <li>{@code dedup.batch.size}: DistributionSummary</li>
 *   <li>{@code dedup.cache.hit} / {@code dedup.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer searchTimer;
    private final Timer batchTimer;
    private final DistributionSummary candidateSummary;
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter skippedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.searchTimer = Timer.builder("dedup.search.duration")
                .description("Duration of single-record duplicate searches")
                .register(registry);
        this.batchTimer = Timer.builder("dedup.batch.duration")
                .description("Duration of batch deduplication runs")
                .register(registry);
        this.candidateSummary = DistributionSummary.builder("dedup.candidates")
                .description("Number of candidates retrieved from the index per search")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("dedup.similarity.score")
                .description("Distribution of match scores")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("dedup.batch.size")
                .description("Number of records submitted per batch")
                .register(registry);
        this.skippedCounter = Counter.builder("dedup.records.skipped")
                .description("Records excluded from a batch for data quality issues")
                .register(registry);
        this.cacheHitCounter = Counter.builder("dedup.cache.hit")
                .description("Number of normalization cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("dedup.cache.miss")
                .description("Number of normalization cache misses")
                .register(registry);
    }

    @Override
    public void recordSearchDuration(Duration duration) {
        searchTimer.record(duration);
    }

    @Override
    public void recordBatchDuration(Duration duration) {
        batchTimer.record(duration);
    }

    @Override
    public void recordCandidateCount(int count) {
        candidateSummary.record(count);
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void incrementDuplicateFound(MergeAction action) {
        taggedCounter("dedup.duplicates.found", "Duplicates found by suggested action", "action", action.name())
                .increment();
    }

    @Override
    public void incrementRecordsMerged(String strategy) {
        taggedCounter("dedup.records.merged", "Records merged by strategy", "strategy", strategy)
                .increment();
    }

    @Override
    public void incrementRecordsSkipped() {
        skippedCounter.increment();
    }

    @Override
    public void incrementScorerFallback(String reason) {
        taggedCounter("dedup.scorer.fallback", "External scorer failures that fell back to algorithmic scoring",
                "reason", reason).increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter taggedCounter(String name, String description, String tag, String value) {
        return counterCache.computeIfAbsent(name + ":" + value, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tag, value)
                        .register(registry));
    }
}
