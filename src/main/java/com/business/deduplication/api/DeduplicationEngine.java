package com.business.deduplication.api;

import com.business.deduplication.bulk.ProgressCallback;
import com.business.deduplication.cache.CacheConfig;
import com.business.deduplication.cache.CacheStats;
import com.business.deduplication.cache.CaffeineNormalizationCache;
import com.business.deduplication.cache.NoOpNormalizationCache;
import com.business.deduplication.cache.NormalizationCache;
import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.core.model.DuplicateGroup;
import com.business.deduplication.core.model.MatchResult;
import com.business.deduplication.core.model.MergedRecord;
import com.business.deduplication.core.model.RecordIssue;
import com.business.deduplication.index.BlockingKeyStrategy;
import com.business.deduplication.index.CandidateIndex;
import com.business.deduplication.index.DefaultBlockingKeyStrategy;
import com.business.deduplication.logging.LogContext;
import com.business.deduplication.match.MatchScorer;
import com.business.deduplication.merge.MergeEngine;
import com.business.deduplication.merge.RecordQuality;
import com.business.deduplication.metrics.MetricsService;
import com.business.deduplication.metrics.NoOpMetricsService;
import com.business.deduplication.rules.FieldNormalizer;
import com.business.deduplication.rules.FieldValidator;
import com.business.deduplication.rules.NormalizationTables;
import com.business.deduplication.rules.NormalizedRecord;
import com.business.deduplication.scorer.ExternalScorer;
import com.business.deduplication.scorer.NoOpExternalScorer;
import com.business.deduplication.scorer.TimeBoundedScorer;
import com.business.deduplication.similarity.FieldWeights;
import com.business.deduplication.store.InMemoryRecordStore;
import com.business.deduplication.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for business deduplication.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * InMemoryRecordStore store = new InMemoryRecordStore(existingRecords);
 * try (DeduplicationEngine engine = DeduplicationEngine.builder()
 *         .recordStore(store)
 *         .build()) {
 *     engine.indexAll();
 *
 *     // Single search against the indexed records
 *     DuplicateSearchResult result = engine.findDuplicates(incoming);
 *
 *     // Batch clustering
 *     BatchDeduplicationResult batch = engine.deduplicateBatch(records,
 *             DeduplicationOptions.builder().autoMerge(true).build());
 * }
 * </pre>
 *
 * <p>The engine is safe for concurrent use. Batch comparisons run on a fixed worker
 * pool sized by {@link EngineConfig#parallelism()}; clustering is sequential, so
 * batch results are reproducible for the same input and options.</p>
 */
public class DeduplicationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DeduplicationEngine.class);

    private final RecordStore store;
    private final FieldNormalizer normalizer;
    private final NormalizationCache cache;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final CandidateIndex index;
    private final MatchScorer matchScorer;
    private final TimeBoundedScorer externalScorer;
    private final MergeEngine mergeEngine;
    private final MetricsService metrics;
    private final EngineConfig engineConfig;
    private final DeduplicationOptions defaultOptions;
    private final ExecutorService workers;

    private DeduplicationEngine(Builder builder) {
        this.store = builder.recordStore != null ? builder.recordStore : new InMemoryRecordStore();
        this.metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.engineConfig = builder.engineConfig != null ? builder.engineConfig : EngineConfig.defaults();
        this.defaultOptions = builder.defaultOptions != null ? builder.defaultOptions : DeduplicationOptions.defaults();

        NormalizationTables tables = builder.normalizationTables != null
                ? builder.normalizationTables : NormalizationTables.defaults();
        this.normalizer = new FieldNormalizer(tables);

        CacheConfig cacheConfig = builder.cacheConfig != null ? builder.cacheConfig : CacheConfig.defaults();
        this.cache = cacheConfig.enabled()
                ? new CaffeineNormalizationCache(cacheConfig, metrics)
                : new NoOpNormalizationCache();

        this.blockingKeyStrategy = builder.blockingKeyStrategy != null
                ? builder.blockingKeyStrategy : new DefaultBlockingKeyStrategy();
        this.index = new CandidateIndex(blockingKeyStrategy);

        ExternalScorer scorer = builder.externalScorer != null ? builder.externalScorer : new NoOpExternalScorer();
        this.externalScorer = new TimeBoundedScorer(scorer, engineConfig.scorerTimeout(),
                engineConfig.scorerThreads(), metrics);

        FieldWeights weights = builder.fieldWeights != null ? builder.fieldWeights : FieldWeights.defaultWeights();
        this.matchScorer = new MatchScorer(weights, externalScorer);
        this.mergeEngine = new MergeEngine(new FieldValidator(normalizer), metrics);

        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(engineConfig.parallelism(), r -> {
            Thread t = new Thread(r, "dedup-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("engine.initialized parallelism={} scorer={} scorerAvailable={} cacheEnabled={}",
                engineConfig.parallelism(), scorer.name(), externalScorer.isAvailable(), cacheConfig.enabled());
    }

    // ========== Index API ==========

    /**
     * Adds or refreshes a record in the shared candidate index. The record must also
     * be resolvable through the record store to be returned as a candidate.
     *
     * @throws IllegalArgumentException if the record has no id
     */
    public void index(BusinessRecord record) {
        Objects.requireNonNull(record, "record is required");
        if (!record.hasId()) {
            throw new IllegalArgumentException("Cannot index a record without an id");
        }
        cache.invalidate(record.getId());
        index.index(normalize(record));
    }

    /**
     * Indexes every record in the store. Records without an id or name are skipped.
     *
     * @return number of records indexed
     */
    public int indexAll() {
        int indexed = 0;
        for (BusinessRecord record : store.list()) {
            if (!record.hasId() || isBlank(record.getName())) {
                log.warn("index.skipped recordId={} reason=missing id or name", record.getId());
                metrics.incrementRecordsSkipped();
                continue;
            }
            index(record);
            indexed++;
        }
        log.info("index.rebuilt records={} keys={}", indexed, index.keyCount());
        return indexed;
    }

    public boolean removeFromIndex(String id) {
        cache.invalidate(id);
        return index.remove(id);
    }

    // ========== Search API ==========

    public DuplicateSearchResult findDuplicates(BusinessRecord record) {
        return findDuplicates(record, defaultOptions);
    }

    /**
     * Parses loosely typed options first.
     *
     * @throws IllegalArgumentException if the options are invalid
     */
    public DuplicateSearchResult findDuplicates(BusinessRecord record, Map<String, ?> options) {
        return findDuplicates(record, DeduplicationOptions.fromMap(options));
    }

    /**
     * Finds indexed records that duplicate {@code record}, best match first.
     * A record without a usable name yields an empty result with an error message.
     */
    public DuplicateSearchResult findDuplicates(BusinessRecord record, DeduplicationOptions options) {
        DeduplicationOptions opts = options != null ? options : defaultOptions;
        if (record == null) {
            return DuplicateSearchResult.error("record is required", opts);
        }
        if (isBlank(record.getName())) {
            log.debug("search.rejected recordId={} reason=blank name", record.getId());
            return DuplicateSearchResult.error("record name is required", opts);
        }

        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forSearch(LogContext.generateCorrelationId(), record.getId())) {
            NormalizedRecord query = normalize(record);
            Set<String> candidateIds = index.candidates(query);
            metrics.recordCandidateCount(candidateIds.size());

            List<MatchResult> matches = new ArrayList<>();
            for (String candidateId : candidateIds) {
                Optional<BusinessRecord> candidate = store.get(candidateId);
                if (candidate.isEmpty()) {
                    log.debug("index.stale candidateId={}", candidateId);
                    continue;
                }
                MatchResult match = matchScorer.compare(query, normalize(candidate.get()), opts);
                metrics.recordSimilarityScore(match.score());
                if (match.score() >= opts.getThreshold()) {
                    matches.add(match);
                    metrics.incrementDuplicateFound(match.suggestedAction());
                }
            }
            matches.sort(BY_SCORE_THEN_ID);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordSearchDuration(elapsed);
            log.debug("search.completed candidates={} duplicates={} durationMs={}",
                    candidateIds.size(), matches.size(), elapsed.toMillis());
            return DuplicateSearchResult.of(matches, opts);
        }
    }

    // ========== Batch API ==========

    public BatchDeduplicationResult deduplicateBatch(List<BusinessRecord> records) {
        return deduplicateBatch(records, defaultOptions);
    }

    /**
     * @throws IllegalArgumentException if the options are invalid
     */
    public BatchDeduplicationResult deduplicateBatch(List<BusinessRecord> records, Map<String, ?> options) {
        return deduplicateBatch(records, DeduplicationOptions.fromMap(options));
    }

    /**
     * Clusters the batch into groups of duplicates.
     *
     * <p>Each valid record is compared with the earlier valid records that share a
     * blocking key, and with matching records in the shared index. Match edges are
     * unioned in input order, so groups are transitive and ordered by the position of
     * their first member.</p>
     */
    public BatchDeduplicationResult deduplicateBatch(List<BusinessRecord> records, DeduplicationOptions options) {
        return deduplicateBatch(records, options, ProgressCallback.NOOP);
    }

    /**
     * Same as {@link #deduplicateBatch(List, DeduplicationOptions)}, reporting progress after
     * every {@code batchSize} chunk of comparisons. {@code total} is the number of valid records.
     */
    public BatchDeduplicationResult deduplicateBatch(List<BusinessRecord> records, DeduplicationOptions options,
                                                     ProgressCallback progress) {
        Objects.requireNonNull(records, "records is required");
        ProgressCallback cb = progress != null ? progress : ProgressCallback.NOOP;
        DeduplicationOptions opts = options != null ? options : defaultOptions;
        String batchId = LogContext.generateCorrelationId();
        long start = System.nanoTime();

        try (LogContext ignored = LogContext.forBatch(batchId, records.size())) {
            log.info("batch.started records={} batchSize={} autoMerge={}",
                    records.size(), opts.getBatchSize(), opts.isAutoMerge());
            metrics.recordBatchSize(records.size());

            List<RecordIssue> issues = new ArrayList<>();
            List<BusinessRecord> valid = validate(records, issues);

            List<NormalizedRecord> normalized = new ArrayList<>(valid.size());
            Map<String, Integer> positions = new HashMap<>();
            CandidateIndex batchIndex = new CandidateIndex(blockingKeyStrategy);
            for (int i = 0; i < valid.size(); i++) {
                NormalizedRecord n = normalize(valid.get(i));
                normalized.add(n);
                positions.put(n.id(), i);
                batchIndex.index(n);
            }

            List<Comparisons> comparisons = compareAll(normalized, positions, batchIndex, opts, cb);

            DuplicateClusterer clusterer = new DuplicateClusterer(valid.size());
            for (Comparisons c : comparisons) {
                for (BatchEdge edge : c.edges()) {
                    clusterer.union(edge.earlier(), c.position());
                }
            }

            List<DuplicateGroup> groups = buildGroups(clusterer.groups(), valid, comparisons);
            List<MergedRecord> merged = opts.isAutoMerge() ? mergeGroups(groups, valid, positions, opts) : List.of();

            int totalProcessed = valid.size();
            BatchDeduplicationResult result = new BatchDeduplicationResult(
                    totalProcessed, totalProcessed - groups.size(), groups.size(), groups, merged, issues);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordBatchDuration(elapsed);
            log.info("batch.completed totalProcessed={} uniqueBusinesses={} duplicatesFound={} merged={} skipped={} durationMs={}",
                    result.totalProcessed(), result.uniqueBusinesses(), result.duplicatesFound(),
                    merged.size(), result.skipped(), elapsed.toMillis());
            return result;
        }
    }

    private List<BusinessRecord> validate(List<BusinessRecord> records, List<RecordIssue> issues) {
        List<BusinessRecord> valid = new ArrayList<>(records.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < records.size(); i++) {
            BusinessRecord record = records.get(i);
            String reason = null;
            if (record == null) {
                reason = "record is null";
            } else if (!record.hasId() || record.getId().isBlank()) {
                reason = "missing id";
            } else if (isBlank(record.getName())) {
                reason = "missing name";
            } else if (!seen.add(record.getId())) {
                reason = "duplicate id";
            }
            if (reason != null) {
                String id = record != null ? record.getId() : null;
                issues.add(new RecordIssue(i, id, reason));
                metrics.incrementRecordsSkipped();
                log.warn("batch.record.skipped position={} recordId={} reason={}", i, id, reason);
            } else {
                valid.add(record);
            }
        }
        return valid;
    }

    /**
     * Runs the comparisons chunk by chunk on the worker pool. Results come back in
     * position order regardless of completion order.
     */
    private List<Comparisons> compareAll(List<NormalizedRecord> normalized, Map<String, Integer> positions,
                                         CandidateIndex batchIndex, DeduplicationOptions opts,
                                         ProgressCallback progress) {
        List<Comparisons> all = new ArrayList<>(normalized.size());
        int matches = 0;
        int chunkSize = opts.getBatchSize();
        for (int from = 0; from < normalized.size(); from += chunkSize) {
            int to = Math.min(from + chunkSize, normalized.size());
            List<Callable<Comparisons>> tasks = new ArrayList<>(to - from);
            for (int i = from; i < to; i++) {
                int position = i;
                tasks.add(() -> compareOne(position, normalized, positions, batchIndex, opts));
            }
            try {
                for (Future<Comparisons> future : workers.invokeAll(tasks)) {
                    Comparisons c = future.get();
                    matches += c.edges().size();
                    all.add(c);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Batch deduplication interrupted", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Batch comparison failed", e.getCause());
            }
            log.debug("batch.chunk.completed from={} to={} matches={}", from, to, matches);
            progress.onProgress(to, normalized.size(), "Compared " + to + " of " + normalized.size()
                    + " records, " + matches + " matches");
        }
        return all;
    }

    private Comparisons compareOne(int position, List<NormalizedRecord> normalized, Map<String, Integer> positions,
                                   CandidateIndex batchIndex, DeduplicationOptions opts) {
        NormalizedRecord record = normalized.get(position);

        List<Integer> earlier = new ArrayList<>();
        for (String id : batchIndex.candidates(record)) {
            int other = positions.get(id);
            if (other < position) {
                earlier.add(other);
            }
        }
        earlier.sort(Comparator.naturalOrder());

        List<BatchEdge> edges = new ArrayList<>();
        for (int other : earlier) {
            MatchResult match = matchScorer.compare(record, normalized.get(other), opts);
            metrics.recordSimilarityScore(match.score());
            if (match.score() >= opts.getThreshold()) {
                edges.add(new BatchEdge(other, match));
                metrics.incrementDuplicateFound(match.suggestedAction());
            }
        }

        List<String> indexedMatches = new ArrayList<>();
        Set<String> shared = index.candidates(record);
        if (!shared.isEmpty()) {
            List<String> ids = new ArrayList<>(shared);
            ids.sort(Comparator.naturalOrder());
            for (String id : ids) {
                if (positions.containsKey(id)) {
                    continue;
                }
                Optional<BusinessRecord> indexed = store.get(id);
                if (indexed.isEmpty()) {
                    log.debug("index.stale candidateId={}", id);
                    continue;
                }
                MatchResult match = matchScorer.compare(record, normalize(indexed.get()), opts);
                if (match.score() >= opts.getThreshold()) {
                    indexedMatches.add(id);
                }
            }
        }
        return new Comparisons(position, edges, indexedMatches);
    }

    private List<DuplicateGroup> buildGroups(List<List<Integer>> components, List<BusinessRecord> valid,
                                             List<Comparisons> comparisons) {
        List<DuplicateGroup> groups = new ArrayList<>(components.size());
        for (List<Integer> members : components) {
            List<String> memberIds = new ArrayList<>(members.size());
            int canonical = members.get(0);
            int bestRank = -1;
            List<DuplicateGroup.Link> evidence = new ArrayList<>();
            Set<String> indexedMatchIds = new LinkedHashSet<>();

            for (int position : members) {
                BusinessRecord record = valid.get(position);
                memberIds.add(record.getId());
                int rank = RecordQuality.canonicalRank(record);
                if (rank > bestRank) {
                    bestRank = rank;
                    canonical = position;
                }
                Comparisons c = comparisons.get(position);
                for (BatchEdge edge : c.edges()) {
                    evidence.add(new DuplicateGroup.Link(
                            valid.get(edge.earlier()).getId(), record.getId(), edge.match()));
                }
                indexedMatchIds.addAll(c.indexedMatches());
            }
            groups.add(new DuplicateGroup(memberIds, valid.get(canonical).getId(), evidence,
                    new ArrayList<>(indexedMatchIds)));
        }
        return groups;
    }

    private List<MergedRecord> mergeGroups(List<DuplicateGroup> groups, List<BusinessRecord> valid,
                                           Map<String, Integer> positions, DeduplicationOptions opts) {
        List<MergedRecord> merged = new ArrayList<>();
        for (DuplicateGroup group : groups) {
            if (group.isSingleton()) {
                continue;
            }
            BusinessRecord primary = valid.get(positions.get(group.canonicalId()));
            List<BusinessRecord> duplicates = group.duplicateIds().stream()
                    .map(id -> valid.get(positions.get(id)))
                    .toList();
            merged.add(mergeEngine.merge(primary, duplicates, opts.getMergeStrategy()));
        }
        return merged;
    }

    // ========== Merge API ==========

    public MergedRecord mergeBusinesses(BusinessRecord primary, List<BusinessRecord> duplicates) {
        return mergeBusinesses(primary, duplicates, defaultOptions);
    }

    /**
     * @throws IllegalArgumentException if the options are invalid
     */
    public MergedRecord mergeBusinesses(BusinessRecord primary, List<BusinessRecord> duplicates,
                                        Map<String, ?> options) {
        return mergeBusinesses(primary, duplicates, DeduplicationOptions.fromMap(options));
    }

    /**
     * Merges {@code duplicates} into {@code primary} with the options' merge strategy.
     */
    public MergedRecord mergeBusinesses(BusinessRecord primary, List<BusinessRecord> duplicates,
                                        DeduplicationOptions options) {
        DeduplicationOptions opts = options != null ? options : defaultOptions;
        return mergeEngine.merge(primary, duplicates, opts.getMergeStrategy());
    }

    // ========== Accessors ==========

    public DeduplicationOptions getDefaultOptions() {
        return defaultOptions;
    }

    public EngineConfig getEngineConfig() {
        return engineConfig;
    }

    public FieldNormalizer getNormalizer() {
        return normalizer;
    }

    public MergeEngine getMergeEngine() {
        return mergeEngine;
    }

    public int indexedCount() {
        return index.size();
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    private NormalizedRecord normalize(BusinessRecord record) {
        return cache.get(record, normalizer::normalize);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        externalScorer.close();
        log.info("engine.closed");
    }

    private static final Comparator<MatchResult> BY_SCORE_THEN_ID = Comparator
            .comparingDouble(MatchResult::score).reversed()
            .thenComparing(MatchResult::candidateId, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * A match from a batch record back to an earlier batch position.
     */
    private record BatchEdge(int earlier, MatchResult match) {
    }

    private record Comparisons(int position, List<BatchEdge> edges, List<String> indexedMatches) {
    }

    // ========== Builder ==========

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RecordStore recordStore;
        private ExternalScorer externalScorer;
        private NormalizationTables normalizationTables;
        private FieldWeights fieldWeights;
        private CacheConfig cacheConfig;
        private MetricsService metricsService;
        private EngineConfig engineConfig;
        private DeduplicationOptions defaultOptions;
        private BlockingKeyStrategy blockingKeyStrategy;

        /**
         * Source of indexed records. Defaults to an empty {@link InMemoryRecordStore}.
         */
        public Builder recordStore(RecordStore recordStore) {
            this.recordStore = recordStore;
            return this;
        }

        /**
         * Optional scorer consulted in deep-check mode or when {@code ml} is selected.
         */
        public Builder externalScorer(ExternalScorer externalScorer) {
            this.externalScorer = externalScorer;
            return this;
        }

        public Builder normalizationTables(NormalizationTables normalizationTables) {
            this.normalizationTables = normalizationTables;
            return this;
        }

        public Builder fieldWeights(FieldWeights fieldWeights) {
            this.fieldWeights = fieldWeights;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder engineConfig(EngineConfig engineConfig) {
            this.engineConfig = engineConfig;
            return this;
        }

        public Builder defaultOptions(DeduplicationOptions defaultOptions) {
            this.defaultOptions = defaultOptions;
            return this;
        }

        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        public DeduplicationEngine build() {
            return new DeduplicationEngine(this);
        }
    }
}
