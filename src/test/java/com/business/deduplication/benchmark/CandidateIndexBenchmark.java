package com.business.deduplication.benchmark;

import com.business.deduplication.api.DeduplicationOptions;
import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.core.model.MatchResult;
import com.business.deduplication.index.CandidateIndex;
import com.business.deduplication.match.MatchScorer;
import com.business.deduplication.rules.FieldNormalizer;
import com.business.deduplication.rules.NormalizedRecord;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks comparing a full scan against candidate-index retrieval for a
 * single duplicate search at different store sizes.
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class CandidateIndexBenchmark {

    private static final String[] WORDS = {
            "Acme", "Maple", "Northwind", "Harbour", "Summit", "Pioneer", "Cedar", "Granite",
            "Zenith", "Atlas", "Beacon", "Falcon", "Orchard", "Prairie", "Riverside", "Aurora"
    };
    private static final String[] TRADES = {
            "Plumbing", "Bakery", "Dental", "Consulting", "Widgets", "Logistics", "Roofing", "Catering"
    };

    @Param({"1000", "10000", "50000"})
    private int recordCount;

    private List<NormalizedRecord> records;
    private Map<String, NormalizedRecord> byId;
    private CandidateIndex index;
    private MatchScorer scorer;
    private FieldNormalizer normalizer;
    private DeduplicationOptions options;
    private int queryCounter;

    @Setup(Level.Trial)
    public void setUp() {
        normalizer = new FieldNormalizer();
        scorer = new MatchScorer();
        options = DeduplicationOptions.defaults();
        index = new CandidateIndex();
        records = new ArrayList<>(recordCount);
        byId = new HashMap<>();

        Random random = new Random(42);
        for (int i = 0; i < recordCount; i++) {
            BusinessRecord record = BusinessRecord.builder()
                    .id("rec-" + i)
                    .name(WORDS[random.nextInt(WORDS.length)] + " " + WORDS[random.nextInt(WORDS.length)] + " "
                            + TRADES[random.nextInt(TRADES.length)] + " " + i)
                    .phone(String.format("416%07d", i))
                    .build();
            NormalizedRecord normalized = normalizer.normalize(record);
            records.add(normalized);
            byId.put(normalized.id(), normalized);
            index.index(normalized);
        }
        queryCounter = 0;
    }

    private NormalizedRecord nextQuery() {
        NormalizedRecord target = records.get(queryCounter++ % recordCount);
        BusinessRecord query = target.source().toBuilder()
                .id("query")
                .name(target.source().getName() + " Inc")
                .build();
        return normalizer.normalize(query);
    }

    /**
     * Scores the query against every stored record.
     */
    @Benchmark
    public void fullScan(Blackhole bh) {
        NormalizedRecord query = nextQuery();
        MatchResult best = null;
        for (NormalizedRecord candidate : records) {
            MatchResult result = scorer.compare(query, candidate, options);
            if (best == null || result.score() > best.score()) {
                best = result;
            }
        }
        bh.consume(best);
    }

    /**
     * Scores the query only against records that share a blocking key.
     */
    @Benchmark
    public void indexedCandidates(Blackhole bh) {
        NormalizedRecord query = nextQuery();
        MatchResult best = null;
        for (String id : index.candidates(query)) {
            MatchResult result = scorer.compare(query, byId.get(id), options);
            if (best == null || result.score() > best.score()) {
                best = result;
            }
        }
        bh.consume(best);
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(CandidateIndexBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
