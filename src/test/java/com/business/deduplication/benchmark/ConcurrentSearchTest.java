package com.business.deduplication.benchmark;

import com.business.deduplication.api.DeduplicationEngine;
import com.business.deduplication.api.DuplicateSearchResult;
import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.store.InMemoryRecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent searches and index updates against one engine.
 * Not a JMH benchmark; collects latency percentiles and asserts thread safety.
 */
class ConcurrentSearchTest {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentSearchTest.class);

    private static final int THREAD_COUNT = 16;
    private static final int OPS_PER_THREAD = 100;
    private static final int SEEDED = 1000;

    private InMemoryRecordStore store;
    private DeduplicationEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        for (int i = 0; i < SEEDED; i++) {
            store.save(BusinessRecord.builder()
                    .id("seed-" + i)
                    .name("Company " + i + " Plumbing")
                    .phone(String.format("905%07d", i))
                    .build());
        }
        engine = DeduplicationEngine.builder().recordStore(store).build();
        engine.indexAll();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    @DisplayName("Concurrent searches and indexing should be thread-safe")
    void concurrentSearchAndIndex() throws Exception {
        AtomicInteger found = new AtomicInteger();
        AtomicInteger errors = new AtomicInteger();
        List<Long> latencies = Collections.synchronizedList(new ArrayList<>());

        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < THREAD_COUNT; t++) {
            final int threadId = t;
            futures.add(executor.submit(() -> {
                for (int i = 0; i < OPS_PER_THREAD; i++) {
                    long start = System.nanoTime();
                    try {
                        if (i % 10 == 0) {
                            BusinessRecord added = BusinessRecord.builder()
                                    .id("added-" + threadId + "-" + i)
                                    .name("Added " + threadId + " Roofing " + i)
                                    .build();
                            store.save(added);
                            engine.index(added);
                        } else {
                            int target = (threadId * OPS_PER_THREAD + i) % SEEDED;
                            DuplicateSearchResult result = engine.findDuplicates(BusinessRecord.builder()
                                    .name("Company " + target + " Plumbing Inc")
                                    .phone(String.format("905%07d", target))
                                    .build());
                            if (result.best().map(m -> m.candidateId().equals("seed-" + target)).orElse(false)) {
                                found.incrementAndGet();
                            }
                        }
                    } catch (RuntimeException e) {
                        log.error("Search failed", e);
                        errors.incrementAndGet();
                    } finally {
                        latencies.add(System.nanoTime() - start);
                    }
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        int searches = THREAD_COUNT * OPS_PER_THREAD * 9 / 10;
        assertEquals(0, errors.get());
        assertEquals(searches, found.get());
        assertEquals(SEEDED + THREAD_COUNT * OPS_PER_THREAD / 10, engine.indexedCount());

        long[] sorted = latencies.stream().mapToLong(Long::longValue).sorted().toArray();
        log.info("Concurrent search latency: p50={}us p95={}us p99={}us",
                sorted[sorted.length / 2] / 1000,
                sorted[(int) (sorted.length * 0.95)] / 1000,
                sorted[(int) (sorted.length * 0.99)] / 1000);
    }
}
