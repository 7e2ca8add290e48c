package com.business.deduplication.api;

import com.business.deduplication.bulk.ProgressCallback;
import com.business.deduplication.cache.CacheConfig;
import com.business.deduplication.core.model.Address;
import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.core.model.DuplicateGroup;
import com.business.deduplication.core.model.MatchAlgorithm;
import com.business.deduplication.core.model.MatchConfidence;
import com.business.deduplication.core.model.MatchResult;
import com.business.deduplication.core.model.MergeAction;
import com.business.deduplication.core.model.MergedRecord;
import com.business.deduplication.core.model.RecordField;
import com.business.deduplication.core.model.RecordIssue;
import com.business.deduplication.merge.MergeStrategyType;
import com.business.deduplication.metrics.MicrometerMetricsService;
import com.business.deduplication.scorer.ExternalScorer;
import com.business.deduplication.store.InMemoryRecordStore;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("DeduplicationEngine Tests")
class DeduplicationEngineTest {

    private InMemoryRecordStore store;
    private DeduplicationEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        engine = DeduplicationEngine.builder()
                .recordStore(store)
                .engineConfig(EngineConfig.defaults().withParallelism(4))
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private void seed(BusinessRecord... records) {
        for (BusinessRecord record : records) {
            store.save(record);
        }
        engine.indexAll();
    }

    private static BusinessRecord named(String id, String name) {
        return BusinessRecord.builder().id(id).name(name).build();
    }

    @Nested
    @DisplayName("findDuplicates")
    class FindDuplicates {

        @Test
        @DisplayName("Should find a name typo via string similarity")
        void nameTypo() {
            seed(named("1", "Indigenous Tech Solutions"), named("2", "Zenith Bakery"));

            DuplicateSearchResult result = engine.findDuplicates(named("q", "Indigenous Tech Solution"));

            assertFalse(result.hasError());
            assertEquals(1, result.duplicates().size());
            MatchResult match = result.duplicates().get(0);
            assertEquals("1", match.candidateId());
            assertTrue(match.score() > 0.9);
            assertEquals(MatchAlgorithm.STRING, match.algorithm());
        }

        @Test
        @DisplayName("Should find sound-alike and reordered names")
        void phoneticAndToken() {
            seed(named("1", "Smith Plumbing"), named("2", "Acme Widgets"));

            MatchResult phonetic = engine.findDuplicates(named("q1", "Smythe Plumbing")).best().orElseThrow();
            MatchResult token = engine.findDuplicates(named("q2", "Widgets Acme")).best().orElseThrow();

            assertEquals("1", phonetic.candidateId());
            assertEquals(MatchAlgorithm.PHONETIC, phonetic.algorithm());
            assertEquals("2", token.candidateId());
            assertEquals(MatchAlgorithm.TOKEN, token.algorithm());
        }

        @Test
        @DisplayName("Shared business number should be a certain match")
        void businessNumber() {
            seed(BusinessRecord.builder().id("1").name("Company A").businessNumber("123456789RC0001").build());

            MatchResult match = engine.findDuplicates(BusinessRecord.builder()
                    .id("q").name("Company A Ltd").businessNumber("123456789RC0001").build())
                    .best().orElseThrow();

            assertEquals(1.0, match.score());
            assertEquals(MatchConfidence.HIGH, match.confidence());
            assertEquals(MergeAction.MERGE, match.suggestedAction());
        }

        @Test
        @DisplayName("Phone formatting differences should still match")
        void phone() {
            seed(BusinessRecord.builder().id("1").name("Maple Dental").phone("+1 (555) 123-4567").build());

            MatchResult match = engine.findDuplicates(BusinessRecord.builder()
                    .id("q").name("Bright Smiles Dentistry").phone("5551234567").build())
                    .best().orElseThrow();

            assertEquals(1.0, match.detail(RecordField.PHONE));
            assertEquals(MatchAlgorithm.FIELD_EXACT, match.algorithm());
        }

        @Test
        @DisplayName("Website hosts should match across URL forms")
        void website() {
            seed(BusinessRecord.builder().id("1").name("Northwind Traders").website("https://www.northwind.com/about").build());

            MatchResult match = engine.findDuplicates(BusinessRecord.builder()
                    .id("q").name("Northwind Trading").website("northwind.com").build())
                    .best().orElseThrow();

            assertEquals(1.0, match.score());
            assertEquals(1.0, match.detail(RecordField.WEBSITE));
        }

        @Test
        @DisplayName("A shared email domain should only earn partial credit")
        void emailDomain() {
            seed(BusinessRecord.builder().id("1").name("Acme Widgets").email("info@acme.com").build());
            BusinessRecord query = BusinessRecord.builder().id("q").name("Acme Gadgets").email("sales@acme.com").build();

            DuplicateSearchResult strict = engine.findDuplicates(query);
            DuplicateSearchResult lenient = engine.findDuplicates(query, Map.of("threshold", 0.5));

            assertFalse(strict.hasDuplicates());
            MatchResult match = lenient.best().orElseThrow();
            assertEquals(0.5, match.detail(RecordField.EMAIL), 1e-9);
            assertEquals(MergeAction.MANUAL_REVIEW, match.suggestedAction());
        }

        @Test
        @DisplayName("Addresses should contribute after abbreviation expansion")
        void address() {
            seed(BusinessRecord.builder().id("1").name("Harbour Cafe")
                    .address(Address.of("12 Water St.", "Halifax", "NS", "B3J 1A1")).build());

            MatchResult match = engine.findDuplicates(BusinessRecord.builder().id("q").name("Harbour Café")
                    .address(Address.of("12 Water Street", "Halifax", "NS", "b3j1a1")).build())
                    .best().orElseThrow();

            assertEquals(1.0, match.detail(RecordField.ADDRESS), 1e-9);
            assertEquals(1.0, match.score(), 1e-9);
        }

        @Test
        @DisplayName("Results should be sorted by score then id")
        void ordering() {
            seed(named("b", "Acme Widgets"), named("a", "Acme Widgets"), named("c", "Acme Widget"));

            List<MatchResult> duplicates = engine.findDuplicates(named("q", "Acme Widgets")).duplicates();

            assertEquals(List.of("a", "b", "c"), duplicates.stream().map(MatchResult::candidateId).toList());
            assertTrue(duplicates.get(1).score() >= duplicates.get(2).score());
        }

        @Test
        @DisplayName("A name-only query should be compared safely")
        void minimalRecord() {
            seed(BusinessRecord.builder().id("1").name("Acme Widgets").phone("5551234567")
                    .email("info@acme.com").address(Address.of("1 Main St", "Toronto", "ON", null)).build());

            MatchResult match = engine.findDuplicates(BusinessRecord.builder().name("Acme Widgets").build())
                    .best().orElseThrow();

            assertEquals(1.0, match.score());
            assertEquals(List.of("nameMatch"), List.copyOf(match.matchDetails().keySet()));
        }

        @Test
        @DisplayName("An unusable query should yield an error result")
        void unusableQuery() {
            DuplicateSearchResult blank = engine.findDuplicates(BusinessRecord.builder().id("q").phone("555").build());
            DuplicateSearchResult missing = engine.findDuplicates((BusinessRecord) null);

            assertTrue(blank.hasError());
            assertTrue(blank.duplicates().isEmpty());
            assertTrue(missing.hasError());
        }

        @Test
        @DisplayName("Invalid options should fail before any work")
        void invalidOptions() {
            assertThrows(IllegalArgumentException.class,
                    () -> engine.findDuplicates(named("q", "Acme"), Map.of("threshold", 2.0)));
            assertThrows(IllegalArgumentException.class,
                    () -> engine.findDuplicates(named("q", "Acme"), Map.of("algorithms", List.of("neural"))));
        }

        @Test
        @DisplayName("Removed and deleted records should not be returned")
        void indexMaintenance() {
            seed(named("1", "Acme Widgets"), named("2", "Acme Widgets Ltd"));
            assertEquals(2, engine.indexedCount());

            assertTrue(engine.removeFromIndex("1"));
            store.delete("2");

            assertFalse(engine.findDuplicates(named("q", "Acme Widgets")).hasDuplicates());
            assertEquals(1, engine.indexedCount());
        }

        @Test
        @DisplayName("Re-indexing a changed record should use its new values")
        void reindex() {
            seed(named("1", "Acme Widgets"));
            BusinessRecord renamed = named("1", "Zenith Bakery");
            store.save(renamed);
            engine.index(renamed);

            assertFalse(engine.findDuplicates(named("q", "Acme Widgets")).hasDuplicates());
            assertTrue(engine.findDuplicates(named("q", "Zenith Bakery")).hasDuplicates());
            assertThrows(IllegalArgumentException.class, () -> engine.index(BusinessRecord.builder().name("x").build()));
        }
    }

    @Nested
    @DisplayName("External scorer")
    class External {

        private final BusinessRecord existing = named("1", "Complex Business Holdings");
        private final BusinessRecord query = named("q", "Complex Business Group");

        private DeduplicationEngine withScorer(ExternalScorer scorer) {
            InMemoryRecordStore scoredStore = new InMemoryRecordStore(List.of(existing));
            DeduplicationEngine scored = DeduplicationEngine.builder()
                    .recordStore(scoredStore)
                    .externalScorer(scorer)
                    .engineConfig(EngineConfig.defaults().withScorerTimeout(Duration.ofMillis(500)))
                    .build();
            scored.indexAll();
            return scored;
        }

        @Test
        @DisplayName("Deep check should blend in the external score")
        void deepCheckBlends() {
            ExternalScorer scorer = mock(ExternalScorer.class);
            when(scorer.isAvailable()).thenReturn(true);
            when(scorer.score(any(), any())).thenReturn(0.99);

            try (DeduplicationEngine scored = withScorer(scorer)) {
                DeduplicationOptions plain = DeduplicationOptions.builder().threshold(0.3).build();
                DeduplicationOptions deep = plain.toBuilder().deepCheck(true).build();

                double algorithmic = scored.findDuplicates(query, plain).best().orElseThrow().score();
                MatchResult blended = scored.findDuplicates(query, deep).best().orElseThrow();

                assertEquals(0.7 * algorithmic + 0.3 * 0.99, blended.score(), 1e-9);
                assertNull(blended.scorerNote());
                verify(scorer, times(1)).score(existing, query);
            }
        }

        @Test
        @DisplayName("A failing scorer should fall back with a note")
        void failingScorer() {
            ExternalScorer scorer = mock(ExternalScorer.class);
            when(scorer.isAvailable()).thenReturn(true);
            when(scorer.name()).thenReturn("flaky");
            when(scorer.score(any(), any())).thenThrow(new IllegalStateException("model unavailable"));

            try (DeduplicationEngine scored = withScorer(scorer)) {
                DeduplicationOptions deep = DeduplicationOptions.builder().threshold(0.3).deepCheck(true).build();

                MatchResult match = scored.findDuplicates(query, deep).best().orElseThrow();

                assertTrue(match.hasScorerFallback());
                assertTrue(match.scorerNote().contains("model unavailable"));
                assertNotEquals(MatchAlgorithm.ML, match.algorithm());
            }
        }
    }

    @Nested
    @DisplayName("deduplicateBatch")
    class Batch {

        private final BusinessRecord acme = BusinessRecord.builder().id("a").name("Acme Widgets").email("info@acme.com").build();
        private final BusinessRecord acmeInc = BusinessRecord.builder().id("b").name("Acme Widgets Inc").email("info@acme.com").build();
        private final BusinessRecord zenith = BusinessRecord.builder().id("c").name("Zenith Bakery").build();

        @Test
        @DisplayName("Should group duplicates and count unique businesses")
        void groups() {
            BatchDeduplicationResult result = engine.deduplicateBatch(List.of(acme, acmeInc, zenith));

            assertEquals(3, result.totalProcessed());
            assertEquals(2, result.uniqueBusinesses());
            assertEquals(1, result.duplicatesFound());
            assertEquals(List.of("a", "b"), result.groups().get(0).memberIds());
            assertEquals(List.of("c"), result.groups().get(1).memberIds());
            assertEquals(1, result.groups().get(0).evidence().size());
            assertTrue(result.merged().isEmpty());
            assertEquals(0, result.skipped());
        }

        @Test
        @DisplayName("Auto-merge should merge each group into its canonical record")
        void autoMerge() {
            BatchDeduplicationResult result = engine.deduplicateBatch(List.of(acme, acmeInc, zenith),
                    DeduplicationOptions.builder().autoMerge(true).build());

            assertEquals(1, result.merged().size());
            MergedRecord merged = result.merged().get(0);
            assertEquals("a", merged.id());
            assertEquals(List.of("b"), merged.mergedFrom());
            assertEquals("comprehensive", merged.strategy());
        }

        @Test
        @DisplayName("The most complete record should be canonical")
        void canonicalSelection() {
            BusinessRecord sparse = named("s", "Acme Widgets");
            BusinessRecord rich = BusinessRecord.builder().id("r").name("Acme Widgets Ltd")
                    .businessNumber("123456789").phone("4165550100").build();

            BatchDeduplicationResult result = engine.deduplicateBatch(List.of(sparse, rich),
                    Map.of("autoMerge", true, "strategy", "preservePrimary"));

            DuplicateGroup group = result.groups().get(0);
            assertEquals("r", group.canonicalId());
            assertEquals(List.of("s"), group.duplicateIds());
            assertEquals("Acme Widgets Ltd", result.merged().get(0).record().getName());
        }

        @Test
        @DisplayName("A verified record should be canonical even when sparser")
        void verifiedCanonical() {
            BusinessRecord verified = BusinessRecord.builder().id("v").name("Acme Widgets").verified(true).build();
            BusinessRecord rich = BusinessRecord.builder().id("r").name("Acme Widgets Ltd")
                    .businessNumber("123456789").phone("4165550100").email("info@acme.com").build();

            BatchDeduplicationResult result = engine.deduplicateBatch(List.of(rich, verified),
                    Map.of("autoMerge", true, "strategy", "preservePrimary"));

            DuplicateGroup group = result.groups().get(0);
            assertEquals("v", group.canonicalId());
            assertEquals(List.of("r"), group.duplicateIds());
            MergedRecord merged = result.merged().get(0);
            assertEquals("v", merged.id());
            assertEquals("Acme Widgets", merged.record().getName());
            assertEquals("123456789", merged.record().getBusinessNumber());
        }

        @ParameterizedTest(name = "batchSize={0}")
        @CsvSource({"7, 4", "10, 3", "25, 1", "100, 1"})
        @DisplayName("Progress should be reported after every chunk")
        void progressPerChunk(int batchSize, int expectedCalls) {
            List<BusinessRecord> records = generated(25);
            List<Long> processed = new ArrayList<>();
            List<Long> totals = new ArrayList<>();
            List<String> messages = new ArrayList<>();
            ProgressCallback progress = (done, total, message) -> {
                processed.add(done);
                totals.add(total);
                messages.add(message);
            };

            engine.deduplicateBatch(records, DeduplicationOptions.builder().batchSize(batchSize).build(), progress);

            assertEquals(expectedCalls, processed.size());
            assertEquals((long) Math.min(batchSize, 25), processed.get(0));
            assertEquals(25L, processed.get(processed.size() - 1));
            assertTrue(totals.stream().allMatch(t -> t == 25L));
            assertTrue(messages.get(messages.size() - 1).startsWith("Compared 25 of 25 records"),
                    messages.get(messages.size() - 1));
        }

        @Test
        @DisplayName("Skipped records should not count toward progress")
        void progressExcludesSkipped() {
            ProgressCallback progress = mock(ProgressCallback.class);

            engine.deduplicateBatch(Arrays.asList(acme, null, acmeInc, zenith), null, progress);

            verify(progress).onProgress(eq(3L), eq(3L), contains("1 matches"));
            verifyNoMoreInteractions(progress);
        }

        @Test
        @DisplayName("Matches should be transitive")
        void transitive() {
            BusinessRecord alpha = BusinessRecord.builder().id("1").name("Alpha Services").phone("416-555-0100").build();
            BusinessRecord bridge = BusinessRecord.builder().id("2").name("Alpha Services Group")
                    .phone("4165550100").email("office@omegaholdings.com").build();
            BusinessRecord omega = BusinessRecord.builder().id("3").name("Omega Holdings").email("office@omegaholdings.com").build();

            BatchDeduplicationResult result = engine.deduplicateBatch(List.of(alpha, bridge, omega));

            assertEquals(1, result.uniqueBusinesses());
            DuplicateGroup group = result.groups().get(0);
            assertEquals(List.of("1", "2", "3"), group.memberIds());
            assertEquals("2", group.canonicalId());
            assertEquals(2, group.evidence().size());
        }

        @Test
        @DisplayName("Invalid records should be skipped with an issue")
        void invalidRecords() {
            List<BusinessRecord> records = Arrays.asList(
                    acme,
                    null,
                    BusinessRecord.builder().name("No Id").build(),
                    BusinessRecord.builder().id("x").name("  ").build(),
                    acme.toBuilder().name("Acme Again").build());

            BatchDeduplicationResult result = engine.deduplicateBatch(records);

            assertEquals(1, result.totalProcessed());
            assertEquals(4, result.skipped());
            assertEquals(List.of(1, 2, 3, 4), result.issues().stream().map(RecordIssue::position).toList());
            assertEquals("duplicate id", result.issues().get(3).reason());
            assertEquals("a", result.issues().get(3).recordId());
        }

        @Test
        @DisplayName("An empty batch should produce an empty result")
        void emptyBatch() {
            BatchDeduplicationResult result = engine.deduplicateBatch(List.of());

            assertEquals(0, result.totalProcessed());
            assertTrue(result.groups().isEmpty());
        }

        @Test
        @DisplayName("Batch records should report matches among indexed records")
        void indexedMatches() {
            seed(BusinessRecord.builder().id("existing").name("Acme Widgets Corp").email("info@acme.com").build());

            BatchDeduplicationResult result = engine.deduplicateBatch(List.of(acme, zenith));

            assertEquals(List.of("existing"), result.groups().get(0).indexedMatchIds());
            assertTrue(result.groups().get(1).indexedMatchIds().isEmpty());
        }

        @Test
        @DisplayName("Results should be reproducible across runs and chunk sizes")
        void reproducible() {
            List<BusinessRecord> records = generated(200);

            BatchDeduplicationResult first = engine.deduplicateBatch(records, Map.of("batchSize", 7));
            BatchDeduplicationResult second = engine.deduplicateBatch(records, Map.of("batchSize", 100));

            assertEquals(first.groups().stream().map(DuplicateGroup::memberIds).toList(),
                    second.groups().stream().map(DuplicateGroup::memberIds).toList());
        }

        @Test
        @DisplayName("1000 records with 100 names should collapse to 100 businesses quickly")
        void largeBatch() {
            List<BusinessRecord> records = generated(1000);

            BatchDeduplicationResult result = assertTimeout(Duration.ofSeconds(60),
                    () -> engine.deduplicateBatch(records));

            assertEquals(1000, result.totalProcessed());
            assertEquals(100, result.uniqueBusinesses());
            assertEquals(900, result.duplicatesFound());
            assertTrue(result.groups().stream().allMatch(g -> g.size() == 10));
        }

        private List<BusinessRecord> generated(int count) {
            List<BusinessRecord> records = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                records.add(BusinessRecord.builder()
                        .id("rec-" + i)
                        .name("Business " + (i % 100))
                        .email("contact" + (i % 100) + "@example.com")
                        .phone(String.format("416555%04d", i))
                        .build());
            }
            return records;
        }
    }

    @Nested
    @DisplayName("mergeBusinesses")
    class Merge {

        @Test
        @DisplayName("Quality merge should pick the valid email of the better record")
        void qualityMerge() {
            BusinessRecord a = BusinessRecord.builder().id("a").name("Acme").email("invalid-email").confidence(0.4).build();
            BusinessRecord b = BusinessRecord.builder().id("b").name("Acme Inc").email("info@acme.com").confidence(0.9).build();

            MergedRecord merged = engine.mergeBusinesses(a, List.of(b), Map.of("strategy", "quality"));

            assertEquals("info@acme.com", merged.record().getEmail());
            assertEquals("a", merged.id());
            assertEquals(0.9, merged.record().getConfidence());
        }

        @Test
        @DisplayName("Default options should merge comprehensively")
        void defaultStrategy() {
            BusinessRecord a = BusinessRecord.builder().id("a").name("Acme").industry("retail").build();
            BusinessRecord b = BusinessRecord.builder().id("b").name("Acme").industry("wholesale").verified(true).build();

            MergedRecord merged = engine.mergeBusinesses(a, List.of(b));

            assertEquals(MergeStrategyType.COMPREHENSIVE.key(), merged.strategy());
            assertEquals(2, merged.record().getIndustry().size());
            assertTrue(merged.record().isVerified());
        }
    }

    @Test
    @DisplayName("Should publish metrics and cache statistics")
    void metricsAndCache() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try (DeduplicationEngine metered = DeduplicationEngine.builder()
                .metricsService(new MicrometerMetricsService(registry))
                .cacheConfig(CacheConfig.of(1000, 60))
                .build()) {
            BusinessRecord record = named("a", "Acme Widgets");
            metered.deduplicateBatch(List.of(record, named("b", "Acme Widgets Ltd")));
            metered.deduplicateBatch(List.of(record));

            DistributionSummary batchSize = registry.find("dedup.batch.size").summary();
            assertNotNull(batchSize);
            assertEquals(2, batchSize.count());
            assertNotNull(registry.find("dedup.duplicates.found").tag("action", "MERGE").counter());
            assertTrue(metered.getCacheStats().hitCount() >= 1);
        }
    }
}
