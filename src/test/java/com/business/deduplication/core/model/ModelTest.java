package com.business.deduplication.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Core model Tests")
class ModelTest {

    @Nested
    @DisplayName("BusinessRecord")
    class BusinessRecordTests {

        @Test
        @DisplayName("Blank values should be stored as null and trimmed otherwise")
        void blankToNull() {
            BusinessRecord record = BusinessRecord.builder()
                    .id("  ")
                    .name("  Acme Widgets ")
                    .phone("")
                    .address(Address.of(" ", null, "", null))
                    .industry("retail", " ", null)
                    .build();

            assertNull(record.getId());
            assertFalse(record.hasId());
            assertEquals("Acme Widgets", record.getName());
            assertNull(record.getPhone());
            assertNull(record.getAddress());
            assertEquals(Set.of("retail"), record.getIndustry());
        }

        @ParameterizedTest
        @ValueSource(doubles = {-0.1, 1.5, Double.NaN})
        @DisplayName("Confidence outside [0, 1] should be rejected")
        void confidenceValidation(double confidence) {
            assertThrows(IllegalArgumentException.class,
                    () -> BusinessRecord.builder().confidence(confidence));
        }

        @Test
        @DisplayName("toBuilder should copy every field")
        void toBuilderCopies() {
            BusinessRecord record = BusinessRecord.builder()
                    .id("1").name("Acme").businessType("retail").businessNumber("123456789")
                    .phone("4165550100").email("info@acme.com").website("acme.com")
                    .address(Address.of("1 Main St", "Toronto", "ON", "M5V 3A8"))
                    .description("Widgets").industry("retail", "wholesale")
                    .confidence(0.7).verified(true)
                    .build();

            BusinessRecord copy = record.toBuilder().build();

            assertEquals(record, copy);
            assertEquals(record.hashCode(), copy.hashCode());
            assertNotEquals(record, record.toBuilder().phone("4165550199").build());
        }

        @Test
        @DisplayName("Industry tags should be immutable")
        void industryImmutable() {
            BusinessRecord record = BusinessRecord.builder().id("1").name("Acme").industry("retail").build();

            assertThrows(UnsupportedOperationException.class, () -> record.getIndustry().add("food"));
        }
    }

    @Nested
    @DisplayName("RecordField and MatchAlgorithm")
    class Keys {

        @ParameterizedTest
        @CsvSource({
                "name, NAME, nameMatch",
                "businessNumber, BUSINESS_NUMBER, businessNumberMatch",
                "phone, PHONE, phoneMatch",
                "address, ADDRESS, addressMatch"
        })
        @DisplayName("Field keys should resolve and produce detail keys")
        void fieldKeys(String key, RecordField expected, String detailKey) {
            RecordField field = RecordField.fromKey(key);

            assertEquals(expected, field);
            assertEquals(detailKey, field.detailKey());
        }

        @Test
        @DisplayName("Informational fields should not be comparable")
        void informationalFields() {
            assertThrows(IllegalArgumentException.class, () -> RecordField.comparableFromKey("description"));
            assertThrows(IllegalArgumentException.class, () -> RecordField.fromKey("fax"));
            assertFalse(RecordField.comparableFields().contains(RecordField.CONFIDENCE));
            assertEquals(7, RecordField.comparableFields().size());
        }

        @Test
        @DisplayName("Generic accessors should read and write fields")
        void genericAccessors() {
            BusinessRecord.Builder builder = BusinessRecord.builder().id("1");
            RecordField.NAME.set(builder, "Acme");
            RecordField.INDUSTRY.set(builder, List.of("retail"));
            BusinessRecord record = builder.build();

            assertEquals("Acme", RecordField.NAME.get(record));
            assertTrue(RecordField.INDUSTRY.isPresent(record));
            assertFalse(RecordField.EMAIL.isPresent(record));
        }

        @Test
        @DisplayName("Custom should not be selectable by name")
        void algorithmKeys() {
            assertEquals(MatchAlgorithm.FIELD_EXACT, MatchAlgorithm.fromKey("field-exact"));
            assertEquals(MatchAlgorithm.ML, MatchAlgorithm.fromKey("ml"));
            assertThrows(IllegalArgumentException.class, () -> MatchAlgorithm.fromKey("custom"));
        }
    }

    @Nested
    @DisplayName("Results")
    class Results {

        @Test
        @DisplayName("MatchResult should reject scores outside [0, 1]")
        void matchResultValidation() {
            assertThrows(IllegalArgumentException.class, () -> new MatchResult("1", 1.2, MatchConfidence.HIGH,
                    MatchAlgorithm.STRING, Map.of(), MergeAction.MERGE, null));
            assertThrows(IllegalArgumentException.class, () -> new MatchResult("1", Double.NaN, MatchConfidence.LOW,
                    MatchAlgorithm.STRING, Map.of(), MergeAction.KEEP_BOTH, null));
        }

        @Test
        @DisplayName("MatchResult should expose field details by field")
        void matchResultDetails() {
            MatchResult result = new MatchResult("1", 0.85, MatchConfidence.MEDIUM, MatchAlgorithm.TOKEN,
                    Map.of("nameMatch", 0.85), MergeAction.MARK_DUPLICATE, "scorer timed out");

            assertEquals(0.85, result.detail(RecordField.NAME));
            assertNull(result.detail(RecordField.PHONE));
            assertFalse(result.hasDetail(RecordField.PHONE));
            assertTrue(result.hasScorerFallback());
            assertEquals("2", result.withCandidateId("2").candidateId());
        }

        @Test
        @DisplayName("DuplicateGroup canonical id must be a member")
        void groupCanonicalMember() {
            assertThrows(IllegalArgumentException.class,
                    () -> new DuplicateGroup(List.of("a", "b"), "c", null, null));

            DuplicateGroup group = new DuplicateGroup(List.of("a", "b", "c"), "b", null, null);
            assertEquals(List.of("a", "c"), group.duplicateIds());
            assertEquals(3, group.size());
            assertFalse(group.isSingleton());
            assertTrue(group.evidence().isEmpty());
        }

        @Test
        @DisplayName("Address completeness should count populated components")
        void addressCompleteness() {
            Address address = Address.of("1 Main St", "Toronto", null, "M5V 3A8");

            assertEquals(3, address.populatedComponents());
            assertEquals("1 Main St, Toronto, M5V 3A8", address.format());
            assertTrue(Address.of(null, " ", null, null).isEmpty());
        }
    }
}
