package com.business.deduplication.rules;

import com.business.deduplication.core.model.RecordField;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the built-in normalization rules from a set of {@link NormalizationTables}.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with the default rules for the given tables.
     */
    public static NormalizationEngine createEngine(NormalizationTables tables) {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getCommonRules());
        engine.addRules(getNameRules(tables));
        engine.addRules(getAddressRules(tables));
        return engine;
    }

    /**
     * Rules shared by every text field.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // Combining marks left behind by NFD decomposition
                NormalizationRule.builder()
                        .name("common-diacritics")
                        .pattern("\\p{InCombiningDiacriticalMarks}+")
                        .replacement("")
                        .priority(5)
                        .build(),

                NormalizationRule.builder()
                        .name("common-apostrophe")
                        .pattern("['‘’`]")
                        .replacement("")
                        .applicableFields(RecordField.NAME, RecordField.INDUSTRY, RecordField.ADDRESS)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("common-punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement(" ")
                        .applicableFields(RecordField.NAME, RecordField.INDUSTRY, RecordField.ADDRESS)
                        .priority(30)
                        .build()
        );
    }

    /**
     * Connector removal, legal suffix stripping and leading article removal.
     * Industry tags get the connector rules only.
     */
    public static List<NormalizationRule> getNameRules(NormalizationTables tables) {
        List<NormalizationRule> rules = new ArrayList<>();

        List<String> wordConnectors = tables.connectors().stream()
                .filter(DefaultNormalizationRules::isWord)
                .toList();
        List<String> symbolConnectors = tables.connectors().stream()
                .filter(c -> !isWord(c))
                .toList();

        if (!symbolConnectors.isEmpty()) {
            // Runs before punctuation removal so that '&' is still there to match
            rules.add(NormalizationRule.builder()
                    .name("name-connector-symbols")
                    .pattern("\\s*(?:" + alternation(symbolConnectors) + ")\\s*")
                    .replacement(" ")
                    .applicableFields(RecordField.NAME, RecordField.INDUSTRY)
                    .priority(20)
                    .build());
        }
        if (!wordConnectors.isEmpty()) {
            rules.add(NormalizationRule.builder()
                    .name("name-connector-words")
                    .wholeWords(wordConnectors)
                    .literalReplacement(" ")
                    .applicableFields(RecordField.NAME, RecordField.INDUSTRY)
                    .priority(40)
                    .build());
        }
        if (!tables.legalSuffixes().isEmpty()) {
            // Repeated suffixes ("Holdings Co Ltd") are removed in one pass
            rules.add(NormalizationRule.builder()
                    .name("name-legal-suffix")
                    .pattern("(?:\\s+(?:" + alternation(tables.legalSuffixes()) + "))+\\s*$")
                    .replacement("")
                    .applicableFields(RecordField.NAME)
                    .priority(50)
                    .build());
        }
        if (!tables.leadingArticles().isEmpty()) {
            rules.add(NormalizationRule.builder()
                    .name("name-leading-article")
                    .pattern("^\\s*(?:" + alternation(tables.leadingArticles()) + ")\\s+(?=\\S)")
                    .replacement("")
                    .applicableFields(RecordField.NAME)
                    .priority(60)
                    .build());
        }
        return rules;
    }

    /**
     * One whole-word expansion rule per address abbreviation.
     */
    public static List<NormalizationRule> getAddressRules(NormalizationTables tables) {
        List<NormalizationRule> rules = new ArrayList<>();
        for (Map.Entry<String, String> entry : tables.addressAbbreviations().entrySet()) {
            rules.add(NormalizationRule.builder()
                    .name("address-" + entry.getKey())
                    .wholeWords(List.of(entry.getKey()))
                    .literalReplacement(entry.getValue())
                    .applicableFields(RecordField.ADDRESS)
                    .priority(70)
                    .build());
        }
        return rules;
    }

    private static boolean isWord(String token) {
        return token.chars().allMatch(Character::isLetterOrDigit);
    }

    private static String alternation(List<String> tokens) {
        return tokens.stream().map(Pattern::quote).collect(Collectors.joining("|"));
    }
}
