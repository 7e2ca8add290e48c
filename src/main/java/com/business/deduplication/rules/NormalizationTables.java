package com.business.deduplication.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Word lists used by the field normalizer.
 *
 * <p>The defaults are read from the classpath resource {@value #DEFAULT_RESOURCE}.
 * Callers can supply their own tables, for example to add regional legal suffixes.</p>
 *
 * @param legalSuffixes        trailing legal-form words stripped from names ({@code inc}, {@code ltd}, ...)
 * @param leadingArticles      leading words stripped from names ({@code the})
 * @param connectors           connector words and symbols removed from names ({@code and}, {@code &})
 * @param addressAbbreviations abbreviation to expansion, applied to street, city and province
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NormalizationTables(
        List<String> legalSuffixes,
        List<String> leadingArticles,
        List<String> connectors,
        Map<String, String> addressAbbreviations
) {
    public static final String DEFAULT_RESOURCE = "/normalization-tables.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public NormalizationTables {
        legalSuffixes = lowerCaseList(legalSuffixes);
        leadingArticles = lowerCaseList(leadingArticles);
        connectors = lowerCaseList(connectors);
        Map<String, String> abbreviations = new LinkedHashMap<>();
        if (addressAbbreviations != null) {
            addressAbbreviations.forEach((k, v) -> {
                if (k != null && !k.isBlank() && v != null && !v.isBlank()) {
                    abbreviations.put(k.trim().toLowerCase(Locale.ROOT), v.trim().toLowerCase(Locale.ROOT));
                }
            });
        }
        addressAbbreviations = Collections.unmodifiableMap(abbreviations);
    }

    /**
     * Tables with no entries. Names are then only lowercased and cleaned of punctuation.
     */
    public static NormalizationTables empty() {
        return new NormalizationTables(List.of(), List.of(), List.of(), Map.of());
    }

    /**
     * Loads the bundled default tables.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static NormalizationTables defaults() {
        try (InputStream in = NormalizationTables.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Normalization tables resource not found: " + DEFAULT_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read normalization tables: " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Reads tables from a JSON document.
     *
     * @throws UncheckedIOException if the stream cannot be parsed
     */
    public static NormalizationTables load(InputStream in) {
        try {
            return MAPPER.readValue(in, NormalizationTables.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid normalization tables document", e);
        }
    }

    private static List<String> lowerCaseList(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }
}
