package com.business.deduplication.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of merging a cluster of duplicates.
 *
 * @param record     the merged record; it keeps the primary's id
 * @param provenance field key to the id of the record its value came from; a value combined
 *                   from several records maps to their ids joined by {@code ','}
 * @param mergedFrom ids of the duplicates folded into the primary, in input order
 * @param strategy   name of the strategy that produced the record
 */
public record MergedRecord(
        BusinessRecord record,
        Map<String, String> provenance,
        List<String> mergedFrom,
        String strategy
) {
    public MergedRecord {
        Objects.requireNonNull(record, "record is required");
        provenance = provenance != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(provenance))
                : Map.of();
        mergedFrom = mergedFrom != null ? List.copyOf(mergedFrom) : List.of();
    }

    public String id() {
        return record.getId();
    }

    /**
     * Id of the record that supplied the field's value, comma-separated ids when several
     * records were combined, or {@code null} if the field is empty.
     */
    public String sourceOf(RecordField field) {
        return provenance.get(field.key());
    }
}
