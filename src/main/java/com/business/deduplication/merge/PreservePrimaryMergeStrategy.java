package com.business.deduplication.merge;

import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.core.model.MergedRecord;
import com.business.deduplication.core.model.RecordField;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps every populated field of the primary and fills its empty fields from the
 * first duplicate, in list order, that has a value.
 */
public class PreservePrimaryMergeStrategy implements MergeStrategy {

    @Override
    public MergedRecord merge(BusinessRecord primary, List<BusinessRecord> duplicates) {
        BusinessRecord.Builder builder = primary.toBuilder();
        Map<String, String> provenance = new LinkedHashMap<>();

        for (RecordField field : RecordField.values()) {
            BusinessRecord source = firstWith(field, primary, duplicates);
            if (source != null) {
                field.set(builder, field.get(source));
                provenance.put(field.key(), source.getId());
            }
        }
        refine(builder, provenance, primary, duplicates);

        return new MergedRecord(builder.build(), provenance, ids(duplicates), type().key());
    }

    /**
     * Hook for strategies that combine values instead of taking a single source.
     */
    protected void refine(BusinessRecord.Builder builder, Map<String, String> provenance,
                          BusinessRecord primary, List<BusinessRecord> duplicates) {
    }

    @Override
    public MergeStrategyType type() {
        return MergeStrategyType.PRESERVE_PRIMARY;
    }

    static BusinessRecord firstWith(RecordField field, BusinessRecord primary, List<BusinessRecord> duplicates) {
        if (field.isPresent(primary)) {
            return primary;
        }
        for (BusinessRecord duplicate : duplicates) {
            if (field.isPresent(duplicate)) {
                return duplicate;
            }
        }
        return null;
    }

    static List<String> ids(List<BusinessRecord> records) {
        List<String> ids = new ArrayList<>(records.size());
        for (BusinessRecord record : records) {
            ids.add(record.getId());
        }
        return ids;
    }
}
