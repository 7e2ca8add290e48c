package com.business.deduplication.merge;

import com.business.deduplication.core.model.Address;
import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.core.model.MergedRecord;
import com.business.deduplication.core.model.RecordField;
import com.business.deduplication.rules.FieldValidator;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per field, takes the usable value of the member with the highest
 * {@link RecordQuality#qualityScore(BusinessRecord) quality score}. Ties go to the
 * longer value, then to the earlier member (primary first). Confidence becomes the
 * cluster maximum.
 *
 * <p>A field whose values are all unusable (an email without a domain, say) is still
 * filled, preserve-primary style, rather than dropped.</p>
 */
public class QualityMergeStrategy implements MergeStrategy {

    private final FieldValidator validator;

    public QualityMergeStrategy(FieldValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator is required");
    }

    @Override
    public MergedRecord merge(BusinessRecord primary, List<BusinessRecord> duplicates) {
        List<BusinessRecord> members = ComprehensiveMergeStrategy.members(primary, duplicates);
        BusinessRecord.Builder builder = primary.toBuilder();
        Map<String, String> provenance = new LinkedHashMap<>();

        for (RecordField field : RecordField.values()) {
            BusinessRecord source = field == RecordField.CONFIDENCE
                    ? mostConfident(members)
                    : bestSource(field, members);
            if (source == null) {
                source = PreservePrimaryMergeStrategy.firstWith(field, primary, duplicates);
            }
            if (source != null) {
                field.set(builder, field.get(source));
                provenance.put(field.key(), source.getId());
            }
        }

        return new MergedRecord(builder.build(), provenance,
                PreservePrimaryMergeStrategy.ids(duplicates), type().key());
    }

    @Override
    public MergeStrategyType type() {
        return MergeStrategyType.QUALITY;
    }

    private BusinessRecord bestSource(RecordField field, List<BusinessRecord> members) {
        BusinessRecord best = null;
        double bestQuality = 0.0;
        int bestLength = 0;
        for (BusinessRecord member : members) {
            Object value = field.get(member);
            if (!validator.isUsable(field, value)) {
                continue;
            }
            double quality = RecordQuality.qualityScore(member);
            int length = length(value);
            if (best == null || quality > bestQuality || (quality == bestQuality && length > bestLength)) {
                best = member;
                bestQuality = quality;
                bestLength = length;
            }
        }
        return best;
    }

    private static BusinessRecord mostConfident(List<BusinessRecord> members) {
        BusinessRecord best = null;
        for (BusinessRecord member : members) {
            if (member.getConfidence() != null
                    && (best == null || member.getConfidence() > best.getConfidence())) {
                best = member;
            }
        }
        return best;
    }

    private static int length(Object value) {
        if (value instanceof String s) {
            return s.length();
        }
        if (value instanceof Address a) {
            return a.format().length();
        }
        if (value instanceof Collection<?> c) {
            return c.size();
        }
        return 0;
    }
}
