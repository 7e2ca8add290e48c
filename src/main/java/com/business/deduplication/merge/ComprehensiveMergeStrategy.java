package com.business.deduplication.merge;

import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.core.model.RecordField;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Preserve-primary for scalar fields, plus: union of industry tags, the longest
 * description, the maximum confidence, and verified if any member is verified.
 *
 * <p>The provenance of the industry tags lists every member that added a tag, in
 * member order.</p>
 */
public class ComprehensiveMergeStrategy extends PreservePrimaryMergeStrategy {

    @Override
    protected void refine(BusinessRecord.Builder builder, Map<String, String> provenance,
                          BusinessRecord primary, List<BusinessRecord> duplicates) {
        List<BusinessRecord> members = members(primary, duplicates);

        Set<String> industry = new LinkedHashSet<>();
        List<String> contributors = new ArrayList<>();
        for (BusinessRecord member : members) {
            if (industry.addAll(member.getIndustry())) {
                contributors.add(member.getId());
            }
        }
        builder.industry(industry);
        if (contributors.isEmpty()) {
            provenance.remove(RecordField.INDUSTRY.key());
        } else {
            provenance.put(RecordField.INDUSTRY.key(), String.join(",", contributors));
        }

        BusinessRecord longestDescription = null;
        for (BusinessRecord member : members) {
            String description = member.getDescription();
            if (description != null && (longestDescription == null
                    || description.length() > longestDescription.getDescription().length())) {
                longestDescription = member;
            }
        }
        if (longestDescription != null) {
            builder.description(longestDescription.getDescription());
            provenance.put(RecordField.DESCRIPTION.key(), longestDescription.getId());
        }

        BusinessRecord mostConfident = null;
        for (BusinessRecord member : members) {
            Double confidence = member.getConfidence();
            if (confidence != null && (mostConfident == null || confidence > mostConfident.getConfidence())) {
                mostConfident = member;
            }
        }
        if (mostConfident != null) {
            builder.confidence(mostConfident.getConfidence());
            provenance.put(RecordField.CONFIDENCE.key(), mostConfident.getId());
        }

        builder.verified(members.stream().anyMatch(BusinessRecord::isVerified));
    }

    @Override
    public MergeStrategyType type() {
        return MergeStrategyType.COMPREHENSIVE;
    }

    static List<BusinessRecord> members(BusinessRecord primary, List<BusinessRecord> duplicates) {
        List<BusinessRecord> members = new ArrayList<>(duplicates.size() + 1);
        members.add(primary);
        members.addAll(duplicates);
        return members;
    }
}
