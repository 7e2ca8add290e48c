package com.business.deduplication.merge;

import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.core.model.MergedRecord;

import java.util.List;

/**
 * Combines a primary record and its duplicates into one record.
 *
 * <p>Implementations are deterministic and never leave a field empty when some
 * member of the cluster has a value for it.</p>
 */
public interface MergeStrategy {

    /**
     * @param primary    the record whose id survives
     * @param duplicates the other members, in priority order
     */
    MergedRecord merge(BusinessRecord primary, List<BusinessRecord> duplicates);

    MergeStrategyType type();
}
