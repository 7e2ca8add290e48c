package com.business.deduplication.merge;

import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.core.model.MergedRecord;
import com.business.deduplication.logging.LogContext;
import com.business.deduplication.metrics.MetricsService;
import com.business.deduplication.metrics.NoOpMetricsService;
import com.business.deduplication.rules.FieldValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies a {@link MergeStrategy} to a primary record and its duplicates.
 *
 * <p>Merging never writes anywhere; the caller decides what to do with the
 * returned {@link MergedRecord}.</p>
 */
public class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final Map<MergeStrategyType, MergeStrategy> strategies = new EnumMap<>(MergeStrategyType.class);
    private final MetricsService metrics;

    public MergeEngine(FieldValidator validator) {
        this(validator, new NoOpMetricsService());
    }

    public MergeEngine(FieldValidator validator, MetricsService metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        register(new PreservePrimaryMergeStrategy());
        register(new QualityMergeStrategy(validator));
        register(new ComprehensiveMergeStrategy());
    }

    /**
     * Replaces the implementation used for a strategy type.
     */
    public void register(MergeStrategy strategy) {
        strategies.put(strategy.type(), strategy);
    }

    public MergeStrategy strategy(MergeStrategyType type) {
        return strategies.get(type);
    }

    /**
     * Merges {@code duplicates} into {@code primary}.
     *
     * @throws IllegalArgumentException if the primary has no id
     */
    public MergedRecord merge(BusinessRecord primary, List<BusinessRecord> duplicates, MergeStrategyType type) {
        Objects.requireNonNull(primary, "primary is required");
        Objects.requireNonNull(duplicates, "duplicates is required");
        Objects.requireNonNull(type, "type is required");
        if (!primary.hasId()) {
            throw new IllegalArgumentException("Primary record must have an id");
        }

        List<BusinessRecord> others = new ArrayList<>(duplicates.size());
        for (BusinessRecord duplicate : duplicates) {
            if (duplicate == null) {
                throw new IllegalArgumentException("duplicates must not contain null");
            }
            if (primary.getId().equals(duplicate.getId())) {
                log.debug("merge.duplicateSkipped primaryId={} reason=same-id", primary.getId());
                continue;
            }
            others.add(duplicate);
        }

        try (LogContext ctx = LogContext.forMerge(LogContext.generateCorrelationId(), primary.getId(), type.key())) {
            MergedRecord merged = strategies.get(type).merge(primary, others);
            log.info("merge.completed primaryId={} mergedFrom={} strategy={} fields={}",
                    primary.getId(), merged.mergedFrom(), type.key(), merged.provenance().keySet());
            metrics.incrementRecordsMerged(type.key());
            return merged;
        }
    }
}
