package com.business.deduplication.api;

import com.business.deduplication.core.model.MatchAlgorithm;
import com.business.deduplication.core.model.RecordField;
import com.business.deduplication.match.FieldComparator;
import com.business.deduplication.merge.MergeStrategyType;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-call options for duplicate search, batch deduplication and merging.
 * Instances are immutable; every value is validated when it is set, so invalid
 * options fail before any comparison work starts.
 */
public class DeduplicationOptions {

    public static final double DEFAULT_THRESHOLD = 0.8;
    public static final double DEFAULT_AUTO_MERGE_THRESHOLD = 0.9;
    public static final double DEFAULT_ML_WEIGHT = 0.3;
    public static final int DEFAULT_BATCH_SIZE = 100;

    private static final Set<MatchAlgorithm> DEFAULT_ALGORITHMS = Collections.unmodifiableSet(EnumSet.of(
            MatchAlgorithm.STRING, MatchAlgorithm.TOKEN, MatchAlgorithm.PHONETIC,
            MatchAlgorithm.ADDRESS, MatchAlgorithm.FIELD_EXACT));

    private static final Set<String> KNOWN_KEYS = Set.of(
            "threshold", "autoMergeThreshold", "algorithms", "checkFields", "fieldThresholds",
            "customComparators", "deepCheck", "autoMerge", "mergeStrategy", "strategy",
            "preservePrimary", "batchSize", "mlWeight");

    private final double threshold;
    private final double autoMergeThreshold;
    private final Set<MatchAlgorithm> algorithms;
    private final Set<RecordField> checkFields;
    private final Map<RecordField, Double> fieldThresholds;
    private final Map<RecordField, FieldComparator> customComparators;
    private final boolean deepCheck;
    private final boolean autoMerge;
    private final MergeStrategyType mergeStrategy;
    private final int batchSize;
    private final double mlWeight;

    private DeduplicationOptions(Builder builder) {
        this.threshold = builder.threshold;
        this.autoMergeThreshold = builder.autoMergeThreshold;
        this.algorithms = Collections.unmodifiableSet(EnumSet.copyOf(builder.algorithms));
        this.checkFields = Collections.unmodifiableSet(EnumSet.copyOf(builder.checkFields));
        this.fieldThresholds = Collections.unmodifiableMap(new EnumMap<>(builder.fieldThresholds));
        this.customComparators = Collections.unmodifiableMap(new EnumMap<>(builder.customComparators));
        this.deepCheck = builder.deepCheck;
        this.autoMerge = builder.autoMerge;
        this.mergeStrategy = builder.mergeStrategy;
        this.batchSize = builder.batchSize;
        this.mlWeight = builder.mlWeight;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getAutoMergeThreshold() {
        return autoMergeThreshold;
    }

    public Set<MatchAlgorithm> getAlgorithms() {
        return algorithms;
    }

    public boolean isEnabled(MatchAlgorithm algorithm) {
        return algorithms.contains(algorithm);
    }

    public Set<RecordField> getCheckFields() {
        return checkFields;
    }

    public boolean isChecked(RecordField field) {
        return checkFields.contains(field);
    }

    public Map<RecordField, Double> getFieldThresholds() {
        return fieldThresholds;
    }

    /**
     * Minimum score for the field to contribute to the weighted mean; 0.0 if unset.
     */
    public double fieldThreshold(RecordField field) {
        return fieldThresholds.getOrDefault(field, 0.0);
    }

    public Map<RecordField, FieldComparator> getCustomComparators() {
        return customComparators;
    }

    public boolean isDeepCheck() {
        return deepCheck;
    }

    /**
     * The external scorer is consulted in deep-check mode, or when {@code ml} is
     * explicitly selected.
     */
    public boolean wantsExternalScore() {
        return deepCheck || algorithms.contains(MatchAlgorithm.ML);
    }

    public boolean isAutoMerge() {
        return autoMerge;
    }

    public MergeStrategyType getMergeStrategy() {
        return mergeStrategy;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public double getMlWeight() {
        return mlWeight;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .threshold(threshold)
                .autoMergeThreshold(autoMergeThreshold)
                .algorithms(algorithms)
                .checkFields(checkFields)
                .deepCheck(deepCheck)
                .autoMerge(autoMerge)
                .mergeStrategy(mergeStrategy)
                .batchSize(batchSize)
                .mlWeight(mlWeight);
        fieldThresholds.forEach(builder::fieldThreshold);
        customComparators.forEach(builder::customComparator);
        return builder;
    }

    public static DeduplicationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses loosely typed options, e.g. from a JSON request body.
     *
     * <p>Recognized keys: {@code threshold}, {@code autoMergeThreshold}, {@code algorithms},
     * {@code checkFields}, {@code fieldThresholds}, {@code customComparators},
     * {@code deepCheck}, {@code autoMerge}, {@code mergeStrategy} (alias {@code strategy}),
     * {@code preservePrimary} (boolean shorthand for the preservePrimary strategy),
     * {@code batchSize} and {@code mlWeight}. Missing keys take their defaults.</p>
     *
     * @throws IllegalArgumentException for unknown keys, unknown names or values of the wrong type or range
     */
    public static DeduplicationOptions fromMap(Map<String, ?> options) {
        Builder builder = builder();
        if (options == null) {
            return builder.build();
        }
        for (String key : options.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown option: '" + key + "'");
            }
        }

        if (options.containsKey("threshold")) {
            builder.threshold(number(options, "threshold"));
        }
        if (options.containsKey("autoMergeThreshold")) {
            builder.autoMergeThreshold(number(options, "autoMergeThreshold"));
        }
        if (options.containsKey("algorithms")) {
            Set<MatchAlgorithm> algorithms = EnumSet.noneOf(MatchAlgorithm.class);
            for (Object name : collection(options, "algorithms")) {
                algorithms.add(MatchAlgorithm.fromKey(string(name, "algorithms")));
            }
            builder.algorithms(algorithms);
        }
        if (options.containsKey("checkFields")) {
            Set<RecordField> fields = EnumSet.noneOf(RecordField.class);
            for (Object name : collection(options, "checkFields")) {
                fields.add(RecordField.comparableFromKey(string(name, "checkFields")));
            }
            builder.checkFields(fields);
        }
        if (options.containsKey("fieldThresholds")) {
            for (Map.Entry<?, ?> entry : map(options, "fieldThresholds").entrySet()) {
                RecordField field = RecordField.comparableFromKey(string(entry.getKey(), "fieldThresholds"));
                if (!(entry.getValue() instanceof Number n)) {
                    throw new IllegalArgumentException("fieldThresholds." + field.key() + " must be a number");
                }
                builder.fieldThreshold(field, n.doubleValue());
            }
        }
        if (options.containsKey("customComparators")) {
            for (Map.Entry<?, ?> entry : map(options, "customComparators").entrySet()) {
                RecordField field = RecordField.comparableFromKey(string(entry.getKey(), "customComparators"));
                if (!(entry.getValue() instanceof FieldComparator comparator)) {
                    throw new IllegalArgumentException("customComparators." + field.key()
                            + " must be a FieldComparator");
                }
                builder.customComparator(field, comparator);
            }
        }
        if (options.containsKey("deepCheck")) {
            builder.deepCheck(bool(options, "deepCheck"));
        }
        if (options.containsKey("autoMerge")) {
            builder.autoMerge(bool(options, "autoMerge"));
        }
        if (options.containsKey("preservePrimary") && bool(options, "preservePrimary")) {
            builder.mergeStrategy(MergeStrategyType.PRESERVE_PRIMARY);
        }
        if (options.containsKey("strategy")) {
            builder.mergeStrategy(MergeStrategyType.fromKey(string(options.get("strategy"), "strategy")));
        }
        if (options.containsKey("mergeStrategy")) {
            builder.mergeStrategy(MergeStrategyType.fromKey(string(options.get("mergeStrategy"), "mergeStrategy")));
        }
        if (options.containsKey("batchSize")) {
            double size = number(options, "batchSize");
            if (size != Math.rint(size)) {
                throw new IllegalArgumentException("batchSize must be an integer, got " + size);
            }
            builder.batchSize((int) size);
        }
        if (options.containsKey("mlWeight")) {
            builder.mlWeight(number(options, "mlWeight"));
        }
        return builder.build();
    }

    private static double number(Map<String, ?> options, String key) {
        if (!(options.get(key) instanceof Number n)) {
            throw new IllegalArgumentException(key + " must be a number");
        }
        return n.doubleValue();
    }

    private static boolean bool(Map<String, ?> options, String key) {
        if (!(options.get(key) instanceof Boolean b)) {
            throw new IllegalArgumentException(key + " must be a boolean");
        }
        return b;
    }

    private static Collection<?> collection(Map<String, ?> options, String key) {
        if (!(options.get(key) instanceof Collection<?> c)) {
            throw new IllegalArgumentException(key + " must be a list");
        }
        return c;
    }

    private static Map<?, ?> map(Map<String, ?> options, String key) {
        if (!(options.get(key) instanceof Map<?, ?> m)) {
            throw new IllegalArgumentException(key + " must be a map");
        }
        return m;
    }

    private static String string(Object value, String key) {
        if (!(value instanceof String s)) {
            throw new IllegalArgumentException(key + " entries must be strings, got " + value);
        }
        return s;
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private double autoMergeThreshold = DEFAULT_AUTO_MERGE_THRESHOLD;
        private Set<MatchAlgorithm> algorithms = EnumSet.copyOf(DEFAULT_ALGORITHMS);
        private Set<RecordField> checkFields = RecordField.comparableFields();
        private final Map<RecordField, Double> fieldThresholds = new EnumMap<>(RecordField.class);
        private final Map<RecordField, FieldComparator> customComparators = new EnumMap<>(RecordField.class);
        private boolean deepCheck = false;
        private boolean autoMerge = false;
        private MergeStrategyType mergeStrategy = MergeStrategyType.COMPREHENSIVE;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private double mlWeight = DEFAULT_ML_WEIGHT;

        public Builder threshold(double threshold) {
            validateUnit(threshold, "threshold");
            this.threshold = threshold;
            return this;
        }

        public Builder autoMergeThreshold(double autoMergeThreshold) {
            validateUnit(autoMergeThreshold, "autoMergeThreshold");
            this.autoMergeThreshold = autoMergeThreshold;
            return this;
        }

        public Builder algorithms(Collection<MatchAlgorithm> algorithms) {
            Objects.requireNonNull(algorithms, "algorithms is required");
            if (algorithms.isEmpty()) {
                throw new IllegalArgumentException("algorithms must not be empty");
            }
            for (MatchAlgorithm algorithm : algorithms) {
                if (!algorithm.isSelectable()) {
                    throw new IllegalArgumentException("Algorithm '" + algorithm.key() + "' cannot be selected");
                }
            }
            this.algorithms = EnumSet.copyOf(algorithms);
            return this;
        }

        public Builder algorithms(MatchAlgorithm... algorithms) {
            return algorithms(Arrays.asList(algorithms));
        }

        public Builder checkFields(Collection<RecordField> fields) {
            Objects.requireNonNull(fields, "checkFields is required");
            if (fields.isEmpty()) {
                throw new IllegalArgumentException("checkFields must not be empty");
            }
            for (RecordField field : fields) {
                if (!field.isComparable()) {
                    throw new IllegalArgumentException("Field '" + field.key() + "' cannot be compared");
                }
            }
            this.checkFields = EnumSet.copyOf(fields);
            return this;
        }

        public Builder checkFields(RecordField... fields) {
            return checkFields(Arrays.asList(fields));
        }

        public Builder fieldThreshold(RecordField field, double minimum) {
            if (!field.isComparable()) {
                throw new IllegalArgumentException("Field '" + field.key() + "' cannot be compared");
            }
            validateUnit(minimum, "fieldThresholds." + field.key());
            this.fieldThresholds.put(field, minimum);
            return this;
        }

        public Builder customComparator(RecordField field, FieldComparator comparator) {
            Objects.requireNonNull(comparator, "comparator is required");
            if (!field.isComparable()) {
                throw new IllegalArgumentException("Field '" + field.key() + "' cannot be compared");
            }
            this.customComparators.put(field, comparator);
            return this;
        }

        public Builder deepCheck(boolean deepCheck) {
            this.deepCheck = deepCheck;
            return this;
        }

        public Builder autoMerge(boolean autoMerge) {
            this.autoMerge = autoMerge;
            return this;
        }

        public Builder mergeStrategy(MergeStrategyType mergeStrategy) {
            this.mergeStrategy = Objects.requireNonNull(mergeStrategy, "mergeStrategy is required");
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder mlWeight(double mlWeight) {
            validateUnit(mlWeight, "mlWeight");
            this.mlWeight = mlWeight;
            return this;
        }

        public DeduplicationOptions build() {
            return new DeduplicationOptions(this);
        }

        private void validateUnit(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "DeduplicationOptions{" +
                "threshold=" + threshold +
                ", autoMergeThreshold=" + autoMergeThreshold +
                ", algorithms=" + algorithms +
                ", checkFields=" + checkFields +
                ", fieldThresholds=" + fieldThresholds +
                ", customComparators=" + customComparators.keySet() +
                ", deepCheck=" + deepCheck +
                ", autoMerge=" + autoMerge +
                ", mergeStrategy=" + mergeStrategy +
                ", batchSize=" + batchSize +
                ", mlWeight=" + mlWeight +
                '}';
    }
}
