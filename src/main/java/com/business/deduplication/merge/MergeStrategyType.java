package com.business.deduplication.merge;

import java.util.Arrays;

/**
 * Built-in merge strategies, selectable by name through the {@code mergeStrategy} option.
 */
public enum MergeStrategyType {
    PRESERVE_PRIMARY("preservePrimary"),
    QUALITY("quality"),
    COMPREHENSIVE("comprehensive");

    private final String key;

    MergeStrategyType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * @throws IllegalArgumentException for an unknown strategy name
     */
    public static MergeStrategyType fromKey(String key) {
        for (MergeStrategyType type : values()) {
            if (type.key.equals(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown merge strategy: '" + key + "'. Known strategies: "
                + Arrays.toString(Arrays.stream(values()).map(MergeStrategyType::key).toArray()));
    }

    @Override
    public String toString() {
        return key;
    }
}
