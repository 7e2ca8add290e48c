package com.business.deduplication.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Engine-level settings that do not change per call.
 *
 * @param parallelism   worker threads used for batch comparisons
 * @param scorerTimeout maximum time to wait for the external scorer per pair
 * @param scorerThreads threads dedicated to external scorer calls
 */
public record EngineConfig(int parallelism, Duration scorerTimeout, int scorerThreads) {

    public EngineConfig {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        Objects.requireNonNull(scorerTimeout, "scorerTimeout is required");
        if (scorerTimeout.isZero() || scorerTimeout.isNegative()) {
            throw new IllegalArgumentException("scorerTimeout must be positive");
        }
        if (scorerThreads <= 0) {
            throw new IllegalArgumentException("scorerThreads must be > 0");
        }
    }

    /**
     * One worker per available processor, 2s scorer timeout, 2 scorer threads.
     */
    public static EngineConfig defaults() {
        return new EngineConfig(Runtime.getRuntime().availableProcessors(), Duration.ofSeconds(2), 2);
    }

    public EngineConfig withParallelism(int parallelism) {
        return new EngineConfig(parallelism, scorerTimeout, scorerThreads);
    }

    public EngineConfig withScorerTimeout(Duration timeout) {
        return new EngineConfig(parallelism, timeout, scorerThreads);
    }
}
