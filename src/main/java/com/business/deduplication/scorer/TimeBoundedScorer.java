package com.business.deduplication.scorer;

import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.metrics.MetricsService;
import com.business.deduplication.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an {@link ExternalScorer} on a dedicated executor with a per-call timeout.
 *
 * <p>Any failure (timeout, exception, interrupted wait, value outside [0,1]) yields a
 * {@link ScorerOutcome#fallback(String)} instead of propagating, is logged at WARN and
 * counted through {@link MetricsService#incrementScorerFallback(String)}. A call that times
 * out is interrupted; scorers should honour interruption.</p>
 */
public class TimeBoundedScorer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TimeBoundedScorer.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    private final ExternalScorer scorer;
    private final Duration timeout;
    private final MetricsService metrics;
    private final ExecutorService executor;

    public TimeBoundedScorer(ExternalScorer scorer) {
        this(scorer, DEFAULT_TIMEOUT, 2, new NoOpMetricsService());
    }

    public TimeBoundedScorer(ExternalScorer scorer, Duration timeout, int threads, MetricsService metrics) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "dedup-scorer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public boolean isAvailable() {
        return scorer.isAvailable();
    }

    public String scorerName() {
        return scorer.name();
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Scores a pair. The records are handed to the scorer in ascending id order so
     * that {@code score(a, b)} and {@code score(b, a)} see the same call.
     */
    public ScorerOutcome score(BusinessRecord a, BusinessRecord b) {
        BusinessRecord first = compareIds(a, b) <= 0 ? a : b;
        BusinessRecord second = first == a ? b : a;

        // a FutureTask, so cancel(true) interrupts a call that overran and frees its thread
        Future<Double> future = executor.submit(() -> scorer.score(first, second));
        try {
            double value = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                return fallback("out-of-range", "scorer " + scorer.name() + " returned " + value,
                        first, second, null);
            }
            return ScorerOutcome.success(value);
        } catch (TimeoutException e) {
            future.cancel(true);
            return fallback("timeout", "scorer " + scorer.name() + " timed out after " + timeout.toMillis() + "ms",
                    first, second, null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return fallback("error", "scorer " + scorer.name() + " failed: " + cause.getMessage(),
                    first, second, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return fallback("interrupted", "scorer " + scorer.name() + " call interrupted", first, second, null);
        }
    }

    private ScorerOutcome fallback(String reason, String note, BusinessRecord first, BusinessRecord second,
                                   Throwable cause) {
        if (cause != null) {
            log.warn("scorer.fallback scorer={} reason={} firstId={} secondId={}",
                    scorer.name(), reason, first.getId(), second.getId(), cause);
        } else {
            log.warn("scorer.fallback scorer={} reason={} firstId={} secondId={}",
                    scorer.name(), reason, first.getId(), second.getId());
        }
        metrics.incrementScorerFallback(reason);
        return ScorerOutcome.fallback(note);
    }

    private static int compareIds(BusinessRecord a, BusinessRecord b) {
        String left = a.getId() == null ? "" : a.getId();
        String right = b.getId() == null ? "" : b.getId();
        return left.compareTo(right);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
