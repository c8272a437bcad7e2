package com.phillippitts.lineaccuracy.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for line accuracy checks.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Batch check latency</li>
 *   <li>Pass/fail counts by strictness</li>
 *   <li>Locked states that froze on a mismatch</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available through the actuator.
 */
@Component
public class AccuracyMetrics {

    private static final String METRIC_PREFIX = "lineaccuracy";

    private final MeterRegistry registry;

    public AccuracyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long a batch check took.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordCheckLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".check.latency")
                .description("Time taken to score a spoken line")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a batch check verdict.
     *
     * @param correct whether the attempt passed
     * @param strict  whether strict mode was on
     */
    public void recordCheckResult(boolean correct, boolean strict) {
        Counter.builder(METRIC_PREFIX + ".check.result")
                .description("Number of scored attempts by outcome")
                .tag("outcome", correct ? "correct" : "incorrect")
                .tag("mode", strict ? "strict" : "normal")
                .register(registry)
                .increment();
    }

    /**
     * Counts a locked state that just froze.
     */
    public void incrementLockedFrozen() {
        Counter.builder(METRIC_PREFIX + ".locked.frozen")
                .description("Number of live matches stopped by a mismatch")
                .register(registry)
                .increment();
    }
}
