package com.phillippitts.mathwords.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for verbalization calls.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Conversion latency per speech style and input format</li>
 *   <li>Success and failure counts, failures tagged by error kind</li>
 *   <li>Batch sizes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class VerbalizationMetrics {

    private static final String METRIC_PREFIX = "mathwords.verbalization";

    private final MeterRegistry registry;

    public VerbalizationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records conversion latency.
     *
     * @param style speech style name
     * @param format input format (latex, mathml)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String style, String format, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to verbalize one expression")
                .tag("style", style)
                .tag("format", format)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String style) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful verbalizations")
                .tag("style", style)
                .tag("outcome", "success")
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param style speech style name
     * @param reason failure kind (UNKNOWN_COMMAND, LEX_ERROR, INVALID_INPUT, ...)
     */
    public void incrementFailure(String style, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed verbalizations")
                .tag("style", style)
                .tag("outcome", "failure")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts a batch call.
     *
     * @param size number of items
     * @param parallel whether the batch ran on the executor
     */
    public void recordBatch(int size, boolean parallel) {
        Counter.builder(METRIC_PREFIX + ".batch.items")
                .description("Number of expressions submitted in batches")
                .tag("mode", parallel ? "parallel" : "sequential")
                .register(registry)
                .increment(size);
    }
}
