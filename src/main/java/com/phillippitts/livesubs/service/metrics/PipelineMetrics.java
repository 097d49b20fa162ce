package com.phillippitts.livesubs.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the subtitle pipeline.
 *
 * <ul>
 *   <li>{@code livesubs.stage.latency} - per-item processing time, tagged by stage</li>
 *   <li>{@code livesubs.stage.items} - processed items, tagged by stage and outcome</li>
 *   <li>{@code livesubs.queue.dropped} - partial items dropped under overload, tagged by queue</li>
 * </ul>
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "livesubs";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(String stage, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".stage.latency")
                .description("Time taken to process one item in a pipeline stage")
                .tag("stage", stage)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param outcome lower-case outcome kind (success, skipped, transient_failure, fatal)
     */
    public void incrementItems(String stage, String outcome) {
        Counter.builder(METRIC_PREFIX + ".stage.items")
                .description("Number of items processed by a pipeline stage")
                .tag("stage", stage)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementDropped(String queue) {
        Counter.builder(METRIC_PREFIX + ".queue.dropped")
                .description("Number of partial items dropped under overload")
                .tag("queue", queue)
                .register(registry)
                .increment();
    }
}
