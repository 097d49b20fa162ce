package com.phillippitts.livesubs.service.pipeline;

import com.phillippitts.livesubs.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Null-safe front for {@link PipelineMetrics} used by workers and queues.
 *
 * <p>{@link #NOOP} lets the pipeline run without a meter registry, e.g. in unit tests.
 */
public final class PipelineMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(PipelineMetricsPublisher.class);

    public static final PipelineMetricsPublisher NOOP = new PipelineMetricsPublisher(null);

    private final PipelineMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public PipelineMetricsPublisher(PipelineMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("PipelineMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordOutcome(String stage, StageOutcome.Kind kind, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(stage, durationNanos);
        metrics.incrementItems(stage, kind.name().toLowerCase(Locale.ROOT));
    }

    public void recordDrop(String queue) {
        if (metrics == null) {
            return;
        }
        metrics.incrementDropped(queue);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
