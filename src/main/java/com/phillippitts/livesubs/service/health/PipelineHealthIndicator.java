package com.phillippitts.livesubs.service.health;

import com.phillippitts.livesubs.service.pipeline.PipelineState;
import com.phillippitts.livesubs.service.pipeline.SubtitlePipeline;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the subtitle pipeline.
 *
 * <ul>
 *   <li>UP: pipeline running</li>
 *   <li>DOWN: pipeline in ERROR; the last error is reported</li>
 *   <li>OUT_OF_SERVICE: idle or stopped</li>
 *   <li>UNKNOWN: starting or stopping</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final SubtitlePipeline pipeline;

    public PipelineHealthIndicator(SubtitlePipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public Health health() {
        PipelineState state = pipeline.state();
        Health.Builder builder = switch (state) {
            case RUNNING -> Health.up();
            case ERROR -> Health.down();
            case IDLE, STOPPED -> Health.outOfService();
            case STARTING, STOPPING -> Health.unknown();
        };
        builder.withDetail("state", state.name())
                .withDetail("droppedPartials", pipeline.droppedPartialCount())
                .withDetail("lastShutdownClean", pipeline.lastShutdownClean());
        Throwable error = pipeline.lastError();
        if (error != null) {
            builder.withDetail("lastError", String.valueOf(error.getMessage()));
        }
        return builder.build();
    }
}
