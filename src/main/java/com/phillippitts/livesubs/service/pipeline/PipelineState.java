package com.phillippitts.livesubs.service.pipeline;

/**
 * Lifecycle states of {@link SubtitlePipeline}.
 *
 * <pre>
 * IDLE | STOPPED | ERROR → STARTING → RUNNING → STOPPING → STOPPED
 *                          STARTING → ERROR (fatal load failure)
 * </pre>
 */
public enum PipelineState {
    IDLE,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    ERROR;

    /** States from which {@code start} is accepted. */
    public boolean canStart() {
        return this == IDLE || this == STOPPED || this == ERROR;
    }
}
