package com.phillippitts.livesubs.service.pipeline;

/**
 * Per-item work bound into a {@link StageWorker}.
 *
 * <p>Processors call their external collaborator synchronously and hand results downstream
 * themselves. Failures are reported through the returned {@link StageOutcome} rather than thrown.
 *
 * @param <I> input item type
 */
@FunctionalInterface
public interface StageProcessor<I> {

    /**
     * @throws InterruptedException if a blocking downstream hand-off was interrupted
     */
    StageOutcome process(I item) throws InterruptedException;
}
