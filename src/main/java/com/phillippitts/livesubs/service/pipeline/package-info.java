/**
 * Streaming orchestration: bounded {@link com.phillippitts.livesubs.service.pipeline.StageQueue}s,
 * one {@link com.phillippitts.livesubs.service.pipeline.StageWorker} thread per stage, and the
 * {@link com.phillippitts.livesubs.service.pipeline.SubtitlePipeline} state machine that starts and
 * stops them.
 *
 * <p>Finalized items are never dropped; partial items may be, under overload.
 */
package com.phillippitts.livesubs.service.pipeline;
