package com.phillippitts.livesubs.util;

import java.time.Duration;

/**
 * Timeout values for subprocess and worker-thread lifecycle management.
 *
 * @see com.phillippitts.livesubs.service.stt.whisper.WhisperProcessManager
 * @see com.phillippitts.livesubs.service.audio.capture.JavaSoundAudioSource
 * @see com.phillippitts.livesubs.service.pipeline.SubtitlePipeline
 */
public final class ProcessTimeouts {

    /**
     * Time allowed for stream gobbler threads to flush buffered output after the whisper process
     * exits. Sufficient for typical stdout/stderr volumes (&lt;100KB).
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}; a process surviving this is abandoned. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Time allowed for the capture thread to leave its read loop on stop. Longer than the gobbler
     * timeout because the thread may be blocked in {@code TargetDataLine.read}.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /** Wait for a stage worker after it has been halted past the shutdown grace period. */
    public static final Duration STAGE_HALT_TIMEOUT = Duration.ofMillis(200);

    /**
     * Slice in which the capture thread waits for room in the audio queue before re-checking
     * whether a stop has armed the shutdown deadline.
     */
    public static final Duration CHUNK_HANDOFF_POLL = Duration.ofMillis(50);

    private ProcessTimeouts() {
    }
}
