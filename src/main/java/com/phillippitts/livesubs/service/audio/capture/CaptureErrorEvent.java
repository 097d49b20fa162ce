package com.phillippitts.livesubs.service.audio.capture;

import java.time.Instant;

/**
 * Published when capture fails after the device was opened.
 *
 * @param reason      short machine-readable reason, e.g. {@code CAPTURE_ERROR}
 * @param deviceIndex device that failed
 * @param at          when the failure was observed
 */
public record CaptureErrorEvent(String reason, int deviceIndex, Instant at) { }
