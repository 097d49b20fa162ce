package com.phillippitts.livesubs.service.audio.capture;

import java.util.List;

/**
 * Delivers raw microphone samples to the pipeline.
 *
 * <p>Samples are always 16 kHz, 16-bit, mono. Only one capture may be active at a time.
 */
public interface AudioSource {

    /** Devices that can be opened in the pipeline's format. */
    List<AudioDevice> listDevices();

    /**
     * Opens the device and begins delivering samples on a capture thread.
     *
     * @param deviceIndex index from {@link #listDevices()}, or negative for the system default
     * @throws com.phillippitts.livesubs.exception.AudioSourceException if the device cannot be opened
     * @throws IllegalStateException if a capture is already active
     */
    void start(int deviceIndex, SampleListener listener);

    /** Stops delivery and waits briefly for the capture thread. No-op when not capturing. */
    void stop();

    boolean isCapturing();
}
