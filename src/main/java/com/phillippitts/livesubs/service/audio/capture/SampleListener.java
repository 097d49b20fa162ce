package com.phillippitts.livesubs.service.audio.capture;

/**
 * Receives raw sample buffers on the capture thread.
 */
@FunctionalInterface
public interface SampleListener {

    /**
     * @param samples freshly decoded samples; the listener may keep the array
     * @throws InterruptedException if the listener was blocked by backpressure and interrupted
     */
    void onSamples(short[] samples) throws InterruptedException;
}
