package com.phillippitts.livesubs.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the subtitle pipeline.
 *
 * <p>Queue capacities are deliberately small: total buffering must stay within roughly one chunk
 * of extra latency, so the audio and recognition queues together hold at most
 * {@value #MAX_BUFFERED_ITEMS} items.
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Upper bound on audio plus recognition queue capacity. */
    public static final int MAX_BUFFERED_ITEMS = 4;

    /** What the chunker does when the recognition stage cannot keep up. */
    public enum AudioOverflowPolicy {
        /** Every chunk is finalized: the capture thread blocks until there is room. */
        BLOCK,
        /** Non-final chunks may be dropped oldest-first; the flush chunk still blocks. */
        DROP_OLDEST
    }

    @DecimalMin(value = "0.1")
    @DecimalMax(value = "30.0")
    private final double chunkDurationSeconds;

    /** Capture device index; negative selects the system default line. */
    private final int audioDeviceIndex;

    @Min(1)
    @Max(3)
    private final int audioQueueCapacity;

    @Min(1)
    @Max(3)
    private final int recognitionQueueCapacity;

    @Min(1)
    @Max(64)
    private final int displayQueueCapacity;

    @NotNull
    private final AudioOverflowPolicy audioOverflowPolicy;

    @Min(100)
    @Max(60_000)
    private final long shutdownGraceMillis;

    /** RMS level below which non-final chunks skip recognition; 0 disables the gate. */
    @DecimalMin(value = "0.0")
    @DecimalMax(value = "1.0")
    private final double silenceRmsThreshold;

    private final boolean autoStart;

    @ConstructorBinding
    public PipelineProperties(Double chunkDurationSeconds,
                              Integer audioDeviceIndex,
                              Integer audioQueueCapacity,
                              Integer recognitionQueueCapacity,
                              Integer displayQueueCapacity,
                              AudioOverflowPolicy audioOverflowPolicy,
                              Long shutdownGraceMillis,
                              Double silenceRmsThreshold,
                              Boolean autoStart) {
        this.chunkDurationSeconds = chunkDurationSeconds == null ? 2.0 : chunkDurationSeconds;
        this.audioDeviceIndex = audioDeviceIndex == null ? -1 : audioDeviceIndex;
        this.audioQueueCapacity = audioQueueCapacity == null ? 2 : audioQueueCapacity;
        this.recognitionQueueCapacity = recognitionQueueCapacity == null ? 2 : recognitionQueueCapacity;
        this.displayQueueCapacity = displayQueueCapacity == null ? 8 : displayQueueCapacity;
        this.audioOverflowPolicy = audioOverflowPolicy == null ? AudioOverflowPolicy.BLOCK : audioOverflowPolicy;
        this.shutdownGraceMillis = shutdownGraceMillis == null ? 3000L : shutdownGraceMillis;
        this.silenceRmsThreshold = silenceRmsThreshold == null ? 0.0 : silenceRmsThreshold;
        this.autoStart = autoStart == null || autoStart;
        if (this.audioQueueCapacity + this.recognitionQueueCapacity > MAX_BUFFERED_ITEMS) {
            throw new IllegalArgumentException("audio-queue-capacity + recognition-queue-capacity must be <= "
                    + MAX_BUFFERED_ITEMS + ", got: " + this.audioQueueCapacity + " + " + this.recognitionQueueCapacity);
        }
    }

    /**
     * Defaults for everything; used by tests and manual wiring.
     */
    public static PipelineProperties defaults() {
        return new PipelineProperties(null, null, null, null, null, null, null, null, null);
    }

    public double getChunkDurationSeconds() {
        return chunkDurationSeconds;
    }

    public int getAudioDeviceIndex() {
        return audioDeviceIndex;
    }

    public int getAudioQueueCapacity() {
        return audioQueueCapacity;
    }

    public int getRecognitionQueueCapacity() {
        return recognitionQueueCapacity;
    }

    public int getDisplayQueueCapacity() {
        return displayQueueCapacity;
    }

    public AudioOverflowPolicy getAudioOverflowPolicy() {
        return audioOverflowPolicy;
    }

    public long getShutdownGraceMillis() {
        return shutdownGraceMillis;
    }

    public double getSilenceRmsThreshold() {
        return silenceRmsThreshold;
    }

    public boolean isAutoStart() {
        return autoStart;
    }
}
