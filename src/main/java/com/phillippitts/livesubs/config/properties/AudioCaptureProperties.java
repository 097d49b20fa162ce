package com.phillippitts.livesubs.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture.
 *
 * Required format (enforced by the source): 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Size of a single read from the TargetDataLine in milliseconds. */
    @Min(10)
    @Max(200)
    private final int readChunkMillis;

    /** Line buffer size in milliseconds; must hold several reads. */
    @Min(50)
    @Max(2000)
    private final int bufferMillis;

    @ConstructorBinding
    public AudioCaptureProperties(Integer readChunkMillis, Integer bufferMillis) {
        this.readChunkMillis = readChunkMillis == null ? 40 : readChunkMillis;
        this.bufferMillis = bufferMillis == null ? 200 : bufferMillis;
    }

    public int getReadChunkMillis() { return readChunkMillis; }
    public int getBufferMillis() { return bufferMillis; }
}
