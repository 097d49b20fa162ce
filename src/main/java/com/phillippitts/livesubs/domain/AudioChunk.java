package com.phillippitts.livesubs.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * A slice of mono 16 kHz PCM audio handed from the chunker to the recognition stage.
 *
 * @param sequence        gap-free, strictly increasing chunk number starting at 0
 * @param samples         signed 16-bit samples (never empty)
 * @param durationSeconds duration of {@code samples} at the capture sample rate
 * @param isFinal         true only for the flush chunk emitted when the pipeline stops
 *
 * <p>Equality compares sample content, not array identity. The array is not copied; callers must
 * not modify it after construction.
 */
public record AudioChunk(long sequence, short[] samples, double durationSeconds, boolean isFinal) {

    public AudioChunk {
        Objects.requireNonNull(samples, "samples must not be null");
        if (samples.length == 0) {
            throw new IllegalArgumentException("samples must not be empty");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0, got: " + sequence);
        }
    }

    public int sampleCount() {
        return samples.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioChunk other)) {
            return false;
        }
        return sequence == other.sequence
                && Double.compare(durationSeconds, other.durationSeconds) == 0
                && isFinal == other.isFinal
                && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sequence, durationSeconds, isFinal);
        return 31 * result + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "AudioChunk[sequence=" + sequence + ", samples=" + samples.length
                + ", durationSeconds=" + durationSeconds + ", isFinal=" + isFinal + "]";
    }
}
