package com.phillippitts.livesubs.service.audio;

import com.phillippitts.livesubs.domain.AudioChunk;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Accumulates raw samples into fixed-duration {@link AudioChunk}s.
 *
 * <p>Every emitted chunk holds exactly {@link #samplesPerChunk()} samples except the single
 * flush chunk, which holds whatever remained and is suppressed when nothing did. Sequence
 * numbers start at 0 and are gap-free.
 *
 * <p>{@code push} is called from the capture thread and {@code flush} from the stopping
 * thread, so both are synchronized.
 */
public final class Chunker {

    private static final Logger LOG = LogManager.getLogger(Chunker.class);

    /** Receives completed chunks; may block for backpressure. */
    @FunctionalInterface
    public interface ChunkSink {
        void accept(AudioChunk chunk) throws InterruptedException;
    }

    private final int samplesPerChunk;
    private final int sampleRate;
    private final ChunkSink sink;

    private short[] accumulator;
    private int filled;
    private long nextSequence;
    private boolean flushed;

    public Chunker(double chunkDurationSeconds, int sampleRate, ChunkSink sink) {
        if (!(chunkDurationSeconds > 0)) {
            throw new IllegalArgumentException("chunkDurationSeconds must be > 0, got: " + chunkDurationSeconds);
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be > 0, got: " + sampleRate);
        }
        this.samplesPerChunk = (int) Math.round(chunkDurationSeconds * sampleRate);
        if (samplesPerChunk < 1) {
            throw new IllegalArgumentException("Chunk duration " + chunkDurationSeconds
                    + "s is shorter than one sample at " + sampleRate + " Hz");
        }
        this.sampleRate = sampleRate;
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.accumulator = new short[samplesPerChunk];
    }

    /**
     * Appends samples, emitting one chunk each time a full chunk duration has accumulated.
     * The remainder is carried into the next chunk.
     *
     * @throws IllegalStateException if called after {@link #flush()}
     */
    public synchronized void push(short[] samples) throws InterruptedException {
        Objects.requireNonNull(samples, "samples must not be null");
        if (flushed) {
            throw new IllegalStateException("Chunker already flushed");
        }
        int offset = 0;
        while (offset < samples.length) {
            if (filled == samplesPerChunk) {
                emitFull();
            }
            int n = Math.min(samplesPerChunk - filled, samples.length - offset);
            System.arraycopy(samples, offset, accumulator, filled, n);
            filled += n;
            offset += n;
        }
        if (filled == samplesPerChunk) {
            emitFull();
        }
    }

    /**
     * Emits the remaining samples as the final chunk. Only the first call has any effect.
     *
     * @return true if a final chunk was emitted, false if there was no remainder
     */
    public synchronized boolean flush() throws InterruptedException {
        if (flushed) {
            LOG.debug("Chunker flush ignored; already flushed");
            return false;
        }
        flushed = true;
        if (filled == 0) {
            LOG.debug("Chunker flush suppressed; no remaining samples");
            return false;
        }
        short[] remainder = new short[filled];
        System.arraycopy(accumulator, 0, remainder, 0, filled);
        filled = 0;
        emit(remainder, true);
        return true;
    }

    /** Number of chunks emitted so far; also the next sequence number. */
    public synchronized long emittedCount() {
        return nextSequence;
    }

    public int samplesPerChunk() {
        return samplesPerChunk;
    }

    // A full accumulator survives an interrupted hand-off and is retried on the next push.
    private void emitFull() throws InterruptedException {
        emit(accumulator, false);
        accumulator = new short[samplesPerChunk];
        filled = 0;
    }

    private void emit(short[] samples, boolean isFinal) throws InterruptedException {
        AudioChunk chunk = new AudioChunk(nextSequence, samples, (double) samples.length / sampleRate, isFinal);
        sink.accept(chunk);
        nextSequence++;
    }
}
