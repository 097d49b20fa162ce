package com.phillippitts.livesubs.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.livesubs.service.audio.AudioFormat.BITS_PER_SAMPLE;
import static com.phillippitts.livesubs.service.audio.AudioFormat.BLOCK_ALIGN;
import static com.phillippitts.livesubs.service.audio.AudioFormat.BYTE_RATE;
import static com.phillippitts.livesubs.service.audio.AudioFormat.CHANNELS;
import static com.phillippitts.livesubs.service.audio.AudioFormat.SAMPLE_RATE;

/**
 * Writes chunk samples as a canonical 44-byte-header PCM WAV file for CLI recognizers.
 */
public final class WavWriter {

    public static final int HEADER_SIZE = 44;

    private WavWriter() {}

    /**
     * @throws IllegalStateException if the file cannot be written
     */
    public static void write(short[] samples, Path wavPath) {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        byte[] pcm = AudioFormat.toBytes(samples);
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            os.write(new byte[] {'R', 'I', 'F', 'F'});
            writeLEInt(os, 36 + pcm.length);
            os.write(new byte[] {'W', 'A', 'V', 'E'});

            os.write(new byte[] {'f', 'm', 't', ' '});
            writeLEInt(os, 16);
            writeLEShort(os, (short) 1); // PCM
            writeLEShort(os, (short) CHANNELS);
            writeLEInt(os, SAMPLE_RATE);
            writeLEInt(os, BYTE_RATE);
            writeLEShort(os, (short) BLOCK_ALIGN);
            writeLEShort(os, (short) BITS_PER_SAMPLE);

            os.write(new byte[] {'d', 'a', 't', 'a'});
            writeLEInt(os, pcm.length);
            os.write(pcm);
            os.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
