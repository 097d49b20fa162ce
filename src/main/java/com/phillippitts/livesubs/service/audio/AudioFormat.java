package com.phillippitts.livesubs.service.audio;

/**
 * The one PCM format the pipeline works in: 16 kHz, 16-bit signed, mono, little-endian.
 */
public final class AudioFormat {

    public static final int SAMPLE_RATE = 16_000;
    public static final int BITS_PER_SAMPLE = 16;
    public static final int CHANNELS = 1;

    public static final boolean SIGNED = true;
    public static final boolean BIG_ENDIAN = false;

    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS; // 2 bytes
    public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;          // 32,000

    private AudioFormat() {}

    /**
     * Decodes little-endian 16-bit PCM bytes into samples. A trailing odd byte is ignored.
     */
    public static short[] toSamples(byte[] pcm, int length) {
        int count = Math.min(length, pcm.length) / BLOCK_ALIGN;
        short[] samples = new short[count];
        for (int i = 0; i < count; i++) {
            int lo = pcm[2 * i] & 0xFF;
            int hi = pcm[2 * i + 1];
            samples[i] = (short) ((hi << 8) | lo);
        }
        return samples;
    }

    /**
     * Encodes samples as little-endian 16-bit PCM.
     */
    public static byte[] toBytes(short[] samples) {
        byte[] pcm = new byte[samples.length * BLOCK_ALIGN];
        for (int i = 0; i < samples.length; i++) {
            pcm[2 * i] = (byte) (samples[i] & 0xFF);
            pcm[2 * i + 1] = (byte) ((samples[i] >>> 8) & 0xFF);
        }
        return pcm;
    }

    public static double durationSeconds(int sampleCount) {
        return (double) sampleCount / SAMPLE_RATE;
    }
}
