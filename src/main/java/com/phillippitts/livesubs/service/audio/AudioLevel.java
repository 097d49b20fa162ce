package com.phillippitts.livesubs.service.audio;

/**
 * Energy measurement used by the optional silence gate in front of recognition.
 */
public final class AudioLevel {

    private static final double FULL_SCALE = 32768.0;

    private AudioLevel() {
        // Utility class
    }

    /**
     * Root mean square of the samples, normalized to [0, 1].
     *
     * @return 0 for an empty array
     */
    public static double rms(short[] samples) {
        if (samples == null || samples.length == 0) {
            return 0.0;
        }
        double sumSquares = 0;
        for (short sample : samples) {
            double s = sample / FULL_SCALE;
            sumSquares += s * s;
        }
        return Math.sqrt(sumSquares / samples.length);
    }

    public static boolean isSilent(short[] samples, double threshold) {
        return threshold > 0 && rms(samples) < threshold;
    }
}
