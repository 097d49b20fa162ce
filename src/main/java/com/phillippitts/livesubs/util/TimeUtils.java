package com.phillippitts.livesubs.util;

/**
 * Conversions between {@link System#nanoTime()} readings and milliseconds.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }

    /**
     * Milliseconds left until a {@code nanoTime} deadline, never less than {@code floorMillis}.
     */
    public static long millisUntil(long deadlineNanos, long floorMillis) {
        return Math.max(floorMillis, nanosToMillis(deadlineNanos - System.nanoTime()));
    }
}
