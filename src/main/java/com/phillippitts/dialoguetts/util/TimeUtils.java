package com.phillippitts.dialoguetts.util;

/**
 * Utility methods for time and audio-frame conversions.
 *
 * <p>Frame conversions use integer arithmetic only, so silence and duration calculations
 * are exact at the sample level.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Number of whole frames covering the given duration (truncated).
     *
     * @param durationMs duration in milliseconds
     * @param sampleRate frames per second
     * @return frame count
     */
    public static long millisToFrames(long durationMs, int sampleRate) {
        return (long) sampleRate * durationMs / 1000L;
    }

    /**
     * Duration in milliseconds of the given number of frames (truncated).
     */
    public static long framesToMillis(long frames, int sampleRate) {
        if (sampleRate <= 0) {
            return 0;
        }
        return frames * 1000L / sampleRate;
    }
}
