package com.phillippitts.audioprep.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Utility methods for elapsed time calculations and run timestamps.
 *
 * <p>Elapsed helpers work on {@link System#nanoTime()} values and feed stage timings.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    /**
     * Format of run timestamps embedded in artifact names, e.g. {@code 2024-03-01-14-05-09}.
     */
    public static final DateTimeFormatter RUN_TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss");

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
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
     * Formats a run timestamp for artifact names.
     */
    public static String runTimestamp(LocalDateTime time) {
        return RUN_TIMESTAMP_FORMAT.format(time);
    }

    /**
     * Run timestamp for the current local time.
     */
    public static String runTimestamp() {
        return runTimestamp(LocalDateTime.now());
    }
}
