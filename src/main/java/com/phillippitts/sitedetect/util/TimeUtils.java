package com.phillippitts.sitedetect.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Elapsed-time helpers for engine calls and request timing.
 *
 * <p>Latencies are measured with {@link System#nanoTime()}; wall-clock instants come from an
 * injected {@link Clock} so breakers and health checks stay testable.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds elapsed since a {@link System#nanoTime()} reading; never negative.
     */
    public static long elapsedMillis(long startNanos) {
        return Math.max(0L, (System.nanoTime() - startNanos) / NANOS_PER_MILLI);
    }

    /**
     * True when at least {@code timeout} has passed between {@code since} and the clock's now.
     */
    public static boolean hasElapsed(Clock clock, Instant since, Duration timeout) {
        if (since == null) {
            return true;
        }
        return !Duration.between(since, clock.instant()).minus(timeout).isNegative();
    }
}
