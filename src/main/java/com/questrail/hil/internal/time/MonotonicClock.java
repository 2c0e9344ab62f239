package com.questrail.hil.internal.time;

import java.time.Duration;

/**
 * MonotonicClock
 * =============================================================================
 * The single time source of a serial session.
 *
 * <h2>Binding invariant</h2>
 * Receive timestamps, enqueue times and every timeout of a session are read from
 * the same clock instance. Request/reply correlation compares these values
 * directly, so mixing clocks (or using wall-clock time) breaks stale-reply
 * rejection.
 */
public interface MonotonicClock
{
    long NANOS_PER_SECOND = 1_000_000_000L;

    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful relative to each other.
     */
    long nowNanos();

    /**
     * The current tick in fractional seconds.
     */
    default double nowSeconds()
    {
        return toSeconds(nowNanos());
    }

    /**
     * Nanoseconds elapsed since {@code startNanos}.
     */
    default long elapsedNanos(long startNanos)
    {
        return nowNanos() - startNanos;
    }

    /**
     * Whether more than {@code budget} has elapsed since {@code startNanos}.
     * A zero budget never expires.
     */
    default boolean isExpired(long startNanos, Duration budget)
    {
        return !budget.isZero() && elapsedNanos(startNanos) > saturatedNanos(budget);
    }

    static double toSeconds(long nanos)
    {
        return nanos / (double) NANOS_PER_SECOND;
    }

    /**
     * {@code duration} in nanoseconds, clamped to the {@code long} range for
     * durations longer than about 292 years.
     */
    static long saturatedNanos(Duration duration)
    {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    /**
     * {@code tickNanos + deltaNanos}, clamped instead of wrapping, so a huge
     * delay yields a far deadline rather than one in the past.
     */
    static long saturatedAdd(long tickNanos, long deltaNanos)
    {
        try {
            return Math.addExact(tickNanos, deltaNanos);
        } catch (ArithmeticException e) {
            return deltaNanos > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }

    /**
     * {@code laterNanos - earlierNanos}, clamped instead of wrapping.
     */
    static long saturatedDifference(long laterNanos, long earlierNanos)
    {
        try {
            return Math.subtractExact(laterNanos, earlierNanos);
        } catch (ArithmeticException e) {
            return laterNanos > earlierNanos ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }

    /**
     * Rejects negative and NaN values. Infinity and other out-of-range values
     * saturate to the longest representable duration.
     */
    static Duration ofSeconds(double seconds)
    {
        if (seconds < 0 || Double.isNaN(seconds)) {
            throw new IllegalArgumentException("seconds must be >= 0: " + seconds);
        }
        return Duration.ofNanos(Math.round(seconds * NANOS_PER_SECOND));
    }
}
