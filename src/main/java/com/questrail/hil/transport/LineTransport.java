package com.questrail.hil.transport;

import com.questrail.hil.internal.time.MonotonicClock;
import com.questrail.hil.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

/**
 * LineTransport
 * -----------------------------------------------------------------------------
 * Line-oriented, timestamped view of a serial link, safe to drive from the
 * cooperative scheduler.
 *
 * <p>The returned futures are the suspension points: they never block the
 * calling thread. All timeouts are measured on the same monotonic clock as
 * receive timestamps; {@link Duration#ZERO} waits indefinitely.</p>
 */
public interface LineTransport
{
    /**
     * Next received line.
     *
     * <p>Fails with {@link java.util.concurrent.TimeoutException} when
     * {@code timeout} elapses, or with {@link TransportStoppedException} when the
     * transport has stopped and nothing is left to read.</p>
     */
    CompletableFuture<TimestampedLine> getLine(Duration timeout);

    default CompletableFuture<TimestampedLine> getLine()
    {
        return getLine(Duration.ZERO);
    }

    /**
     * Enqueue {@code text} followed by the session line terminator.
     *
     * @return the enqueue time in monotonic nanoseconds (not the physical write time)
     */
    default CompletableFuture<Long> putLine(String text, Duration timeout)
    {
        return putLine(text, eol(), timeout);
    }

    /**
     * Enqueue {@code text} followed by {@code end}. Pass an empty {@code end} to
     * send raw characters.
     *
     * @return the enqueue time in monotonic nanoseconds
     */
    CompletableFuture<Long> putLine(String text, String end, Duration timeout);

    /**
     * Non-suspending dequeue.
     */
    Optional<TimestampedLine> tryReadLine();

    /**
     * Return a line taken by a reader that no longer wants it to the head of
     * the inbound queue, ahead of everything received since. Counted as an
     * overflow if the queue has filled up in the meantime.
     */
    void unreadLine(TimestampedLine line);

    /**
     * Non-suspending enqueue of {@code text} plus the line terminator.
     *
     * @return the enqueue time, or empty if the outbound queue was full
     */
    OptionalLong tryWriteLine(String text);

    /**
     * Current time on the clock used for receive timestamps.
     */
    long nowNanos();

    default double nowSeconds()
    {
        return MonotonicClock.toSeconds(nowNanos());
    }

    String eol();

    /**
     * Clock that stamps received lines and measures every timeout.
     */
    MonotonicClock clock();

    /**
     * Cooperative scheduler the returned futures are resumed on.
     */
    MonotonicScheduler scheduler();

    /**
     * Number of received lines dropped because the inbound queue was full.
     */
    long rxBufferOverflows();

    boolean isRunning();
}
