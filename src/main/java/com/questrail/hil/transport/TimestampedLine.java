package com.questrail.hil.transport;

import com.questrail.hil.internal.time.MonotonicClock;

import java.util.Objects;

/**
 * TimestampedLine
 * =============================================================================
 * One line of received text plus the monotonic time at which the blocking read
 * that completed it returned.
 *
 * <p>Equality is defined on the text only, so a line can be compared directly
 * against a literal reply. The timestamp is what decides staleness: a reply is
 * only valid for a request if it was received strictly after the request was
 * enqueued (see {@link #isAfter(long)}).</p>
 */
public final class TimestampedLine
{
    private final String text;
    private final long timestampNanos;

    public TimestampedLine(String text, long timestampNanos)
    {
        this.text = Objects.requireNonNull(text, "text");
        this.timestampNanos = timestampNanos;
    }

    public String text()
    {
        return text;
    }

    /**
     * Receive time on the session's {@link MonotonicClock}.
     */
    public long timestampNanos()
    {
        return timestampNanos;
    }

    public double timestampSeconds()
    {
        return MonotonicClock.toSeconds(timestampNanos);
    }

    /**
     * Whether this line was received strictly after {@code nanos}.
     */
    public boolean isAfter(long nanos)
    {
        return timestampNanos > nanos;
    }

    public boolean isBlank()
    {
        return text.isBlank();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof TimestampedLine)) return false;
        return text.equals(((TimestampedLine) o).text);
    }

    @Override
    public int hashCode()
    {
        return text.hashCode();
    }

    @Override
    public String toString()
    {
        return text;
    }
}
