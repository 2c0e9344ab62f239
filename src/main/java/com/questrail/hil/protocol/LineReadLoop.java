package com.questrail.hil.protocol;

import com.questrail.hil.transport.LineTransport;
import com.questrail.hil.transport.TimestampedLine;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * LineReadLoop
 * =============================================================================
 * The read side shared by the protocol drivers:
 *
 * <pre>
 *   WAITING_FOR_LINE --(stale / ignored line)--&gt; WAITING_FOR_LINE
 *   WAITING_FOR_LINE --(qualifying line)------&gt; DONE(success | failure)
 *   WAITING_FOR_LINE --(budget exhausted)-----&gt; DONE(timeout)
 * </pre>
 *
 * <p>Subclasses decide the budget for each read and what a line means; they
 * settle the loop with {@link #complete} or {@link #fail}. Lines that are
 * already buffered are consumed iteratively on the calling thread, so a long
 * backlog does not grow the stack.</p>
 *
 * <p>Cancelling the future returned by {@link #start()} cancels the read in
 * flight. A line that raced with that cancellation, or that arrives after the
 * loop was settled from elsewhere, goes back to the head of the transport's
 * queue, so nothing is lost for the next reader.</p>
 *
 * @param <T> result type
 */
public abstract class LineReadLoop<T>
{
    protected final LineTransport transport;

    private final CompletableFuture<T> result = new CompletableFuture<>();
    private final AtomicReference<CompletableFuture<TimestampedLine>> reading = new AtomicReference<>();

    protected LineReadLoop(LineTransport transport)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public final CompletableFuture<T> start()
    {
        result.whenComplete((value, failure) -> {
            CompletableFuture<TimestampedLine> pending = reading.getAndSet(null);
            if (pending != null) {
                pending.cancel(false);
            }
        });
        readNext();
        return result;
    }

    /**
     * Budget for the next read; {@link Duration#ZERO} waits forever.
     *
     * @return {@code null} once the overall budget is exhausted
     */
    protected abstract Duration nextTimeout();

    protected abstract void onLine(TimestampedLine line);

    /**
     * Called when {@link #nextTimeout()} reports an exhausted budget. Must
     * settle the loop.
     */
    protected void onBudgetExhausted()
    {
        fail(new TimeoutException("no qualifying line within the time budget"));
    }

    /**
     * Called with the unwrapped cause when a read fails. Must settle the loop.
     */
    protected void onReadFailure(Throwable cause)
    {
        fail(cause);
    }

    protected final void complete(T value)
    {
        result.complete(value);
    }

    protected final void fail(Throwable cause)
    {
        result.completeExceptionally(cause);
    }

    protected final boolean isDone()
    {
        return result.isDone();
    }

    private void readNext()
    {
        while (!result.isDone()) {
            Duration timeout = nextTimeout();
            if (timeout == null) {
                onBudgetExhausted();
                return;
            }

            CompletableFuture<TimestampedLine> next = transport.getLine(timeout);
            reading.set(next);
            if (result.isDone()) {
                if (!next.cancel(false)) {
                    // Already read; deliver() hands the line back.
                    deliver(next);
                }
                return;
            }

            if (!next.isDone()) {
                next.whenComplete((line, failure) -> {
                    if (deliver(next)) {
                        readNext();
                    }
                });
                return;
            }

            if (!deliver(next)) {
                return;
            }
        }
    }

    /**
     * @return true if the loop should keep reading
     */
    private boolean deliver(CompletableFuture<TimestampedLine> next)
    {
        reading.compareAndSet(next, null);

        TimestampedLine line;
        try {
            line = next.join();
        } catch (CancellationException e) {
            // Only cancelled by start() once the result is settled.
            return false;
        } catch (CompletionException e) {
            onReadFailure(e.getCause() != null ? e.getCause() : e);
            return false;
        }

        if (result.isDone()) {
            // Settled from elsewhere while the read completed.
            transport.unreadLine(line);
            return false;
        }

        try {
            onLine(line);
        } catch (RuntimeException e) {
            fail(e);
            return false;
        }
        return !result.isDone();
    }
}
