package com.questrail.hil.internal.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * MonotonicScheduler
 * =============================================================================
 * The cooperative scheduler every driver and race step runs on.
 *
 * <h2>Binding invariant</h2>
 * Deadlines are monotonic nanoseconds read from the session's
 * {@link MonotonicClock}. Implementations run tasks one at a time, so code that
 * only ever executes as a scheduled task needs no locking.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task after a delay measured on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadlineNanos = MonotonicClock.saturatedAdd(clock.nowNanos(), MonotonicClock.saturatedNanos(delay));
        return scheduleAtNanos(deadlineNanos, task);
    }

    /**
     * A future that completes after {@code delay}. Cancelling the future disarms
     * the wakeup.
     */
    default CompletableFuture<Void> sleep(Duration delay, MonotonicClock clock)
    {
        CompletableFuture<Void> wakeup = new CompletableFuture<>();
        Cancellable armed = scheduleAfter(delay, clock, () -> wakeup.complete(null));
        wakeup.whenComplete((ignored, failure) -> armed.cancel());
        return wakeup;
    }
}
