package com.questrail.hil.internal.time;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Cooperative execution</h2>
 * <p>Drivers assume their continuations never run concurrently with each other.
 * Use a single-threaded executor ({@link #singleThreaded(String)})
 * unless every scheduled task is independently thread-safe.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> shut the executor down. The composition
 * root that created it is responsible for that.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates a single daemon-threaded executor named {@code threadName}.
     * The caller owns the returned executor.
     */
    public static ScheduledExecutorService singleThreaded(String threadName) {
        Objects.requireNonNull(threadName, "threadName");
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    public MonotonicClock clock() {
        return clock;
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Past deadlines run immediately.
        long delayNanos = Math.max(0, MonotonicClock.saturatedDifference(deadlineNanos, clock.nowNanos()));

        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
