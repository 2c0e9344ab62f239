package com.questrail.hil.internal.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * PollingLoop
 * =============================================================================
 * Bridges a non-blocking attempt to the cooperative scheduler.
 *
 * <p>The first attempt runs on the calling thread. Every further attempt is
 * armed on the {@link MonotonicScheduler} {@code interval} later, until the
 * attempt settles the result future. Completing or cancelling the returned
 * future from outside disarms the next attempt.</p>
 *
 * @param <T> result type
 */
public final class PollingLoop<T> {

    /**
     * One non-blocking attempt.
     */
    @FunctionalInterface
    public interface Attempt<T> {
        /**
         * Try once. Complete {@code result} (normally or exceptionally) to stop
         * the loop; leave it incomplete to be called again.
         */
        void attempt(CompletableFuture<T> result);
    }

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration interval;
    private final Attempt<T> attempt;
    private final CompletableFuture<T> result = new CompletableFuture<>();
    private final AtomicReference<Cancellable> armed = new AtomicReference<>();

    private PollingLoop(MonotonicScheduler scheduler, MonotonicClock clock, Duration interval, Attempt<T> attempt) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.attempt = Objects.requireNonNull(attempt, "attempt");
    }

    public static <T> CompletableFuture<T> start(MonotonicScheduler scheduler,
                                                 MonotonicClock clock,
                                                 Duration interval,
                                                 Attempt<T> attempt) {
        PollingLoop<T> loop = new PollingLoop<>(scheduler, clock, interval, attempt);
        loop.result.whenComplete((value, failure) -> loop.disarm());
        loop.step();
        return loop.result;
    }

    private void step() {
        if (result.isDone()) {
            return;
        }
        try {
            attempt.attempt(result);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        if (!result.isDone()) {
            armed.set(scheduler.scheduleAfter(interval, clock, this::step));
            // Cancelled while arming.
            if (result.isDone()) {
                disarm();
            }
        }
    }

    private void disarm() {
        Cancellable next = armed.getAndSet(null);
        if (next != null) {
            next.cancel();
        }
    }
}
