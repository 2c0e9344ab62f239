package com.questrail.hil.race;

import com.questrail.hil.internal.time.Cancellable;
import com.questrail.hil.internal.time.MonotonicClock;
import com.questrail.hil.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * PeriodicActivity
 * =============================================================================
 * A never-ending background task for races: wait {@code period}, run one async
 * step, repeat.
 *
 * <p>The returned future only completes when it is cancelled (typically by
 * {@link RaceCoordinator#gate}) or when a step fails, in which case it fails
 * with the step's cause. Cancelling it disarms the next wakeup and cancels a
 * step that is still in flight, so nothing runs afterwards.</p>
 */
public final class PeriodicActivity
{
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration period;
    private final Supplier<? extends CompletionStage<?>> step;

    private final CompletableFuture<Void> result = new CompletableFuture<>();
    private final AtomicReference<Cancellable> armed = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<?>> inFlight = new AtomicReference<>();

    private PeriodicActivity(MonotonicScheduler scheduler,
                             MonotonicClock clock,
                             Duration period,
                             Supplier<? extends CompletionStage<?>> step)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.period = Objects.requireNonNull(period, "period");
        this.step = Objects.requireNonNull(step, "step");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }
    }

    public static CompletableFuture<Void> start(MonotonicScheduler scheduler,
                                                MonotonicClock clock,
                                                Duration period,
                                                Supplier<? extends CompletionStage<?>> step)
    {
        PeriodicActivity activity = new PeriodicActivity(scheduler, clock, period, step);
        activity.result.whenComplete((ignored, failure) -> activity.disarm());
        activity.arm();
        return activity.result;
    }

    /**
     * Convenience for synchronous steps.
     */
    public static CompletableFuture<Void> every(MonotonicScheduler scheduler,
                                                MonotonicClock clock,
                                                Duration period,
                                                Runnable step)
    {
        Objects.requireNonNull(step, "step");
        return start(scheduler, clock, period, () -> {
            step.run();
            return CompletableFuture.completedFuture(null);
        });
    }

    private void arm()
    {
        if (result.isDone()) {
            return;
        }
        armed.set(scheduler.scheduleAfter(period, clock, this::fire));
        if (result.isDone()) {
            disarm();
        }
    }

    private void fire()
    {
        if (result.isDone()) {
            return;
        }

        CompletableFuture<?> running;
        try {
            running = step.get().toCompletableFuture();
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }

        inFlight.set(running);
        running.whenComplete((ignored, failure) -> {
            inFlight.compareAndSet(running, null);
            if (failure != null) {
                result.completeExceptionally(failure);
            } else {
                arm();
            }
        });
    }

    private void disarm()
    {
        Cancellable next = armed.getAndSet(null);
        if (next != null) {
            next.cancel();
        }
        CompletableFuture<?> running = inFlight.getAndSet(null);
        if (running != null) {
            running.cancel(true);
        }
    }
}
