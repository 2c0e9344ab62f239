package com.questrail.hil.race;

import com.questrail.hil.internal.time.Cancellable;
import com.questrail.hil.internal.time.MonotonicClock;
import com.questrail.hil.internal.time.MonotonicScheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * RaceCoordinator
 * =============================================================================
 * Runs a primary task concurrently with secondary tasks and resolves on the
 * primary's completion.
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>{@link #observe}: wait for the primary; the secondaries keep running and
 *       the ones still pending are returned.</li>
 *   <li>{@link #observeAssertNotDone}: as {@code observe}, but fail with
 *       {@link ObservedTaskExitedException} the moment a secondary completes
 *       first. Used for liveness checks: a short task runs while a background
 *       activity must stay alive.</li>
 *   <li>{@link #gate}: wait for the primary, then cancel every pending secondary
 *       and await each cancellation before returning. Used to race a search
 *       against background noise. No secondary survives the call.</li>
 * </ul>
 *
 * <h2>Timeouts</h2>
 * A non-zero timeout bounds the wait for the primary; the returned future then
 * fails with {@link TimeoutException}. {@link Duration#ZERO} waits forever.
 * {@code observe} never cancels anything on timeout; {@code gate} cancels every
 * pending task, primary included.
 *
 * <p>All tasks must already be started. Waiting is expressed as completion
 * callbacks, so the calling thread is never blocked.</p>
 */
public final class RaceCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RaceCoordinator.class);

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;

    public RaceCoordinator(MonotonicScheduler scheduler, MonotonicClock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return the secondaries still pending when the primary completed
     */
    public <T> CompletableFuture<Set<CompletableFuture<?>>> observe(CompletableFuture<T> primary,
                                                                  Duration timeout,
                                                                  CompletableFuture<?>... secondaries) {
        CompletableFuture<RaceSet<T>> outcome = race(new RaceSet<>(primary, Arrays.asList(secondaries)), timeout, false);
        return disarmOnCancel(outcome, outcome.thenApply(RaceSet::pendingSecondaries));
    }

    /**
     * @return the secondaries, all still pending
     */
    public <T> CompletableFuture<Set<CompletableFuture<?>>> observeAssertNotDone(CompletableFuture<T> primary,
                                                                               Duration timeout,
                                                                               CompletableFuture<?>... secondaries) {
        CompletableFuture<RaceSet<T>> outcome = race(new RaceSet<>(primary, Arrays.asList(secondaries)), timeout, true);
        return disarmOnCancel(outcome, outcome.thenApply(RaceSet::pendingSecondaries));
    }

    /**
     * Completes with the gate's result and the secondaries that were cancelled.
     * If the gate itself failed, the returned future fails with the same cause
     * once the secondaries are cancelled. Cancelling the returned future cancels
     * every pending task, the gate included.
     */
    public <T> CompletableFuture<GateResult<T>> gate(CompletableFuture<T> gate,
                                                     Duration timeout,
                                                     CompletableFuture<?>... gated) {
        RaceSet<T> set = new RaceSet<>(gate, Arrays.asList(gated));
        long startNanos = clock.nowNanos();

        CompletableFuture<RaceSet<T>> outcome = race(set, timeout, false);
        CompletableFuture<GateResult<T>> result = outcome.handle((completed, failure) -> {
            if (failure != null) {
                cancelAndAwait(set.pending());
                throw asCompletionException(failure);
            }

            List<CompletableFuture<?>> cancelled = cancelAndAwait(set.pendingSecondaries());
            log.debug("Gate passed after {} s; cancelled {} gated task(s)",
                    MonotonicClock.toSeconds(clock.elapsedNanos(startNanos)), cancelled.size());

            // Rethrows the gate's own failure, if any.
            T value = gate.join();
            return new GateResult<>(value, cancelled);
        });
        // A cancelled outcome takes the failure path above and cancels every pending task.
        return disarmOnCancel(outcome, result);
    }

    private <T> CompletableFuture<RaceSet<T>> race(RaceSet<T> set,
                                                  Duration timeout,
                                                  boolean secondariesMustKeepRunning) {
        Objects.requireNonNull(timeout, "timeout");
        CompletableFuture<RaceSet<T>> outcome = new CompletableFuture<>();

        if (!timeout.isZero()) {
            Cancellable deadline = scheduler.scheduleAfter(timeout, clock, () ->
                    outcome.completeExceptionally(new TimeoutException(
                            "primary task did not complete within " + timeout)));
            outcome.whenComplete((ignored, failure) -> deadline.cancel());
        }

        // Secondaries first: one that is already done must be seen before the primary.
        for (CompletableFuture<?> secondary : set.secondaries()) {
            secondary.whenComplete((ignored, failure) -> {
                set.markDone(secondary);
                if (secondariesMustKeepRunning && !set.isPrimaryDone()) {
                    outcome.completeExceptionally(new ObservedTaskExitedException(
                            "Tasks under observation completed before the observation was complete."));
                }
            });
        }

        set.primary().whenComplete((ignored, failure) -> {
            set.markDone(set.primary());
            outcome.complete(set);
        });

        return outcome;
    }

    /**
     * Cancelling {@code derived} cancels {@code outcome}, which disarms its
     * deadline.
     */
    private static <R> CompletableFuture<R> disarmOnCancel(CompletableFuture<?> outcome, CompletableFuture<R> derived) {
        derived.whenComplete((value, failure) -> {
            if (derived.isCancelled()) {
                outcome.cancel(false);
            }
        });
        return derived;
    }

    private static List<CompletableFuture<?>> cancelAndAwait(Collection<CompletableFuture<?>> tasks) {
        List<CompletableFuture<?>> cancelled = new ArrayList<>();
        for (CompletableFuture<?> task : tasks) {
            if (task.cancel(true)) {
                cancelled.add(task);
            }
            awaitSettled(task);
        }
        return cancelled;
    }

    private static void awaitSettled(CompletableFuture<?> task) {
        try {
            task.join();
        } catch (CancellationException expected) {
            log.trace("Gated task cancelled: {}", task);
        } catch (CompletionException e) {
            log.debug("Gated task had already failed", e.getCause());
        }
    }

    private static CompletionException asCompletionException(Throwable failure) {
        if (failure instanceof CompletionException) {
            return (CompletionException) failure;
        }
        return new CompletionException(failure);
    }
}
