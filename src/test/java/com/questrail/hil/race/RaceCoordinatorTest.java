package com.questrail.hil.race;

import com.questrail.hil.internal.time.ScheduledExecutorScheduler;
import com.questrail.hil.internal.time.SystemMonotonicClock;
import com.questrail.hil.time.DeterministicScheduler;
import com.questrail.hil.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RaceCoordinatorTest
 * -----------------------------------------------------------------------------
 * Races driven by the deterministic scheduler; one smoke test on real threads.
 */
class RaceCoordinatorTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RaceCoordinator race;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        race = new RaceCoordinator(scheduler, clock);
    }

    private <T> CompletableFuture<T> after(Duration delay, T value) {
        return scheduler.sleep(delay, clock).thenApply(ignored -> value);
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        assertTrue(future.isCompletedExceptionally(), "expected a failed future");
        return assertThrows(ExecutionException.class, future::get).getCause();
    }

    // ---------------------------------------------------------------------
    // gate
    // ---------------------------------------------------------------------

    @Test
    void gateCancelsBackgroundTasksOnceThePrimaryCompletes() throws Exception {
        AtomicInteger ticks = new AtomicInteger();
        CompletableFuture<String> primary = after(Duration.ofSeconds(1), "done");
        CompletableFuture<Void> ticker = PeriodicActivity.every(scheduler, clock, Duration.ofMillis(100),
                ticks::incrementAndGet);
        CompletableFuture<Void> idle = new CompletableFuture<>();

        CompletableFuture<GateResult<String>> gated = race.gate(primary, Duration.ZERO, ticker, idle);

        scheduler.advance(Duration.ofMillis(999));
        assertFalse(gated.isDone());

        scheduler.advance(Duration.ofMillis(1));
        GateResult<String> result = gated.getNow(null);
        assertNotNull(result);
        assertEquals("done", result.result());
        assertEquals(2, result.cancelled().size());
        assertTrue(ticker.isCancelled());
        assertTrue(idle.isCancelled());

        int ticksAtGate = ticks.get();
        assertTrue(ticksAtGate >= 9, "ticker should have run while gated");
        scheduler.advance(Duration.ofSeconds(1));
        assertEquals(ticksAtGate, ticks.get(), "no background work after the gate opens");
    }

    @Test
    void gateWithoutBackgroundTasks() throws Exception {
        CompletableFuture<GateResult<Integer>> gated = race.gate(CompletableFuture.completedFuture(7), Duration.ZERO);

        assertEquals(7, gated.get().result());
        assertTrue(gated.get().cancelled().isEmpty());
    }

    @Test
    void gateDoesNotReportAlreadyFinishedTasksAsCancelled() throws Exception {
        CompletableFuture<String> finished = CompletableFuture.completedFuture("early");
        CompletableFuture<String> primary = after(Duration.ofMillis(10), "done");

        CompletableFuture<GateResult<String>> gated = race.gate(primary, Duration.ZERO, finished);
        scheduler.advance(Duration.ofMillis(10));

        assertTrue(gated.get().cancelled().isEmpty());
        assertFalse(finished.isCancelled());
    }

    @Test
    void gatePropagatesPrimaryFailureAfterCancellingTheRest() {
        CompletableFuture<String> primary = new CompletableFuture<>();
        CompletableFuture<Void> background = new CompletableFuture<>();

        CompletableFuture<GateResult<String>> gated = race.gate(primary, Duration.ZERO, background);
        primary.completeExceptionally(new IllegalStateException("matcher failed"));

        assertInstanceOf(IllegalStateException.class, failureOf(gated));
        assertTrue(background.isCancelled());
    }

    @Test
    void gateTimeoutCancelsEveryTaskIncludingThePrimary() {
        CompletableFuture<String> primary = new CompletableFuture<>();
        CompletableFuture<Void> background = new CompletableFuture<>();

        CompletableFuture<GateResult<String>> gated = race.gate(primary, Duration.ofSeconds(1), background);
        scheduler.advance(Duration.ofSeconds(1));

        assertInstanceOf(TimeoutException.class, failureOf(gated));
        assertTrue(primary.isCancelled());
        assertTrue(background.isCancelled());
    }

    @Test
    void cancellingTheGateCancelsEveryTaskAndDisarmsTheDeadline() {
        CompletableFuture<String> primary = new CompletableFuture<>();
        CompletableFuture<Void> background = new CompletableFuture<>();

        CompletableFuture<GateResult<String>> gated = race.gate(primary, Duration.ofSeconds(1), background);
        assertEquals(1, scheduler.pendingTasks());

        assertTrue(gated.cancel(true));

        assertTrue(primary.isCancelled());
        assertTrue(background.isCancelled());
        assertEquals(0, scheduler.pendingTasks());
    }

    // ---------------------------------------------------------------------
    // observe
    // ---------------------------------------------------------------------

    @Test
    void observeLeavesSecondariesRunning() throws Exception {
        CompletableFuture<String> primary = after(Duration.ofSeconds(1), "check");
        CompletableFuture<String> slow = after(Duration.ofSeconds(2), "slow");
        CompletableFuture<String> fast = after(Duration.ofMillis(500), "fast");

        CompletableFuture<Set<CompletableFuture<?>>> observed = race.observe(primary, Duration.ZERO, slow, fast);
        scheduler.advance(Duration.ofSeconds(1));

        Set<CompletableFuture<?>> pending = observed.get();
        assertEquals(Set.of(slow), pending);
        assertFalse(slow.isDone());

        scheduler.advance(Duration.ofSeconds(1));
        assertEquals("slow", slow.getNow(null));
    }

    @Test
    void observeTimeoutCancelsNothing() {
        CompletableFuture<String> primary = new CompletableFuture<>();
        CompletableFuture<String> secondary = new CompletableFuture<>();

        CompletableFuture<Set<CompletableFuture<?>>> observed =
                race.observe(primary, Duration.ofMillis(500), secondary);

        scheduler.advance(Duration.ofMillis(499));
        assertFalse(observed.isDone());
        scheduler.advance(Duration.ofMillis(1));

        assertInstanceOf(TimeoutException.class, failureOf(observed));
        assertFalse(primary.isDone());
        assertFalse(secondary.isDone());
    }

    @Test
    void cancellingAnObservationDisarmsItsDeadlineOnly() {
        CompletableFuture<String> primary = new CompletableFuture<>();
        CompletableFuture<String> secondary = new CompletableFuture<>();

        CompletableFuture<Set<CompletableFuture<?>>> observed =
                race.observe(primary, Duration.ofMillis(500), secondary);
        assertTrue(observed.cancel(true));

        assertEquals(0, scheduler.pendingTasks());
        assertFalse(primary.isDone());
        assertFalse(secondary.isDone());
    }

    // ---------------------------------------------------------------------
    // observeAssertNotDone
    // ---------------------------------------------------------------------

    @Test
    void assertNotDonePassesWhileBackgroundKeepsRunning() throws Exception {
        CompletableFuture<String> check = after(Duration.ofMillis(500), "alive");
        CompletableFuture<Void> background = PeriodicActivity.every(scheduler, clock, Duration.ofMillis(50), () -> { });

        CompletableFuture<Set<CompletableFuture<?>>> observed =
                race.observeAssertNotDone(check, Duration.ZERO, background);
        scheduler.advance(Duration.ofMillis(500));

        assertEquals(Set.of(background), observed.get());
        assertFalse(background.isDone(), "observation must not cancel the background task");
        background.cancel(true);
    }

    @Test
    void assertNotDoneFailsWhenBackgroundExitsFirst() {
        CompletableFuture<String> check = after(Duration.ofSeconds(1), "check");
        CompletableFuture<String> background = after(Duration.ofMillis(500), "exited");

        CompletableFuture<Set<CompletableFuture<?>>> observed =
                race.observeAssertNotDone(check, Duration.ZERO, background);
        scheduler.advance(Duration.ofMillis(500));

        assertInstanceOf(ObservedTaskExitedException.class, failureOf(observed));
        assertFalse(check.isDone(), "the failure is reported without waiting for the check");
    }

    @Test
    void assertNotDoneFailsForBackgroundAlreadyFinished() {
        CompletableFuture<String> check = after(Duration.ofSeconds(1), "check");

        CompletableFuture<Set<CompletableFuture<?>>> observed =
                race.observeAssertNotDone(check, Duration.ZERO, CompletableFuture.completedFuture("gone"));

        assertInstanceOf(ObservedTaskExitedException.class, failureOf(observed));
    }

    // ---------------------------------------------------------------------
    // real threads
    // ---------------------------------------------------------------------

    @Test
    void gateOnTheProductionScheduler() throws Exception {
        ScheduledExecutorService executor = ScheduledExecutorScheduler.singleThreaded("race-test");
        try {
            ScheduledExecutorScheduler real = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
            RaceCoordinator realRace = new RaceCoordinator(real, SystemMonotonicClock.INSTANCE);
            AtomicInteger ticks = new AtomicInteger();

            CompletableFuture<String> primary = real.sleep(Duration.ofMillis(200), SystemMonotonicClock.INSTANCE)
                    .thenApply(ignored -> "done");
            CompletableFuture<Void> ticker = PeriodicActivity.every(real, SystemMonotonicClock.INSTANCE,
                    Duration.ofMillis(20), ticks::incrementAndGet);

            GateResult<String> result = realRace.gate(primary, Duration.ofSeconds(5), ticker)
                    .get(5, TimeUnit.SECONDS);

            assertEquals("done", result.result());
            assertTrue(ticker.isCancelled());
            assertTrue(ticks.get() > 0);
        } finally {
            executor.shutdownNow();
        }
    }
}
