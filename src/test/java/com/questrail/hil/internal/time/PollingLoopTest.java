package com.questrail.hil.internal.time;

import com.questrail.hil.time.DeterministicScheduler;
import com.questrail.hil.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PollingLoopTest {

    private static final Duration INTERVAL = Duration.ofMillis(1);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
    }

    @Test
    void firstAttemptRunsOnTheCallingThread() {
        CompletableFuture<String> result = PollingLoop.start(scheduler, clock, INTERVAL,
                r -> r.complete("now"));

        assertEquals("now", result.getNow(null));
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void retriesEveryIntervalUntilSettled() {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<Integer> result = PollingLoop.start(scheduler, clock, INTERVAL, r -> {
            if (attempts.incrementAndGet() == 3) {
                r.complete(3);
            }
        });

        assertFalse(result.isDone());
        assertEquals(1, attempts.get());

        scheduler.runDueTasks();
        assertEquals(1, attempts.get(), "nothing runs before the interval elapses");

        scheduler.advance(Duration.ofMillis(2));

        assertEquals(3, result.getNow(null));
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void attemptFailureFailsTheResult() {
        CompletableFuture<Object> result = PollingLoop.start(scheduler, clock, INTERVAL, r -> {
            throw new IllegalStateException("boom");
        });

        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void cancellingDisarmsTheNextAttempt() {
        AtomicInteger attempts = new AtomicInteger();
        CompletableFuture<Object> result = PollingLoop.start(scheduler, clock, INTERVAL,
                r -> attempts.incrementAndGet());

        result.cancel(true);
        scheduler.advance(Duration.ofMillis(10));

        assertEquals(1, attempts.get());
        assertEquals(0, scheduler.pendingTasks());
    }
}
