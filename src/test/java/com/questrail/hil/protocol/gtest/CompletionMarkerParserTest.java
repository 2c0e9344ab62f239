package com.questrail.hil.protocol.gtest;

import com.questrail.hil.config.CompletionParserConfig;
import com.questrail.hil.internal.time.ScheduledExecutorScheduler;
import com.questrail.hil.internal.time.SystemMonotonicClock;
import com.questrail.hil.transport.ConcurrentLineTransport;
import com.questrail.hil.transport.SimulatedSerialDevice;
import com.questrail.hil.transport.TransportStoppedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CompletionMarkerParserTest
 * -----------------------------------------------------------------------------
 * Feeds captured test logs through a simulated port.
 */
class CompletionMarkerParserTest {

    private ScheduledExecutorService executor;
    private SimulatedSerialDevice device;
    private ConcurrentLineTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        executor = ScheduledExecutorScheduler.singleThreaded("gtest-test");
        device = new SimulatedSerialDevice("ttyTEST", Duration.ofMillis(20), "\r\n");
        transport = new ConcurrentLineTransport(device, SystemMonotonicClock.INSTANCE,
                new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE), "\r\n").open();
    }

    @AfterEach
    void tearDown() {
        transport.close();
        executor.shutdownNow();
    }

    private CompletionReport read(Duration timeout) throws Exception {
        return new CompletionMarkerParser(timeout).readTest(transport).get(5, TimeUnit.SECONDS);
    }

    @Test
    void passedRun() throws Exception {
        device.feedLines(
                "[==========] Running 3 tests from 1 test suite.",
                "[ RUN      ] Uart.Loopback",
                "[       OK ] Uart.Loopback (2 ms)",
                "[==========] 3 tests from 1 test suite ran. (7 ms total)",
                "[  PASSED  ] 3 tests.");

        CompletionReport report = read(Duration.ofSeconds(2));

        assertEquals(TestOutcome.PASSED, report.outcome());
        assertEquals(3, report.reportedTests());
        assertEquals(5, report.linesProcessed());
        assertEquals(0, report.resultCode());
    }

    @Test
    void cancelledReadLeavesLaterLinesForTheNextReader() throws Exception {
        CompletableFuture<CompletionReport> reading = new CompletionMarkerParser(Duration.ofSeconds(2)).readTest(transport);
        assertTrue(reading.cancel(true));

        device.feedLines("[  PASSED  ] 1 test.");

        assertEquals("[  PASSED  ] 1 test.",
                transport.getLine(Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS).text());
    }

    @Test
    void failedRunWithSingularTest() throws Exception {
        device.feedLines(
                "[ RUN      ] Gpio.Toggle",
                "[  FAILED  ] Gpio.Toggle (1 ms)",
                "[  FAILED  ] 1 test.");

        CompletionReport report = read(Duration.ofSeconds(2));

        assertEquals(TestOutcome.FAILED, report.outcome());
        assertEquals(1, report.reportedTests());
        assertEquals(3, report.linesProcessed());
        assertEquals(1, report.resultCode());
    }

    @Test
    void markerMustStartTheLine() throws Exception {
        device.feedLines(
                "echo [  PASSED  ] 4 tests.",
                "[PASSED] 4 tests.");

        CompletionReport report = read(Duration.ofSeconds(2));

        assertEquals(TestOutcome.PASSED, report.outcome());
        assertEquals(2, report.linesProcessed());
    }

    @Test
    void timeoutIsAnOutcomeNotAFailure() throws Exception {
        device.feedLines("[==========] Running 1 test from 1 test suite.", "[ RUN      ] Hangs.Forever");

        CompletionReport report = read(Duration.ofMillis(200));

        assertEquals(TestOutcome.TIMED_OUT, report.outcome());
        assertEquals(-1, report.reportedTests());
        assertEquals(2, report.linesProcessed());
        assertEquals(2, report.resultCode());
    }

    @Test
    void linesAfterTheMarkerAreLeftBuffered() throws Exception {
        device.feedLines("[  PASSED  ] 2 tests.", "# shell prompt");

        assertEquals(TestOutcome.PASSED, read(Duration.ofSeconds(2)).outcome());
        assertEquals("# shell prompt", transport.getLine(Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS).text());
    }

    @Test
    void zeroTimeoutWaitsUntilTheMarkerArrives() throws Exception {
        CompletableFuture<CompletionReport> pending = new CompletionMarkerParser(Duration.ZERO).readTest(transport);
        Thread.sleep(100);
        assertFalse(pending.isDone());

        device.feedLines("[  PASSED  ] 7 tests.");
        assertEquals(7, pending.get(5, TimeUnit.SECONDS).reportedTests());
    }

    @Test
    void stoppedTransportFailsTheRead() {
        transport.close();

        CompletableFuture<CompletionReport> pending = new CompletionMarkerParser(Duration.ofSeconds(1)).readTest(transport);

        ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TransportStoppedException.class, e.getCause());
    }

    @Test
    void configSuppliesTheTimeout() {
        assertEquals(Duration.ofSeconds(60), new CompletionMarkerParser(CompletionParserConfig.defaults()).timeout());
        assertThrows(IllegalArgumentException.class, () -> new CompletionMarkerParser(Duration.ofSeconds(-1)));
    }
}
