package com.questrail.hil.protocol.gtest;

import com.questrail.hil.config.CompletionParserConfig;
import com.questrail.hil.internal.time.MonotonicClock;
import com.questrail.hil.protocol.LineReadLoop;
import com.questrail.hil.transport.LineTransport;
import com.questrail.hil.transport.TimestampedLine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CompletionMarkerParser
 * =============================================================================
 * Watches a serial log for the summary line a googletest run prints last:
 *
 * <pre>
 *   [  PASSED  ] 12 tests.
 *   [  FAILED  ] 1 test.
 * </pre>
 *
 * <p>The marker must start the line. Running out of time is reported as
 * {@link TestOutcome#TIMED_OUT}, never as an exception; a stopped transport
 * still fails the returned future.</p>
 */
public final class CompletionMarkerParser
{
    public static final Pattern COMPLETION_PATTERN = Pattern.compile("\\[\\s*(PASSED|FAILED)\\s*\\]\\s*(\\d+)\\s+tests?\\.");

    private static final Logger log = LoggerFactory.getLogger(CompletionMarkerParser.class);
    private static final Logger lineLog = LoggerFactory.getLogger(CompletionMarkerParser.class.getName() + ".lines");

    private final Duration timeout;

    public CompletionMarkerParser(Duration timeout)
    {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
    }

    public CompletionMarkerParser(CompletionParserConfig config)
    {
        this(Objects.requireNonNull(config, "config").timeout());
    }

    public CompletableFuture<CompletionReport> readTest(LineTransport transport)
    {
        Objects.requireNonNull(transport, "transport");
        MonotonicClock clock = transport.clock();
        long startNanos = clock.nowNanos();

        // Returned as is so that cancelling it stops the read in flight.
        CompletableFuture<CompletionReport> parse = new ReportLoop(transport, clock, startNanos).start();
        parse.whenComplete((report, failure) -> {
            if (report == null) {
                return;
            }
            double elapsed = MonotonicClock.toSeconds(clock.elapsedNanos(startNanos));
            if (report.outcome() == TestOutcome.PASSED) {
                log.info("Detected successful test after {} seconds.", elapsed);
            } else if (report.outcome() == TestOutcome.TIMED_OUT) {
                log.warn("Test log parser timeout after {} seconds", elapsed);
            }
            log.debug("Processed {} lines. There were {} buffer full events reported.",
                    report.linesProcessed(), transport.rxBufferOverflows());
        });
        return parse;
    }

    public Duration timeout()
    {
        return timeout;
    }

    private final class ReportLoop extends LineReadLoop<CompletionReport>
    {
        private final MonotonicClock clock;
        private final long startNanos;
        private int lineCount;

        private ReportLoop(LineTransport transport, MonotonicClock clock, long startNanos)
        {
            super(transport);
            this.clock = clock;
            this.startNanos = startNanos;
        }

        @Override
        protected Duration nextTimeout()
        {
            if (timeout.isZero()) {
                return Duration.ZERO;
            }
            long remaining = MonotonicClock.saturatedNanos(timeout) - clock.elapsedNanos(startNanos);
            return remaining > 0 ? Duration.ofNanos(remaining) : null;
        }

        @Override
        protected void onLine(TimestampedLine line)
        {
            lineLog.debug(line.text());
            lineCount++;
            Matcher marker = COMPLETION_PATTERN.matcher(line.text());
            if (marker.lookingAt()) {
                TestOutcome outcome = "PASSED".equals(marker.group(1)) ? TestOutcome.PASSED : TestOutcome.FAILED;
                complete(new CompletionReport(outcome, Integer.parseInt(marker.group(2)), lineCount));
            }
        }

        @Override
        protected void onBudgetExhausted()
        {
            complete(CompletionReport.timedOut(lineCount));
        }

        @Override
        protected void onReadFailure(Throwable cause)
        {
            if (cause instanceof TimeoutException) {
                complete(CompletionReport.timedOut(lineCount));
            } else {
                fail(cause);
            }
        }
    }
}
