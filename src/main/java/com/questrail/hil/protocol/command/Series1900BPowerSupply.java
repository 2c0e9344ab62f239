package com.questrail.hil.protocol.command;

import com.questrail.hil.internal.time.MonotonicClock;
import com.questrail.hil.protocol.LineReadLoop;
import com.questrail.hil.transport.LineTransport;
import com.questrail.hil.transport.TimestampedLine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Series1900BPowerSupply
 * =============================================================================
 * Command/response control of a BK Precision 1900B series power supply over
 * its serial link.
 *
 * <h2>Exchange</h2>
 * A command is written followed by the session line terminator (a bare
 * carriage return on this instrument). The supply answers with zero or more
 * informational lines followed by {@code OK}. The exchange completes on the
 * first {@code OK} received strictly after the command was enqueued; an
 * {@code OK} sitting in the buffer from an earlier exchange is stale and
 * ignored. The last non-blank line that was not the acknowledgement is
 * returned as the exchange's diagnostic line.
 *
 * <p>Every exchange is bounded by the command timeout measured from the start
 * of the exchange ({@link Duration#ZERO} waits forever). A timed-out exchange
 * leaves the transport usable.</p>
 *
 * <h2>Raw characters</h2>
 * Strings outside the command table (the reset pulse) are written followed by
 * the terminator like any command, but the supply never acknowledges them, so
 * no reply is awaited.
 */
public final class Series1900BPowerSupply
{
    public static final String COMMAND_TURN_ON = "SOUT0";
    public static final String COMMAND_TURN_OFF = "SOUT1";
    public static final String COMMAND_GET_DISPLAY = "GETD";
    public static final String RESET_PULSE = "\r\r\r\r";

    public static final String RESULT_OK = "OK";

    /** Line terminator the supply expects. */
    public static final String EOL = "\r";

    public static final Duration VOLTAGE_POLL_INTERVAL = Duration.ofMillis(100);

    private static final Map<String, String> COMMAND_HELP = Map.of(
            COMMAND_TURN_ON, "Switch on supply output.",
            COMMAND_TURN_OFF, "Switch off supply output.",
            COMMAND_GET_DISPLAY, "Read parameters displayed on the front panel of the supply.");

    private static final Logger log = LoggerFactory.getLogger(Series1900BPowerSupply.class);

    private final LineTransport transport;
    private final MonotonicClock clock;
    private final Duration commandTimeout;

    public Series1900BPowerSupply(LineTransport transport, Duration commandTimeout)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.commandTimeout = Objects.requireNonNull(commandTimeout, "commandTimeout");
        if (commandTimeout.isNegative()) {
            throw new IllegalArgumentException("commandTimeout must be >= 0");
        }
        this.clock = transport.clock();
    }

    /**
     * Dispatch a single-character token: {@code 1} on, {@code 0} off,
     * {@code r} reset pulse, {@code ?} read display.
     *
     * @throws com.questrail.hil.protocol.UnknownCommandException for any other token
     */
    public CompletableFuture<CommandReply> sendCommand(String token)
    {
        return doCommand(PowerSupplyCommand.fromToken(token).wireText());
    }

    public CompletableFuture<CommandReply> turnOn()
    {
        return doCommand(COMMAND_TURN_ON);
    }

    public CompletableFuture<CommandReply> turnOff()
    {
        return doCommand(COMMAND_TURN_OFF);
    }

    public CompletableFuture<CommandReply> reset()
    {
        return doCommand(RESET_PULSE);
    }

    /**
     * Cancelling the returned future cancels the enqueue or the wait for
     * {@code OK}, whichever is in progress, so a later exchange sees every
     * reply.
     */
    public CompletableFuture<CommandReply> doCommand(String command)
    {
        Objects.requireNonNull(command, "command");

        String help = COMMAND_HELP.get(command);
        if (help == null) {
            log.debug("Sending characters {}", command.replace("\r", "<cr>"));
            CompletableFuture<Long> put = transport.putLine(command, commandTimeout);
            return cancelSourceWith(put, put.thenApply(putNanos -> CommandReply.unacknowledged()));
        }

        log.debug("Sending command {} (help={})", command, help);
        long startNanos = clock.nowNanos();
        CompletableFuture<CommandReply> reply = new CompletableFuture<>();
        AtomicReference<CompletableFuture<CommandReply>> acknowledgement = new AtomicReference<>();

        CompletableFuture<Long> put = transport.putLine(command, commandTimeout);
        put.whenComplete((putNanos, failure) -> {
            if (failure != null) {
                reply.completeExceptionally(unwrap(failure));
                return;
            }
            if (reply.isDone()) {
                return;
            }
            CompletableFuture<CommandReply> waiting = new AcknowledgementLoop(command, putNanos, startNanos).start();
            acknowledgement.set(waiting);
            // Cancelled while starting: the callback below may have missed it.
            if (reply.isDone()) {
                waiting.cancel(false);
                return;
            }
            waiting.whenComplete((value, ackFailure) -> {
                if (ackFailure != null) {
                    reply.completeExceptionally(unwrap(ackFailure));
                } else {
                    reply.complete(value);
                }
            });
        });
        reply.whenComplete((value, failure) -> {
            put.cancel(false);
            CompletableFuture<CommandReply> waiting = acknowledgement.get();
            if (waiting != null) {
                waiting.cancel(false);
            }
        });
        return reply;
    }

    /**
     * Read the front panel.
     *
     * <p>Fails with {@link com.questrail.hil.protocol.ProtocolViolationException}
     * when the diagnostic line is missing, short or not numeric.</p>
     */
    public CompletableFuture<SupplyDisplay> getDisplay()
    {
        CompletableFuture<CommandReply> exchange = doCommand(COMMAND_GET_DISPLAY);
        return cancelSourceWith(exchange, exchange.thenApply(reply -> SupplyDisplay.parse(reply.lastLine())));
    }

    /**
     * Poll the display every {@link #VOLTAGE_POLL_INTERVAL} until the voltage is
     * at least ({@code isMinimum}) or at most {@code thresholdVolts}.
     *
     * <p>Unbounded: callers wanting a deadline apply one to the returned future
     * ({@code orTimeout}, or a race). Completing or cancelling it stops polling
     * and cancels the read or pause in progress. A failed read fails the wait.</p>
     *
     * @return the display that satisfied the threshold
     */
    public CompletableFuture<SupplyDisplay> waitForVoltage(boolean isMinimum, double thresholdVolts)
    {
        CompletableFuture<SupplyDisplay> result = new CompletableFuture<>();
        AtomicReference<CompletableFuture<?>> inFlight = new AtomicReference<>();
        result.whenComplete((display, failure) -> {
            CompletableFuture<?> step = inFlight.getAndSet(null);
            if (step != null) {
                step.cancel(false);
            }
        });
        pollVoltage(result, inFlight, isMinimum, thresholdVolts);
        return result;
    }

    public Duration commandTimeout()
    {
        return commandTimeout;
    }

    public static Map<String, String> commandHelp()
    {
        return COMMAND_HELP;
    }

    private void pollVoltage(CompletableFuture<SupplyDisplay> result,
                             AtomicReference<CompletableFuture<?>> inFlight,
                             boolean isMinimum,
                             double thresholdVolts)
    {
        CompletableFuture<SupplyDisplay> read = getDisplay();
        if (!track(result, inFlight, read)) {
            return;
        }
        read.whenComplete((display, failure) -> {
            if (failure != null) {
                result.completeExceptionally(unwrap(failure));
                return;
            }
            boolean reached = isMinimum
                    ? display.voltage() >= thresholdVolts
                    : display.voltage() <= thresholdVolts;
            if (reached) {
                log.debug(isMinimum
                        ? "---------------POWER SUPPLY UP----------------"
                        : "--------------POWER SUPPLY DOWN---------------");
                result.complete(display);
                return;
            }
            CompletableFuture<Void> pause = transport.scheduler().sleep(VOLTAGE_POLL_INTERVAL, clock);
            if (track(result, inFlight, pause)) {
                pause.thenRun(() -> pollVoltage(result, inFlight, isMinimum, thresholdVolts));
            }
        });
    }

    /**
     * Records {@code step} as the one to cancel with {@code result}.
     *
     * @return false if {@code result} already settled, in which case the step is cancelled
     */
    private static boolean track(CompletableFuture<?> result,
                                 AtomicReference<CompletableFuture<?>> inFlight,
                                 CompletableFuture<?> step)
    {
        inFlight.set(step);
        if (result.isDone()) {
            inFlight.set(null);
            step.cancel(false);
            return false;
        }
        return true;
    }

    /**
     * Cancelling {@code derived} cancels {@code source}; a plain
     * {@code thenApply} stage would not.
     */
    private static <T> CompletableFuture<T> cancelSourceWith(CompletableFuture<?> source, CompletableFuture<T> derived)
    {
        derived.whenComplete((value, failure) -> {
            if (derived.isCancelled()) {
                source.cancel(false);
            }
        });
        return derived;
    }

    private static Throwable unwrap(Throwable failure)
    {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    /**
     * Waits for a fresh {@code OK}, remembering the last diagnostic line.
     */
    private final class AcknowledgementLoop extends LineReadLoop<CommandReply>
    {
        private final String command;
        private final long putNanos;
        private final long startNanos;
        private String lastLine;

        private AcknowledgementLoop(String command, long putNanos, long startNanos)
        {
            super(Series1900BPowerSupply.this.transport);
            this.command = command;
            this.putNanos = putNanos;
            this.startNanos = startNanos;
        }

        @Override
        protected Duration nextTimeout()
        {
            if (commandTimeout.isZero()) {
                return Duration.ZERO;
            }
            long remaining = MonotonicClock.saturatedNanos(commandTimeout) - clock.elapsedNanos(startNanos);
            if (remaining <= 0) {
                return null;
            }
            log.trace("Waiting for response to command {} put at {} s", command, MonotonicClock.toSeconds(putNanos));
            return Duration.ofNanos(remaining);
        }

        @Override
        protected void onLine(TimestampedLine line)
        {
            log.trace("At {} s got line: {}", line.timestampSeconds(), line);
            String text = line.text().strip();
            if (line.isAfter(putNanos) && RESULT_OK.equals(text)) {
                complete(new CommandReply(lastLine, true));
                return;
            }
            if (!text.isEmpty()) {
                lastLine = text;
            }
        }

        @Override
        protected void onBudgetExhausted()
        {
            fail(new TimeoutException("no " + RESULT_OK + " for " + command + " within " + commandTimeout));
        }
    }
}
