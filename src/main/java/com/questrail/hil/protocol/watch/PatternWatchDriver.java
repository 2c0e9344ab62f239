package com.questrail.hil.protocol.watch;

import com.questrail.hil.config.PatternWatchConfig;
import com.questrail.hil.protocol.LineReadLoop;
import com.questrail.hil.race.GateResult;
import com.questrail.hil.race.PeriodicActivity;
import com.questrail.hil.race.RaceCoordinator;
import com.questrail.hil.transport.LineTransport;
import com.questrail.hil.transport.TimestampedLine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PatternWatchDriver
 * =============================================================================
 * Gathers serial output until a line matches a pattern.
 *
 * <p>A watch is a gated race: the matcher is the gate, and two optional
 * background activities run until it opens.</p>
 * <ul>
 *   <li><b>agitator</b> writes the disruption characters every
 *       {@code disturbPeriod}, to coax a quiet device into printing.</li>
 *   <li><b>heartbeat</b> logs "still waiting..." every {@code updatePeriod}.</li>
 * </ul>
 * Both are cancelled once the pattern matches. A non-zero
 * {@code gatherTimeout} fails the watch with
 * {@link java.util.concurrent.TimeoutException} and cancels everything, as
 * does cancelling the future returned by {@link #watch(Pattern)}.
 */
public final class PatternWatchDriver
{
    private static final Logger log = LoggerFactory.getLogger(PatternWatchDriver.class);
    private static final Logger lineLog = LoggerFactory.getLogger(PatternWatchDriver.class.getName() + ".lines");

    private final LineTransport transport;
    private final PatternWatchConfig config;
    private final RaceCoordinator race;
    private volatile Runnable heartbeatListener = () -> { };

    public PatternWatchDriver(LineTransport transport, PatternWatchConfig config)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
        this.race = new RaceCoordinator(transport.scheduler(), transport.clock());
    }

    /**
     * Called on every heartbeat, after the log line.
     */
    public void setHeartbeatListener(Runnable listener)
    {
        this.heartbeatListener = Objects.requireNonNull(listener, "listener");
    }

    public CompletableFuture<PatternMatch> watch()
    {
        return watch(config.pattern());
    }

    public CompletableFuture<PatternMatch> watch(Pattern pattern)
    {
        Objects.requireNonNull(pattern, "pattern");
        log.info("Starting to look for pattern : {}", pattern.pattern());

        CompletableFuture<PatternMatch> matcher = new MatchLoop(pattern).start();

        List<CompletableFuture<?>> background = new ArrayList<>(2);
        if (!config.disturbPeriod().isZero()) {
            background.add(PeriodicActivity.start(transport.scheduler(), transport.clock(),
                    config.disturbPeriod(), this::disturb));
        }
        if (!config.updatePeriod().isZero()) {
            background.add(PeriodicActivity.every(transport.scheduler(), transport.clock(),
                    config.updatePeriod(), this::heartbeat));
        }

        CompletableFuture<GateResult<PatternMatch>> gated =
                race.gate(matcher, config.gatherTimeout(), background.toArray(new CompletableFuture<?>[0]));
        CompletableFuture<PatternMatch> watch = gated.thenApply(GateResult::result);
        watch.whenComplete((match, failure) -> {
            if (match != null) {
                log.info("Found match : {}", match.matchedLine());
            } else if (watch.isCancelled()) {
                // Reaches the matcher and the background activities through the gate.
                gated.cancel(false);
            }
        });
        return watch;
    }

    private CompletableFuture<Long> disturb()
    {
        log.debug("About to disturb the uart...");
        return transport.putLine(config.disruption(), "", Duration.ZERO);
    }

    private void heartbeat()
    {
        log.info("still waiting...");
        heartbeatListener.run();
    }

    private final class MatchLoop extends LineReadLoop<PatternMatch>
    {
        private final Pattern pattern;

        private MatchLoop(Pattern pattern)
        {
            super(PatternWatchDriver.this.transport);
            this.pattern = pattern;
        }

        @Override
        protected Duration nextTimeout()
        {
            return Duration.ZERO;
        }

        @Override
        protected void onLine(TimestampedLine line)
        {
            String stripped = line.text().stripTrailing();
            if (!stripped.isEmpty()) {
                lineLog.debug(stripped);
            }
            Matcher matcher = pattern.matcher(line.text());
            if (matcher.find()) {
                complete(new PatternMatch(matcher.toMatchResult(), line.text()));
            }
        }
    }
}
