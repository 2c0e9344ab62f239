package com.questrail.hil.config;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Pattern watch settings.
 *
 * <p>Zero durations switch a feature off: no agitation, no heartbeat, no
 * overall deadline.</p>
 *
 * @param pattern       searched for anywhere in each received line
 * @param disruption    raw characters written to wake the far end
 * @param disturbPeriod how often the disruption is written
 * @param updatePeriod  how often the "still waiting" heartbeat fires
 * @param gatherTimeout overall deadline for a match
 */
public record PatternWatchConfig(
        Pattern pattern,
        String disruption,
        Duration disturbPeriod,
        Duration updatePeriod,
        Duration gatherTimeout
) {
    public static final String ARGUMENT_PREFIX = "lw";
    public static final String DEFAULT_PATTERN = ".*";
    public static final String DEFAULT_DISRUPTION = "\r\n";

    public PatternWatchConfig {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(disruption, "disruption");
        Objects.requireNonNull(disturbPeriod, "disturbPeriod");
        Objects.requireNonNull(updatePeriod, "updatePeriod");
        Objects.requireNonNull(gatherTimeout, "gatherTimeout");

        if (disturbPeriod.isNegative()) {
            throw new IllegalArgumentException("disturbPeriod must be non-negative");
        }
        if (updatePeriod.isNegative()) {
            throw new IllegalArgumentException("updatePeriod must be non-negative");
        }
        if (gatherTimeout.isNegative()) {
            throw new IllegalArgumentException("gatherTimeout must be non-negative");
        }
    }

    public static PatternWatchConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code lw-pattern}, {@code lw-disruption}, {@code lw-disturb-rate},
     * {@code lw-update-period} and {@code lw-gather-timeout}.
     *
     * @throws IllegalArgumentException if the pattern does not compile
     */
    public static PatternWatchConfig fromArguments(DriverArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        String regex = arguments.getString("lw-pattern").orElse(DEFAULT_PATTERN);
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("--lw-pattern is not a valid regular expression: " + regex, e);
        }
        return builder()
                .withPattern(pattern)
                .withDisruption(arguments.getRaw("lw-disruption").orElse(DEFAULT_DISRUPTION))
                .withDisturbPeriod(arguments.getSeconds("lw-disturb-rate").orElse(Duration.ZERO))
                .withUpdatePeriod(arguments.getSeconds("lw-update-period").orElse(Duration.ZERO))
                .withGatherTimeout(arguments.getSeconds("lw-gather-timeout").orElse(Duration.ZERO))
                .build();
    }

    /**
     * {@code lw-port} and {@code lw-port-speed}, both required.
     */
    public static TransportConfig transportFromArguments(DriverArguments arguments) {
        return TransportConfig.fromArguments(arguments, ARGUMENT_PREFIX, arguments.requireInt("lw-port-speed"))
                .build();
    }

    public static final class Builder {
        private Pattern pattern = Pattern.compile(DEFAULT_PATTERN);
        private String disruption = DEFAULT_DISRUPTION;
        private Duration disturbPeriod = Duration.ZERO;
        private Duration updatePeriod = Duration.ZERO;
        private Duration gatherTimeout = Duration.ZERO;

        public Builder withPattern(Pattern pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder withDisruption(String disruption) {
            this.disruption = disruption;
            return this;
        }

        public Builder withDisturbPeriod(Duration disturbPeriod) {
            this.disturbPeriod = disturbPeriod;
            return this;
        }

        public Builder withUpdatePeriod(Duration updatePeriod) {
            this.updatePeriod = updatePeriod;
            return this;
        }

        public Builder withGatherTimeout(Duration gatherTimeout) {
            this.gatherTimeout = gatherTimeout;
            return this;
        }

        public PatternWatchConfig build() {
            return new PatternWatchConfig(pattern, disruption, disturbPeriod, updatePeriod, gatherTimeout);
        }
    }
}
