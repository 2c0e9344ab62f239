package com.questrail.hil.config;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Power supply instrument settings.
 *
 * @param command        single-character token, see
 *                       {@link com.questrail.hil.protocol.command.PowerSupplyCommand}
 * @param commandTimeout per-exchange budget; {@link Duration#ZERO} waits forever
 * @param targetVoltage  when present, switching on or off also waits for the
 *                       output to settle
 */
public record PowerSupplyConfig(
        String command,
        Duration commandTimeout,
        OptionalDouble targetVoltage
) {
    public static final String ARGUMENT_PREFIX = "bk";
    public static final int DEFAULT_BAUD_RATE = 9600;
    public static final String DEFAULT_COMMAND = "?";
    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(4);

    /** Switching on waits for {@code target - RISING_MARGIN_VOLTS}. */
    public static final double RISING_MARGIN_VOLTS = 0.2;

    /** Switching off waits for the output to fall to this. */
    public static final double OFF_THRESHOLD_VOLTS = 1.0;

    public PowerSupplyConfig {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(commandTimeout, "commandTimeout");
        Objects.requireNonNull(targetVoltage, "targetVoltage");
        if (commandTimeout.isNegative()) {
            throw new IllegalArgumentException("commandTimeout must be non-negative");
        }
    }

    public static PowerSupplyConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code bk-command}, {@code bk-command-timeout} and
     * {@code bk-target-voltage}.
     */
    public static PowerSupplyConfig fromArguments(DriverArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Builder builder = builder()
                .withCommand(arguments.getString("bk-command").orElse(DEFAULT_COMMAND))
                .withCommandTimeout(arguments.getSeconds("bk-command-timeout").orElse(DEFAULT_COMMAND_TIMEOUT));
        arguments.getDouble("bk-target-voltage").ifPresent(builder::withTargetVoltage);
        return builder.build();
    }

    /**
     * Serial settings for the supply: {@code bk-port}, 9600 baud unless
     * {@code bk-port-speed} says otherwise, carriage-return terminated lines.
     */
    public static TransportConfig transportFromArguments(DriverArguments arguments) {
        return TransportConfig.fromArguments(arguments, ARGUMENT_PREFIX, DEFAULT_BAUD_RATE)
                .withEol("\r")
                .build();
    }

    public static final class Builder {
        private String command = DEFAULT_COMMAND;
        private Duration commandTimeout = DEFAULT_COMMAND_TIMEOUT;
        private OptionalDouble targetVoltage = OptionalDouble.empty();

        public Builder withCommand(String command) {
            this.command = command;
            return this;
        }

        public Builder withCommandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
            return this;
        }

        public Builder withTargetVoltage(double targetVoltage) {
            this.targetVoltage = OptionalDouble.of(targetVoltage);
            return this;
        }

        public PowerSupplyConfig build() {
            return new PowerSupplyConfig(command, commandTimeout, targetVoltage);
        }
    }
}
