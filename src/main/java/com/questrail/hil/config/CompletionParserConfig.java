package com.questrail.hil.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Test-log parser settings.
 *
 * @param timeout overall budget for the completion marker; {@link Duration#ZERO}
 *                waits forever
 */
public record CompletionParserConfig(Duration timeout) {

    public static final String ARGUMENT_PREFIX = "gtest";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public CompletionParserConfig {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
    }

    public static CompletionParserConfig defaults() {
        return new CompletionParserConfig(DEFAULT_TIMEOUT);
    }

    /**
     * Reads {@code gtest-timeout}.
     */
    public static CompletionParserConfig fromArguments(DriverArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        return new CompletionParserConfig(arguments.getSeconds("gtest-timeout").orElse(DEFAULT_TIMEOUT));
    }

    /**
     * {@code gtest-port} and {@code gtest-port-speed}, both required.
     */
    public static TransportConfig transportFromArguments(DriverArguments arguments) {
        return TransportConfig.fromArguments(arguments, ARGUMENT_PREFIX, arguments.requireInt("gtest-port-speed"))
                .build();
    }
}
