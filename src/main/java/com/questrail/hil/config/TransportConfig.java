package com.questrail.hil.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for one serial session.
 *
 * <ul>
 *   <li><b>readTimeout</b> - how long a device read may block. Also bounds how
 *       long closing waits for each worker. {@link Duration#ZERO} blocks until
 *       data or cancellation.</li>
 *   <li><b>eol</b> - line terminator, both directions.</li>
 *   <li><b>echo</b> - log outbound traffic.</li>
 *   <li><b>inboundCapacity</b> - received lines held before new ones are
 *       dropped and counted.</li>
 *   <li><b>outboundCapacity</b> - queued writes before {@code putLine} waits.</li>
 * </ul>
 */
public record TransportConfig(
        String port,
        int baudRate,
        Duration readTimeout,
        String eol,
        boolean echo,
        int inboundCapacity,
        int outboundCapacity
) {
    public static final int DEFAULT_BAUD_RATE = 115200;
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(1);
    public static final String DEFAULT_EOL = "\r\n";
    public static final int DEFAULT_INBOUND_CAPACITY = 4096;
    public static final int DEFAULT_OUTBOUND_CAPACITY = 256;

    public TransportConfig {
        Objects.requireNonNull(port, "port");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(eol, "eol");

        if (port.isBlank()) {
            throw new IllegalArgumentException("port must not be blank");
        }
        if (baudRate <= 0) {
            throw new IllegalArgumentException("baudRate must be > 0");
        }
        if (readTimeout.isNegative()) {
            throw new IllegalArgumentException("readTimeout must be non-negative");
        }
        if (eol.isEmpty()) {
            throw new IllegalArgumentException("eol must not be empty");
        }
        if (inboundCapacity <= 0) {
            throw new IllegalArgumentException("inboundCapacity must be > 0");
        }
        if (outboundCapacity <= 0) {
            throw new IllegalArgumentException("outboundCapacity must be > 0");
        }
    }

    public static Builder builder(String port) {
        return new Builder(port);
    }

    /**
     * Reads {@code <prefix>-port} (required) and {@code <prefix>-port-speed}.
     */
    public static Builder fromArguments(DriverArguments arguments, String prefix, int defaultBaudRate) {
        Objects.requireNonNull(arguments, "arguments");
        Objects.requireNonNull(prefix, "prefix");
        return builder(arguments.requireString(prefix + "-port"))
                .withBaudRate(arguments.getInt(prefix + "-port-speed").orElse(defaultBaudRate));
    }

    public Builder toBuilder() {
        return builder(port)
                .withBaudRate(baudRate)
                .withReadTimeout(readTimeout)
                .withEol(eol)
                .withEcho(echo)
                .withInboundCapacity(inboundCapacity)
                .withOutboundCapacity(outboundCapacity);
    }

    public static final class Builder {
        private final String port;
        private int baudRate = DEFAULT_BAUD_RATE;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;
        private String eol = DEFAULT_EOL;
        private boolean echo = false;
        private int inboundCapacity = DEFAULT_INBOUND_CAPACITY;
        private int outboundCapacity = DEFAULT_OUTBOUND_CAPACITY;

        private Builder(String port) {
            this.port = port;
        }

        public Builder withBaudRate(int baudRate) {
            this.baudRate = baudRate;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withEol(String eol) {
            this.eol = eol;
            return this;
        }

        public Builder withEcho(boolean echo) {
            this.echo = echo;
            return this;
        }

        public Builder withInboundCapacity(int inboundCapacity) {
            this.inboundCapacity = inboundCapacity;
            return this;
        }

        public Builder withOutboundCapacity(int outboundCapacity) {
            this.outboundCapacity = outboundCapacity;
            return this;
        }

        public TransportConfig build() {
            return new TransportConfig(port, baudRate, readTimeout, eol, echo, inboundCapacity, outboundCapacity);
        }
    }
}
