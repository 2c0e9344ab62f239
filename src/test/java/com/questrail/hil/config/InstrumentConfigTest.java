package com.questrail.hil.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InstrumentConfigTest
 * -----------------------------------------------------------------------------
 * Argument parsing and validation for each instrument's settings.
 */
class InstrumentConfigTest
{
    @Test
    void powerSupplyDefaults() {
        PowerSupplyConfig config = PowerSupplyConfig.fromArguments(DriverArguments.empty());

        assertEquals("?", config.command());
        assertEquals(Duration.ofSeconds(4), config.commandTimeout());
        assertEquals(OptionalDouble.empty(), config.targetVoltage());
    }

    @Test
    void powerSupplyFromArguments() {
        DriverArguments args = DriverArguments.of(Map.of(
                "bk-port", "/dev/ttyUSB3",
                "bk-command", "1",
                "bk-command-timeout", "0.5",
                "bk-target-voltage", "12"));

        PowerSupplyConfig config = PowerSupplyConfig.fromArguments(args);
        TransportConfig transport = PowerSupplyConfig.transportFromArguments(args);

        assertEquals("1", config.command());
        assertEquals(Duration.ofMillis(500), config.commandTimeout());
        assertEquals(12.0, config.targetVoltage().getAsDouble());
        assertEquals("/dev/ttyUSB3", transport.port());
        assertEquals(9600, transport.baudRate());
        assertEquals("\r", transport.eol());
    }

    @Test
    void powerSupplyPortSpeedOverridesDefault() {
        DriverArguments args = DriverArguments.of(Map.of("bk-port", "COM4", "bk-port-speed", "19200"));

        assertEquals(19200, PowerSupplyConfig.transportFromArguments(args).baudRate());
    }

    @Test
    void patternWatchFromArguments() {
        DriverArguments args = DriverArguments.of(Map.of(
                "lw-port", "/dev/ttyACM0",
                "lw-port-speed", "115200",
                "lw-pattern", "login:\\s*$",
                "lw-disruption", " ",
                "lw-disturb-rate", "2",
                "lw-update-period", "10",
                "lw-gather-timeout", "120"));

        PatternWatchConfig config = PatternWatchConfig.fromArguments(args);
        TransportConfig transport = PatternWatchConfig.transportFromArguments(args);

        assertEquals("login:\\s*$", config.pattern().pattern());
        assertEquals(" ", config.disruption());
        assertEquals(Duration.ofSeconds(2), config.disturbPeriod());
        assertEquals(Duration.ofSeconds(10), config.updatePeriod());
        assertEquals(Duration.ofSeconds(120), config.gatherTimeout());
        assertEquals(115200, transport.baudRate());
        assertEquals("\r\n", transport.eol());
    }

    @Test
    void patternWatchDefaultsSwitchFeaturesOff() {
        PatternWatchConfig config = PatternWatchConfig.fromArguments(DriverArguments.empty());

        assertEquals(".*", config.pattern().pattern());
        assertEquals("\r\n", config.disruption());
        assertTrue(config.disturbPeriod().isZero());
        assertTrue(config.updatePeriod().isZero());
        assertTrue(config.gatherTimeout().isZero());
    }

    @Test
    void patternWatchRejectsBadRegexAndMissingSpeed() {
        assertThrows(IllegalArgumentException.class,
                () -> PatternWatchConfig.fromArguments(DriverArguments.empty().with("lw-pattern", "(unclosed")));
        assertThrows(IllegalArgumentException.class,
                () -> PatternWatchConfig.transportFromArguments(DriverArguments.empty().with("lw-port", "tty")));
    }

    @Test
    void completionParserFromArguments() {
        assertEquals(Duration.ofSeconds(60), CompletionParserConfig.fromArguments(DriverArguments.empty()).timeout());
        assertEquals(Duration.ofMillis(2500),
                CompletionParserConfig.fromArguments(DriverArguments.empty().with("gtest-timeout", "2.5")).timeout());
        assertThrows(IllegalArgumentException.class,
                () -> CompletionParserConfig.transportFromArguments(DriverArguments.empty().with("gtest-port", "tty")));
    }

    @Test
    void transportConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> TransportConfig.builder(" ").build());
        assertThrows(IllegalArgumentException.class, () -> TransportConfig.builder("tty").withBaudRate(0).build());
        assertThrows(IllegalArgumentException.class, () -> TransportConfig.builder("tty").withEol("").build());
        assertThrows(IllegalArgumentException.class,
                () -> TransportConfig.builder("tty").withReadTimeout(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class, () -> TransportConfig.builder("tty").withInboundCapacity(0).build());
    }

    @Test
    void transportConfigRoundTripsThroughBuilder() {
        TransportConfig config = TransportConfig.builder("tty").withEcho(true).withOutboundCapacity(8).build();

        assertEquals(config, config.toBuilder().build());
        assertEquals(TransportConfig.DEFAULT_BAUD_RATE, config.baudRate());
    }
}
