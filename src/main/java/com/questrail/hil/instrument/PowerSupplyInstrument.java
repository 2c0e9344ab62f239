package com.questrail.hil.instrument;

import com.questrail.hil.config.DriverArguments;
import com.questrail.hil.config.PowerSupplyConfig;
import com.questrail.hil.protocol.command.CommandReply;
import com.questrail.hil.protocol.command.PowerSupplyCommand;
import com.questrail.hil.protocol.command.Series1900BPowerSupply;
import com.questrail.hil.protocol.command.SupplyDisplay;
import com.questrail.hil.race.GateResult;
import com.questrail.hil.runtime.HilRuntime;
import com.questrail.hil.transport.ConcurrentLineTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * PowerSupplyInstrument
 * =============================================================================
 * Sends one command to a 1900B series supply.
 *
 * <table>
 *   <caption>Commands ({@code bk-command})</caption>
 *   <tr><th>Token</th><th>Action</th><th>Outputs</th></tr>
 *   <tr><td>{@code 1}</td><td>Output on; with {@code bk-target-voltage}, wait for
 *       the target less 0.2 V</td><td>none</td></tr>
 *   <tr><td>{@code 0}</td><td>Output off; with {@code bk-target-voltage}, wait for
 *       the output to fall to 1 V</td><td>none</td></tr>
 *   <tr><td>{@code r}</td><td>Send a burst of carriage returns. The supply never
 *       acknowledges it, so the result code is 1</td><td>none</td></tr>
 *   <tr><td>{@code ?}</td><td>Read the front panel</td>
 *       <td>{@code display} ({@link SupplyDisplay}), {@code display_text}</td></tr>
 * </table>
 */
public final class PowerSupplyInstrument extends AbstractInstrument
{
    public static final String NAME = "bkprecision";
    public static final String OUTPUT_DISPLAY = "display";
    public static final String OUTPUT_DISPLAY_TEXT = "display_text";

    private static final Logger log = LoggerFactory.getLogger(PowerSupplyInstrument.class);

    public PowerSupplyInstrument(HilRuntime runtime)
    {
        super(runtime);
    }

    @Override
    public String name()
    {
        return NAME;
    }

    @Override
    public DriverResult gather(DriverArguments arguments)
            throws IOException, InterruptedException, TimeoutException
    {
        PowerSupplyConfig config = PowerSupplyConfig.fromArguments(arguments);
        // Validate before touching the port.
        PowerSupplyCommand command = PowerSupplyCommand.fromToken(config.command());

        try (ConcurrentLineTransport transport = runtime.openTransport(PowerSupplyConfig.transportFromArguments(arguments))) {
            Series1900BPowerSupply supply = new Series1900BPowerSupply(transport, config.commandTimeout());
            switch (command) {
                case TURN_ON:
                    await(supply.turnOn());
                    if (config.targetVoltage().isPresent()) {
                        double threshold = config.targetVoltage().getAsDouble() - PowerSupplyConfig.RISING_MARGIN_VOLTS;
                        awaitVoltage(supply, true, threshold, config.commandTimeout());
                    }
                    return DriverResult.success();
                case TURN_OFF:
                    await(supply.turnOff());
                    if (config.targetVoltage().isPresent()) {
                        awaitVoltage(supply, false, PowerSupplyConfig.OFF_THRESHOLD_VOLTS, config.commandTimeout());
                    }
                    return DriverResult.success();
                case RESET:
                    CommandReply pulse = await(supply.reset());
                    return new DriverResult(pulse.acknowledged() ? 0 : 1, Map.of());
                case READ_DISPLAY:
                    SupplyDisplay display = await(supply.getDisplay());
                    Map<String, Object> outputs = new LinkedHashMap<>();
                    outputs.put(OUTPUT_DISPLAY, display);
                    outputs.put(OUTPUT_DISPLAY_TEXT, display.displayText());
                    return DriverResult.success(outputs);
                default:
                    throw new IllegalStateException("unhandled command " + command);
            }
        }
    }

    private void awaitVoltage(Series1900BPowerSupply supply, boolean isMinimum, double threshold, Duration timeout)
            throws IOException, InterruptedException, TimeoutException
    {
        log.debug("Waiting for output {} {} V", isMinimum ? ">=" : "<=", threshold);
        CompletableFuture<SupplyDisplay> reached = supply.waitForVoltage(isMinimum, threshold);
        GateResult<SupplyDisplay> settled = await(runtime.raceCoordinator().gate(reached, timeout));
        log.debug("Output settled at {} V", settled.result().voltage());
    }
}
