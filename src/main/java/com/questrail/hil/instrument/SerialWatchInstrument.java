package com.questrail.hil.instrument;

import com.questrail.hil.config.DriverArguments;
import com.questrail.hil.config.PatternWatchConfig;
import com.questrail.hil.protocol.watch.PatternMatch;
import com.questrail.hil.protocol.watch.PatternWatchDriver;
import com.questrail.hil.runtime.HilRuntime;
import com.questrail.hil.transport.ConcurrentLineTransport;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Gathers a serial log until {@code lw-pattern} matches.
 *
 * <p>Outputs {@code match} (a {@link java.util.regex.MatchResult}) and
 * {@code matched_line}.</p>
 */
public final class SerialWatchInstrument extends AbstractInstrument
{
    public static final String NAME = "nanaimo_serial_watch";
    public static final String OUTPUT_MATCH = "match";
    public static final String OUTPUT_MATCHED_LINE = "matched_line";

    public SerialWatchInstrument(HilRuntime runtime)
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
        PatternWatchConfig config = PatternWatchConfig.fromArguments(arguments);

        try (ConcurrentLineTransport transport = runtime.openTransport(PatternWatchConfig.transportFromArguments(arguments))) {
            PatternMatch match = await(new PatternWatchDriver(transport, config).watch());
            Map<String, Object> outputs = new LinkedHashMap<>();
            outputs.put(OUTPUT_MATCH, match.match());
            outputs.put(OUTPUT_MATCHED_LINE, match.matchedLine());
            return DriverResult.success(outputs);
        }
    }
}
