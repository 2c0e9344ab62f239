package com.questrail.hil.instrument;

import com.questrail.hil.config.CompletionParserConfig;
import com.questrail.hil.config.DriverArguments;
import com.questrail.hil.protocol.gtest.CompletionMarkerParser;
import com.questrail.hil.protocol.gtest.CompletionReport;
import com.questrail.hil.runtime.HilRuntime;
import com.questrail.hil.transport.ConcurrentLineTransport;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Reads a googletest run from a serial log. The result code is the
 * {@link com.questrail.hil.protocol.gtest.TestOutcome}'s: 0 passed, 1 failed,
 * 2 timed out.
 */
public final class TestLogInstrument extends AbstractInstrument
{
    public static final String NAME = "gtest";
    public static final String OUTPUT_OUTCOME = "outcome";
    public static final String OUTPUT_REPORTED_TESTS = "reported_tests";
    public static final String OUTPUT_LINES_PROCESSED = "lines_processed";

    public TestLogInstrument(HilRuntime runtime)
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
        CompletionMarkerParser parser = new CompletionMarkerParser(CompletionParserConfig.fromArguments(arguments));

        try (ConcurrentLineTransport transport = runtime.openTransport(CompletionParserConfig.transportFromArguments(arguments))) {
            CompletionReport report = await(parser.readTest(transport));
            Map<String, Object> outputs = new LinkedHashMap<>();
            outputs.put(OUTPUT_OUTCOME, report.outcome());
            outputs.put(OUTPUT_REPORTED_TESTS, report.reportedTests());
            outputs.put(OUTPUT_LINES_PROCESSED, report.linesProcessed());
            return new DriverResult(report.resultCode(), outputs);
        }
    }
}
