package com.questrail.hil.protocol.gtest;

import java.util.Objects;

/**
 * Result of reading one test run.
 *
 * @param outcome        passed, failed or timed out
 * @param reportedTests  test count from the completion marker, {@code -1} on timeout
 * @param linesProcessed lines consumed, the marker line included
 */
public record CompletionReport(TestOutcome outcome, int reportedTests, int linesProcessed)
{
    public CompletionReport {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static CompletionReport timedOut(int linesProcessed)
    {
        return new CompletionReport(TestOutcome.TIMED_OUT, -1, linesProcessed);
    }

    public int resultCode()
    {
        return outcome.resultCode();
    }
}
