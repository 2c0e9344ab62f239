package com.questrail.hil.protocol.gtest;

/**
 * How a test run ended, with the result code reported to the orchestration
 * layer.
 */
public enum TestOutcome
{
    PASSED(0),
    FAILED(1),
    TIMED_OUT(2);

    private final int resultCode;

    TestOutcome(int resultCode)
    {
        this.resultCode = resultCode;
    }

    public int resultCode()
    {
        return resultCode;
    }
}
