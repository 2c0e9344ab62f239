package com.questrail.hil.instrument;

import com.questrail.hil.config.DriverArguments;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Entry point an orchestration layer invokes for one instrument.
 *
 * <p>Implementations acquire their serial link for the duration of the call
 * and release it on every exit path. Calls block the invoking thread, which
 * must not be the runtime's scheduler thread.</p>
 */
public interface InstrumentDriver
{
    /**
     * Stable name, also the prefix family of the instrument's arguments.
     */
    String name();

    /**
     * @throws IOException       if the serial port cannot be opened
     * @throws TimeoutException  if the instrument did not answer in time
     * @throws IllegalArgumentException for missing or malformed arguments
     */
    DriverResult gather(DriverArguments arguments) throws IOException, InterruptedException, TimeoutException;
}
