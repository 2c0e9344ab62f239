package com.questrail.hil.transport;

import java.time.Duration;

/**
 * Creates (unopened) serial devices.
 */
@FunctionalInterface
public interface SerialDeviceFactory
{
    SerialDevice create(String port, int baudRate, Duration readTimeout);
}
