package com.questrail.hil.transport.jserialcomm;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSerialCommDeviceTest
 * -----------------------------------------------------------------------------
 * Read results as jSerialComm reports them; no hardware needed.
 */
class JSerialCommDeviceTest {

    @Test
    void countsPassThrough() throws IOException {
        assertEquals(0, JSerialCommDevice.checkRead(0, true, false, "ttyS0"));
        assertEquals(12, JSerialCommDevice.checkRead(12, true, false, "ttyS0"));
    }

    @Test
    void portClosedByCancelReadReadsAsNoData() throws IOException {
        assertEquals(0, JSerialCommDevice.checkRead(-1, false, true, "ttyS0"));
    }

    @Test
    void portThatWentAwayIsAFailure() {
        IOException failure = assertThrows(IOException.class,
                () -> JSerialCommDevice.checkRead(-1, false, false, "ttyUSB0"));
        assertEquals("serial port ttyUSB0 closed unexpectedly", failure.getMessage());
    }

    @Test
    void negativeCountOnAnOpenPortIsAFailure() {
        IOException failure = assertThrows(IOException.class,
                () -> JSerialCommDevice.checkRead(-1, true, true, "ttyS0"));
        assertEquals("read from ttyS0 failed", failure.getMessage());
    }
}
