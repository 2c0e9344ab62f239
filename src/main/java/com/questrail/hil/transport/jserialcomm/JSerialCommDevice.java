package com.questrail.hil.transport.jserialcomm;

import com.fazecast.jSerialComm.SerialPort;
import com.questrail.hil.transport.SerialDevice;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * JSerialCommDevice
 * =============================================================================
 * jSerialComm-backed implementation of the {@link SerialDevice} port.
 *
 * <h2>Containment rule</h2>
 * jSerialComm types MUST NOT escape this package. Callers see bytes, a port
 * name and a read timeout only.
 *
 * <h2>Read behaviour</h2>
 * The port is configured semi-blocking: a read returns as soon as at least one
 * byte is available, or after the read timeout with zero bytes. With a zero
 * read timeout a read blocks until data arrives, so {@link #cancelRead()}
 * closes the port to release the reader.
 */
public final class JSerialCommDevice implements SerialDevice
{
    private final SerialPort port;
    private final String name;
    private final int baudRate;
    private final Duration readTimeout;
    private volatile boolean readCancelled;

    public JSerialCommDevice(String portName, int baudRate, Duration readTimeout)
    {
        this.name = Objects.requireNonNull(portName, "portName");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
        if (baudRate <= 0) {
            throw new IllegalArgumentException("baudRate must be > 0");
        }
        if (readTimeout.isNegative()) {
            throw new IllegalArgumentException("readTimeout must be >= 0");
        }
        this.baudRate = baudRate;
        this.port = SerialPort.getCommPort(portName);
    }

    @Override
    public String name()
    {
        return name;
    }

    @Override
    public void open() throws IOException
    {
        readCancelled = false;
        port.setComPortParameters(baudRate, 8, SerialPort.ONE_STOP_BIT, SerialPort.NO_PARITY);
        port.setComPortTimeouts(SerialPort.TIMEOUT_READ_SEMI_BLOCKING, (int) readTimeout.toMillis(), 0);
        if (!port.openPort()) {
            throw new IOException("could not open serial port " + name);
        }
    }

    @Override
    public boolean isOpen()
    {
        return port.isOpen();
    }

    @Override
    public int read(byte[] buffer) throws IOException
    {
        return checkRead(port.readBytes(buffer, buffer.length), port.isOpen(), readCancelled, name);
    }

    /**
     * A negative count on a port closed by {@link #cancelRead()} reads as no
     * data. Any other negative count, including a port that went away under a
     * running session, is a failure.
     */
    static int checkRead(int count, boolean open, boolean cancelled, String name) throws IOException
    {
        if (count >= 0) {
            return count;
        }
        if (!open && cancelled) {
            return 0;
        }
        throw new IOException(open
                ? "read from " + name + " failed"
                : "serial port " + name + " closed unexpectedly");
    }

    @Override
    public void write(byte[] data) throws IOException
    {
        int offset = 0;
        while (offset < data.length) {
            byte[] remaining = offset == 0 ? data : Arrays.copyOfRange(data, offset, data.length);
            int written = port.writeBytes(remaining, remaining.length);
            if (written < 0) {
                throw new IOException("write to " + name + " failed");
            }
            offset += written;
        }
    }

    @Override
    public void flush() throws IOException
    {
        if (!port.isOpen()) {
            return;
        }
        long deadline = System.nanoTime() + Math.max(readTimeout.toNanos(), Duration.ofMillis(100).toNanos());
        while (port.bytesAwaitingWrite() > 0 && System.nanoTime() < deadline) {
            try {
                Thread.sleep(1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted while flushing " + name, e);
            }
        }
    }

    @Override
    public void cancelRead()
    {
        readCancelled = true;
        if (readTimeout.isZero()) {
            port.closePort();
        }
    }

    @Override
    public Duration readTimeout()
    {
        return readTimeout;
    }

    @Override
    public void close() throws IOException
    {
        if (port.isOpen() && !port.closePort()) {
            throw new IOException("could not close serial port " + name);
        }
    }
}
