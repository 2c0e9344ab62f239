package com.questrail.hil.transport;

import java.io.IOException;
import java.time.Duration;

/**
 * SerialDevice
 * -----------------------------------------------------------------------------
 * Blocking, byte-oriented port for one physical serial link.
 *
 * <p>Only the reader and writer workers of a {@link ConcurrentLineTransport}
 * call {@link #read(byte[])} and {@link #write(byte[])}; the owning thread calls
 * the lifecycle methods. Implementations may be backed by jSerialComm, a
 * simulator, or a test double.</p>
 *
 * <p>Implementations MUST NOT interpret the bytes they carry.</p>
 */
public interface SerialDevice extends AutoCloseable
{
    /**
     * Human-readable port name, used in thread names and log lines.
     */
    String name();

    void open() throws IOException;

    boolean isOpen();

    /**
     * Read up to {@code buffer.length} bytes, blocking for at most
     * {@link #readTimeout()}.
     *
     * @return the number of bytes read; {@code 0} if the read timed out or was
     *         cancelled by {@link #cancelRead()}
     * @throws IOException if the device failed; the reader treats this as fatal
     */
    int read(byte[] buffer) throws IOException;

    /**
     * Write all bytes, blocking until the device accepted them.
     */
    void write(byte[] data) throws IOException;

    /**
     * Wait until buffered output has been handed to the hardware.
     */
    void flush() throws IOException;

    /**
     * Abort an in-flight {@link #read(byte[])} so the reader can observe a stop.
     * A no-op for devices whose reads always return within the read timeout.
     */
    void cancelRead();

    /**
     * The hardware read timeout. {@link Duration#ZERO} means reads block until
     * data arrives.
     */
    Duration readTimeout();

    @Override
    void close() throws IOException;
}
