package com.questrail.hil.transport;

/**
 * Raised when a caller waits for a line on a transport whose workers have
 * stopped and whose inbound queue is empty. No further lines can arrive.
 */
public final class TransportStoppedException extends RuntimeException
{
    public TransportStoppedException(String message) {
        super(message);
    }
}
