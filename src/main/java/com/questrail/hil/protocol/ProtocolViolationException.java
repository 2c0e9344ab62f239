package com.questrail.hil.protocol;

/**
 * A device answered, but not in the shape its protocol requires (short or
 * non-numeric payload, missing diagnostic line).
 */
public final class ProtocolViolationException extends RuntimeException
{
    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
