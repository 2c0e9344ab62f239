package com.questrail.hil.protocol;

/**
 * A command token outside a driver's command table.
 */
public final class UnknownCommandException extends IllegalArgumentException
{
    public UnknownCommandException(String message) {
        super(message);
    }
}
