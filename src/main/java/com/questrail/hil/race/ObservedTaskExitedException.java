package com.questrail.hil.race;

/**
 * A task that was required to keep running completed before the observing
 * task did.
 */
public final class ObservedTaskExitedException extends RuntimeException
{
    public ObservedTaskExitedException(String message) {
        super(message);
    }
}
