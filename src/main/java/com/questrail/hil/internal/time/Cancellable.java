package com.questrail.hil.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for one armed step on the cooperative scheduler.
 *
 * <p>
 * Polling loops (line dequeue, enqueue retry, periodic activities) hold the
 * handle of their next attempt so that cancelling the owning future disarms the
 * attempt before it can run.
 * </p>
 */
public interface Cancellable
{
    /**
     * Disarm the step.
     *
     * @return {@code true} if the step was disarmed; {@code false} if it already
     *         ran or was disarmed earlier.
     */
    boolean cancel();
}
