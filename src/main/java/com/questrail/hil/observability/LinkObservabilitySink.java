package com.questrail.hil.observability;

/**
 * Receives lifecycle, backpressure and error events from serial transports.
 * Implementations can provide logging, metrics, or test recording.
 *
 * <p>Callbacks arrive on the reader, writer or closing thread; implementations
 * must be thread-safe.</p>
 */
public interface LinkObservabilitySink {
    /**
     * Called when a transport opens, closes, or loses one of its workers.
     * @param event the lifecycle event
     */
    void onTransportEvent(LinkTransportEvent event);

    /**
     * Called when the reader dropped a line because the inbound queue was full.
     * @param event the overflow details
     */
    void onOverflow(LinkOverflowEvent event);

    /**
     * Called when a device operation failed or a worker did not stop in time.
     * @param event the error event
     */
    void onError(LinkErrorEvent event);
}
