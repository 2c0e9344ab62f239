package com.questrail.hil.observability;

import java.time.Instant;

/**
 * Lifecycle event of one serial session. The timestamp is observational only.
 */
public record LinkTransportEvent(
    Instant timestamp,
    String port,
    Kind kind
) {
    public enum Kind {
        OPENED,
        CLOSED,
        READER_EXITED,
        WRITER_EXITED
    }
}
