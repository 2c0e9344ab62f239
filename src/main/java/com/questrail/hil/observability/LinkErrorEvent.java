package com.questrail.hil.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly on a serial link.
 */
public record LinkErrorEvent(
    Instant timestamp,
    String port,
    String message,
    Throwable cause
) {
}
