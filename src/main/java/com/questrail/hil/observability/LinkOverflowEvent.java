package com.questrail.hil.observability;

import java.time.Instant;

/**
 * A received line was dropped because the inbound queue was full.
 *
 * @param totalOverflows the session's overflow counter after this drop
 * @param droppedLine    text of the dropped line
 */
public record LinkOverflowEvent(
    Instant timestamp,
    String port,
    long totalOverflows,
    String droppedLine
) {
}
