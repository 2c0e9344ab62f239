package com.questrail.hil.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LinkObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLinkObservabilitySink implements LinkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLinkObservabilitySink.class);

    @Override
    public void onTransportEvent(LinkTransportEvent event) {
        switch (event.kind()) {
            case OPENED, CLOSED -> log.info("Serial {}: {}", event.port(), event.kind());
            case READER_EXITED -> log.error("Serial {}: read thread exiting.", event.port());
            case WRITER_EXITED -> log.error("Serial {}: write thread exiting.", event.port());
        }
    }

    @Override
    public void onOverflow(LinkOverflowEvent event) {
        log.warn("Serial {}: read buffer overflow ({} dropped so far).",
            event.port(),
            event.totalOverflows());
    }

    @Override
    public void onError(LinkErrorEvent event) {
        log.error("Serial {}: {}", event.port(), event.message(), event.cause());
    }
}
