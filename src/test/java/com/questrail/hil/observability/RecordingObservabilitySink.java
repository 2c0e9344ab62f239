package com.questrail.hil.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements LinkObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onTransportEvent(LinkTransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onOverflow(LinkOverflowEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(LinkErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<LinkTransportEvent.Kind> getTransportEventKinds() {
        return events.stream()
            .filter(e -> e instanceof LinkTransportEvent)
            .map(e -> ((LinkTransportEvent) e).kind())
            .collect(Collectors.toList());
    }

    public synchronized List<LinkOverflowEvent> getOverflows() {
        return events.stream()
            .filter(e -> e instanceof LinkOverflowEvent)
            .map(e -> (LinkOverflowEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
