package com.questrail.hil.observability;

/**
 * No-op implementation of LinkObservabilitySink.
 */
public final class NullObservabilitySink implements LinkObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(LinkTransportEvent event) {}

    @Override
    public void onOverflow(LinkOverflowEvent event) {}

    @Override
    public void onError(LinkErrorEvent event) {}
}
