package com.questrail.uplink.observability;

/**
 * No-op implementation of UplinkObservabilitySink.
 */
public final class NullObservabilitySink implements UplinkObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStatusTransition(UplinkStatusTransitionEvent event) {}

    @Override
    public void onProtocolEvent(UplinkProtocolEvent event) {}

    @Override
    public void onError(UplinkErrorEvent event) {}
}
