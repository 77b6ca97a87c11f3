package com.questrail.uplink.observability;

/**
 * Receives client observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the client's event loop and must not block.</p>
 */
public interface UplinkObservabilitySink {
    /**
     * Called after the connection status changed.
     * @param event the transition details
     */
    void onStatusTransition(UplinkStatusTransitionEvent event);

    /**
     * Called for protocol activity (send, queue, flush, response, timeout, reconnect scheduling).
     * @param event the protocol event
     */
    void onProtocolEvent(UplinkProtocolEvent event);

    /**
     * Called when a failure is contained by the client.
     * @param event the error event
     */
    void onError(UplinkErrorEvent event);
}
