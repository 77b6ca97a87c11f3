package com.questrail.uplink.observability;

import java.time.Instant;

/**
 * Record representing protocol activity.
 *
 * <p>{@code correlationId} is {@code null} for uncorrelated frames.
 * {@code detail} carries kind-specific context such as the reconnect delay.</p>
 */
public record UplinkProtocolEvent(
    Instant timestamp,
    Kind kind,
    String messageType,
    String correlationId,
    String detail
) {

    public enum Kind {
        /** A frame was written to the socket. */
        SENT,
        /** A send was buffered because the socket is not open. */
        QUEUED,
        /** The offline queue was replayed after an open. */
        FLUSHED,
        /** An inbound frame settled a pending request. */
        RESPONSE,
        /** A pending request expired. */
        TIMEOUT,
        /** A reconnect attempt was scheduled. */
        RECONNECT_SCHEDULED
    }

    public static UplinkProtocolEvent of(Instant timestamp, Kind kind, String messageType, String correlationId) {
        return new UplinkProtocolEvent(timestamp, kind, messageType, correlationId, null);
    }
}
