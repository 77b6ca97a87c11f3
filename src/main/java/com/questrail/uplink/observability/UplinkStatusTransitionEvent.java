package com.questrail.uplink.observability;

import com.questrail.uplink.api.ConnectionStatus;

import java.time.Instant;

/**
 * Record representing a connection status change.
 */
public record UplinkStatusTransitionEvent(
    Instant timestamp,
    ConnectionStatus previous,
    ConnectionStatus current,
    int reconnectAttempt
) {
}
