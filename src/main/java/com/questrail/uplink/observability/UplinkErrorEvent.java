package com.questrail.uplink.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly contained by the client.
 */
public record UplinkErrorEvent(
    Instant timestamp,
    UplinkErrorKind kind,
    String message,
    Throwable cause
) {
}
