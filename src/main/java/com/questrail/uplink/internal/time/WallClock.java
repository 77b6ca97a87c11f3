package com.questrail.uplink.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for message timestamps and observability events.
 *
 * <p>This clock may jump. It MUST NOT drive timeouts or backoff.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
