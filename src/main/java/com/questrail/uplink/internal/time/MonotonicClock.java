package com.questrail.uplink.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for everything that affects client behavior: correlation
 * timeouts and reconnect delays.
 *
 * <p>Wall-clock time is used only for the envelope {@code timestamp} field and
 * for observability events; see {@link WallClock}.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful relative to each other.
     */
    long nowNanos();
}
