package com.questrail.uplink.internal.exec;

import com.questrail.uplink.config.UplinkTimingPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Reconnect attempt tracker.
 *
 * - Counts unexpected closes since the last successful open
 * - Resets on open and on explicit disconnect
 * - Looks delays up in the timing policy; does not schedule anything itself
 *
 * Mutated only on the client's event loop. The count is volatile so that
 * status queries from other threads see the latest value.
 */
public final class ReconnectBackoff {

    private final UplinkTimingPolicy timingPolicy;
    private volatile int attempts;

    public ReconnectBackoff(UplinkTimingPolicy timingPolicy) {
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
    }

    /**
     * Record an unexpected close.
     *
     * @return the updated attempt number (1 for the first retry)
     */
    public int recordAttempt() {
        return ++attempts;
    }

    /**
     * Delay before the given attempt, capped at the last table entry.
     */
    public Duration delayFor(int attempt) {
        return timingPolicy.backoffDelay(attempt);
    }

    public void reset() {
        attempts = 0;
    }

    /**
     * Current attempt count (0 if none).
     */
    public int attempts() {
        return attempts;
    }
}
