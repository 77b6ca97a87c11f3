package com.questrail.uplink.config;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * UplinkTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the transport client.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>correlationTimeout</b>: how long a correlated request waits for its
 *       response before failing with a timeout.</li>
 *   <li><b>reconnectDelays</b>: the backoff table. Attempt <i>n</i> (1-indexed)
 *       waits {@code reconnectDelays[min(n - 1, size - 1)]}, so the last entry
 *       is the cap for every attempt past the end of the table.</li>
 * </ul>
 */
public record UplinkTimingPolicy(
        Duration correlationTimeout,
        List<Duration> reconnectDelays
) {
    public static final Duration DEFAULT_CORRELATION_TIMEOUT = Duration.ofSeconds(30);

    public static final List<Duration> DEFAULT_RECONNECT_DELAYS = List.of(
            Duration.ofMillis(1_000),
            Duration.ofMillis(2_000),
            Duration.ofMillis(4_000),
            Duration.ofMillis(8_000),
            Duration.ofMillis(16_000),
            Duration.ofMillis(30_000)
    );

    public UplinkTimingPolicy {
        Objects.requireNonNull(correlationTimeout, "correlationTimeout");
        Objects.requireNonNull(reconnectDelays, "reconnectDelays");

        if (correlationTimeout.isNegative() || correlationTimeout.isZero()) {
            throw new IllegalArgumentException("correlationTimeout must be positive");
        }
        if (reconnectDelays.isEmpty()) {
            throw new IllegalArgumentException("reconnectDelays must not be empty");
        }
        for (Duration delay : reconnectDelays) {
            Objects.requireNonNull(delay, "reconnectDelays element");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("reconnectDelays must be non-negative");
            }
        }
        reconnectDelays = List.copyOf(reconnectDelays);
    }

    /**
     * Returns the delay before reconnect attempt {@code attempt}.
     *
     * @param attempt 1-indexed attempt number
     */
    public Duration backoffDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        int index = Math.min(attempt - 1, reconnectDelays.size() - 1);
        return reconnectDelays.get(index);
    }

    /**
     * Copy of this policy with a different correlation timeout.
     */
    public UplinkTimingPolicy withCorrelationTimeout(Duration timeout) {
        return new UplinkTimingPolicy(timeout, reconnectDelays);
    }

    /**
     * 30 s correlation timeout; backoff 1 s, 2 s, 4 s, 8 s, 16 s, then 30 s.
     */
    public static UplinkTimingPolicy defaults() {
        return new UplinkTimingPolicy(DEFAULT_CORRELATION_TIMEOUT, DEFAULT_RECONNECT_DELAYS);
    }
}
