package com.questrail.uplink.internal.exec;

import com.questrail.uplink.config.UplinkTimingPolicy;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectBackoffTest {

    private final ReconnectBackoff backoff = new ReconnectBackoff(UplinkTimingPolicy.defaults());

    @Test
    void attemptsCountUpAndReset() {
        assertEquals(1, backoff.recordAttempt());
        assertEquals(2, backoff.recordAttempt());
        assertEquals(2, backoff.attempts());

        backoff.reset();

        assertEquals(0, backoff.attempts());
        assertEquals(1, backoff.recordAttempt());
    }

    @Test
    void delayTracksTheAttemptNumber() {
        assertEquals(Duration.ofMillis(1000), backoff.delayFor(1));
        assertEquals(Duration.ofMillis(16000), backoff.delayFor(5));
        assertEquals(Duration.ofMillis(30000), backoff.delayFor(6));
        assertEquals(Duration.ofMillis(30000), backoff.delayFor(50));
    }
}
