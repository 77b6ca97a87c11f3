package com.questrail.uplink.time;

import com.questrail.uplink.internal.time.MonotonicClock;
import com.questrail.uplink.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hand-driven clock for tests, serving both the monotonic and the wall-clock seam.
 *
 * <p>Monotonic time starts at 0; wall time starts at the given instant. Both
 * move together and only through {@link #advance(Duration)}.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock, WallClock {

    private final Instant wallOrigin;
    private final AtomicLong elapsedNanos = new AtomicLong();

    public ManualMonotonicClock() {
        this(Instant.EPOCH);
    }

    public ManualMonotonicClock(Instant wallOrigin) {
        this.wallOrigin = wallOrigin;
    }

    @Override
    public long nowNanos() {
        return elapsedNanos.get();
    }

    @Override
    public Instant now() {
        return wallOrigin.plusNanos(elapsedNanos.get());
    }

    public void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Clock cannot move backwards: " + delta);
        }
        elapsedNanos.addAndGet(delta.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
