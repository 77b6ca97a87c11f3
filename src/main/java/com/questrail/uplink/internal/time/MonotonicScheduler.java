package com.questrail.uplink.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Timer seam for the uplink client. Two kinds of task go through it:
 *
 * <ul>
 *   <li><b>Correlation timeouts.</b> One per correlated request, armed when the
 *       frame is written (a queued request arms it at flush time). The handle is
 *       kept in the correlation table and cancelled when a response, a write
 *       failure or {@code disconnect()} settles the request first.</li>
 *   <li><b>Reconnect delays.</b> At most one live at a time. A new close
 *       replaces it, and {@code connect()} or {@code disconnect()} cancels it.
 *       A generation check covers a task that already started when cancelled.</li>
 * </ul>
 *
 * <p>Deadlines are monotonic nanoseconds, so a wall-clock jump neither fires a
 * timeout early nor holds back a retry. Tasks run on the scheduler's thread
 * and only re-submit work to the client's event loop.</p>
 *
 * <p>Tests substitute a scheduler that runs due tasks only when the test
 * advances a manual clock.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} at or after the given monotonic deadline. Cancelling the
     * returned handle after the task has started has no effect.
     *
     * @param deadlineNanos deadline in nanoseconds, from {@link MonotonicClock#nowNanos()}
     * @param task          task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Run {@code task} once {@code delay} has elapsed on {@code clock}. A zero
     * delay is allowed; the task still runs on the scheduler, never inline.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }
}
