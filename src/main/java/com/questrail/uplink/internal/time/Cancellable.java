package com.questrail.uplink.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled task (reconnect delay, correlation timeout).
 *
 * <p>Implemented by the production executor-backed scheduler and by the
 * deterministic scheduler used in tests.</p>
 */
public interface Cancellable
{
    /**
     * Cancellable for work that was never scheduled.
     */
    Cancellable NONE = () -> false;

    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
