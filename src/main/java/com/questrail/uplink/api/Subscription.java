package com.questrail.uplink.api;

/**
 * Handle returned by a registration; calling {@link #unsubscribe()} removes it.
 * Unsubscribing more than once has no further effect.
 */
@FunctionalInterface
public interface Subscription
{
    void unsubscribe();
}
