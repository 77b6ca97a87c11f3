package com.questrail.uplink.api;

/**
 * Receives every accepted {@link ConnectionStatus} transition.
 */
@FunctionalInterface
public interface StatusListener
{
    /**
     * @param status           the new status
     * @param reconnectAttempt the reconnect counter at the time of the transition
     *                         (0 while connected or after an explicit disconnect)
     */
    void onStatusChange(ConnectionStatus status, int reconnectAttempt);
}
