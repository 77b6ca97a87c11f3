package com.questrail.uplink.api;

/**
 * Callback for broadcast (non-correlated) inbound messages of one type.
 *
 * <p>Handlers run on the client's serialized event loop. They must not block;
 * an exception thrown here is reported and isolated from other handlers.</p>
 */
@FunctionalInterface
public interface MessageHandler
{
    void onMessage(UplinkMessage message);
}
