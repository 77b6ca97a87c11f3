package com.questrail.uplink.transport;

/**
 * SocketEndpoint
 * -----------------------------------------------------------------------------
 * Port for one message-oriented socket connection (a WebSocket in production).
 *
 * <p>An endpoint is single-use: it is created for one connection attempt,
 * opened once, and discarded after it closes. Reconnection creates a new
 * endpoint through a {@link SocketEndpointFactory}.</p>
 *
 * <p>Higher layers are responsible for:</p>
 * <ul>
 *   <li>encoding and decoding message text</li>
 *   <li>correlation, queueing and timeouts</li>
 *   <li>deciding whether and when to reconnect</li>
 * </ul>
 */
public interface SocketEndpoint
{
    /**
     * Begin connecting. Returns immediately; the outcome is reported through
     * {@link SocketEndpointListener#onOpen()} or an error followed by a close.
     */
    void open();

    /**
     * Write one text message.
     *
     * @throws com.questrail.uplink.api.TransportException if the endpoint is not open
     */
    void sendText(String text);

    /**
     * Begin an orderly close. Safe to call in any state and more than once.
     */
    void close();

    /**
     * Whether the endpoint is open and accepting writes.
     */
    boolean isOpen();
}
