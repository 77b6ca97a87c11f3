package com.questrail.uplink.transport;

/**
 * SocketEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for a {@link SocketEndpoint}.
 *
 * <h2>Delivery contract</h2>
 * <ul>
 *   <li>Callbacks for one endpoint are delivered serially.</li>
 *   <li>{@link #onOpen()} at most once.</li>
 *   <li>Every {@link #onError(Throwable)} is followed by {@link #onClose(int, String)}.</li>
 *   <li>{@link #onClose(int, String)} at most once; nothing is delivered after it.</li>
 *   <li>{@link #onText(String)} receives complete messages only.</li>
 * </ul>
 */
public interface SocketEndpointListener
{
    /**
     * The connection is established and writes are accepted.
     */
    void onOpen();

    /**
     * A complete text message arrived.
     */
    void onText(String text);

    /**
     * The connection is gone.
     *
     * @param code   close status code (1006 when the connection dropped without a close frame)
     * @param reason close reason; may be empty
     */
    void onClose(int code, String reason);

    /**
     * A transport failure occurred. Diagnostic only; a close always follows.
     */
    void onError(Throwable cause);
}
