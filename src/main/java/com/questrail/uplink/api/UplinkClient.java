package com.questrail.uplink.api;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * UplinkClient
 * -----------------------------------------------------------------------------
 * {@code UplinkClient} is the single bidirectional message channel between a
 * desktop UI and its long-lived backend process.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Owning exactly one socket at a time and its lifecycle</li>
 *   <li>Turning non fire-and-forget sends into request/response pairs via
 *       correlation ids</li>
 *   <li>Queueing sends while not connected and replaying them, in order, once
 *       the connection opens</li>
 *   <li>Recovering from unexpected drops with a capped backoff schedule</li>
 *   <li>Routing uncorrelated inbound messages to handlers registered by type</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Resending messages that were in flight when the socket dropped</li>
 *   <li>Bounding the operation queue (backpressure is a caller concern)</li>
 *   <li>Deciding how errors are shown to a user</li>
 * </ul>
 *
 * <h2>Non-blocking contract</h2>
 * Every method returns promptly. {@link #send(String, Object)} always hands back
 * a future synchronously, whether the message went to the wire, was queued, or
 * will later time out. Callers must not block on that future from inside a
 * {@link MessageHandler} or {@link StatusListener}; those run on the client's
 * event loop.
 *
 * <h2>Settlement</h2>
 * Each returned future settles exactly once:
 * <ul>
 *   <li>fire-and-forget types: {@code Optional.empty()} as soon as the frame is written</li>
 *   <li>correlated types: the matching response, or {@link RequestTimeoutException}</li>
 *   <li>any pending or queued request on {@link #disconnect()}: {@link DisconnectedException}</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Implementations serialize all state changes through one execution context.
 * Registration methods and the read-only accessors may be called from any thread.
 */
public interface UplinkClient
{
    /**
     * Opens a socket to the configured server.
     * <p>
     * No-op while {@link ConnectionStatus#CONNECTING} or
     * {@link ConnectionStatus#CONNECTED}; otherwise cancels any scheduled retry
     * and starts a fresh connection attempt.
     */
    void connect();

    /**
     * Tears the connection down and stops automatic reconnection.
     * <p>
     * Cancels the retry timer, resets the reconnect counter, rejects every
     * pending and queued request with {@link DisconnectedException}, closes the
     * socket and moves to {@link ConnectionStatus#DISCONNECTED}. Nothing
     * scheduled before this call can change client state afterwards.
     */
    void disconnect();

    /**
     * Sends a message using the configured correlation timeout.
     *
     * @param type    message type
     * @param payload any value Jackson can serialize; {@code null} is sent as an empty object
     * @return future holding the correlated response, or empty for fire-and-forget types
     */
    CompletableFuture<Optional<UplinkMessage>> send(String type, Object payload);

    /**
     * Sends a message with a per-request correlation timeout. The timeout is
     * ignored for fire-and-forget types.
     */
    CompletableFuture<Optional<UplinkMessage>> send(String type, Object payload, Duration timeout);

    /**
     * Registers a broadcast handler for a message type. Registering the same
     * handler twice for one type has no additional effect.
     */
    void on(String type, MessageHandler handler);

    /**
     * Removes a broadcast handler. Removing the last handler for a type forgets
     * the type entirely.
     */
    void off(String type, MessageHandler handler);

    /**
     * Registers a status listener.
     *
     * @return handle that removes the listener
     */
    Subscription onStatusChange(StatusListener listener);

    /**
     * Current connection status.
     */
    ConnectionStatus status();

    /**
     * Current reconnect attempt; 0 while connected or after an explicit disconnect.
     */
    int reconnectAttempt();
}
