package com.questrail.uplink.api;

/**
 * ConnectionStatus
 * -----------------------------------------------------------------------------
 * Coarse-grained connection state reported by an {@link UplinkClient}.
 *
 * <h2>Transitions</h2>
 * <pre>
 *   DISCONNECTED → CONNECTING → CONNECTED → RECONNECTING → CONNECTING → ...
 *                                    ↘ DISCONNECTED (explicit disconnect, from any state)
 * </pre>
 *
 * <p>{@code CONNECTED} is only ever entered from {@code CONNECTING}. A transition
 * to the current value is suppressed, so listeners never observe the same status
 * twice in a row.</p>
 */
public enum ConnectionStatus
{
    /**
     * Initial state, and the terminal state after an explicit disconnect.
     * No automatic reconnection happens while in this state.
     */
    DISCONNECTED("disconnected"),

    /**
     * A socket has been created and the opening handshake is in progress.
     */
    CONNECTING("connecting"),

    /**
     * The socket is open; sends go straight to the wire.
     */
    CONNECTED("connected"),

    /**
     * The socket closed unexpectedly and a retry is scheduled.
     */
    RECONNECTING("reconnecting");

    private final String label;

    ConnectionStatus(String label) {
        this.label = label;
    }

    /**
     * Lower-case label used in logs and by UI collaborators.
     */
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
