package com.questrail.uplink.observability;

/**
 * Classification of failures the client contains instead of propagating.
 */
public enum UplinkErrorKind {
    /** Inbound frame that is not a valid envelope; dropped. */
    MALFORMED_MESSAGE,
    /** A broadcast handler threw. */
    HANDLER_FAILURE,
    /** A status listener threw. */
    LISTENER_FAILURE,
    /** The socket reported an error. */
    TRANSPORT_ERROR,
    /** The handshake frame could not be written. */
    HANDSHAKE_FAILURE,
    /** An outbound frame could not be encoded or written. */
    SEND_FAILURE
}
