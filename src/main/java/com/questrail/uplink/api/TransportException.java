package com.questrail.uplink.api;

/**
 * Socket-level failure (connect refused, handshake rejected, write on a closed
 * channel). Reported to observability; state transitions are driven by the
 * close event that follows, never by this exception.
 */
public final class TransportException extends UplinkException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
