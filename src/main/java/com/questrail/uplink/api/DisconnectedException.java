package com.questrail.uplink.api;

/**
 * A request could not complete because the connection went away: it was still
 * pending or queued when {@link UplinkClient#disconnect()} was called, or the
 * socket refused the write.
 */
public final class DisconnectedException extends UplinkException
{
    public static final String MESSAGE = "WebSocket disconnected";

    public DisconnectedException() {
        super(MESSAGE);
    }

    public DisconnectedException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
