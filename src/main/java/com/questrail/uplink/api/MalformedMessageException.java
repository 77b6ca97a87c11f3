package com.questrail.uplink.api;

/**
 * Inbound text could not be decoded into an {@link UplinkMessage}, or a payload
 * could not be bound to a caller type.
 *
 * <p>The client never surfaces this for inbound frames; it reports the defect
 * and drops the frame.</p>
 */
public final class MalformedMessageException extends UplinkException
{
    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
