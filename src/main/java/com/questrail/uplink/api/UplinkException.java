package com.questrail.uplink.api;

/**
 * Root of the exceptions a caller can observe from an {@link UplinkClient}.
 *
 * <p>Futures returned by {@link UplinkClient#send(String, Object)} only ever
 * complete exceptionally with a subclass of this type.</p>
 */
public class UplinkException extends RuntimeException
{
    public UplinkException(String message) {
        super(message);
    }

    public UplinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
