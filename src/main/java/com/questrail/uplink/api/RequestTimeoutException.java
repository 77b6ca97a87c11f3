package com.questrail.uplink.api;

import java.time.Duration;
import java.util.Objects;

/**
 * No correlated response arrived within the timeout window.
 *
 * <p>The message names both the elapsed time and the request type, e.g.
 * {@code Request timed out after 30000ms: file:open}.</p>
 */
public final class RequestTimeoutException extends UplinkException
{
    private final String messageType;
    private final Duration elapsed;

    public RequestTimeoutException(String messageType, Duration elapsed) {
        super("Request timed out after " + elapsed.toMillis() + "ms: " + messageType);
        this.messageType = Objects.requireNonNull(messageType, "messageType");
        this.elapsed = elapsed;
    }

    public String messageType() {
        return messageType;
    }

    public Duration elapsed() {
        return elapsed;
    }
}
