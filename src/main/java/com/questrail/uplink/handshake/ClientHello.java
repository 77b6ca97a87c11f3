package com.questrail.uplink.handshake;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Payload of the handshake frame sent on every successful open.
 *
 * <p>{@code windowSize} is omitted from the wire when absent.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClientHello(String version, String platform, WindowSize windowSize) {

    public ClientHello {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(platform, "platform");
    }

    public record WindowSize(int width, int height) {
        public WindowSize {
            if (width < 0 || height < 0) {
                throw new IllegalArgumentException("window size must be non-negative: " + width + "x" + height);
            }
        }
    }
}
