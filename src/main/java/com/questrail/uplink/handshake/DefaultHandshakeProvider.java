package com.questrail.uplink.handshake;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Reports the configured client version and the JVM's {@code os.name}.
 *
 * <p>A window size source may be supplied; it may return {@code null} when
 * no window is known, in which case the field is left out.</p>
 */
public final class DefaultHandshakeProvider implements HandshakeProvider {

    private final String clientVersion;
    private final String platform;
    private final Supplier<ClientHello.WindowSize> windowSize;

    public DefaultHandshakeProvider(String clientVersion) {
        this(clientVersion, () -> null);
    }

    public DefaultHandshakeProvider(String clientVersion, Supplier<ClientHello.WindowSize> windowSize) {
        this(clientVersion, System.getProperty("os.name", "unknown"), windowSize);
    }

    DefaultHandshakeProvider(String clientVersion, String platform, Supplier<ClientHello.WindowSize> windowSize) {
        this.clientVersion = Objects.requireNonNull(clientVersion, "clientVersion");
        this.platform = Objects.requireNonNull(platform, "platform");
        this.windowSize = Objects.requireNonNull(windowSize, "windowSize");
    }

    @Override
    public ClientHello hello() {
        return new ClientHello(clientVersion, platform, windowSize.get());
    }
}
