package com.questrail.uplink.config;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated configuration for an uplink transport client.
 *
 * <p>Every knob that is externally meaningful lives here: the server URI, the
 * fire-and-forget type set, the timing policy (correlation timeout and backoff
 * table), the handshake identity, the inbound frame size limit and the bound
 * on opening a socket. Values are fixed for the lifetime of a client.</p>
 *
 * <p>{@code connectTimeout} bounds the TCP connect and, separately, the HTTP
 * upgrade that follows it. A socket that misses either deadline is closed,
 * which counts as an unexpected closure and schedules the next attempt.</p>
 */
public record UplinkClientConfig(
    URI serverUri,
    Set<String> fireAndForgetTypes,
    UplinkTimingPolicy timingPolicy,
    String clientVersion,
    String handshakeType,
    int maxFramePayloadLength,
    Duration connectTimeout
) {
    public static final URI DEFAULT_SERVER_URI = URI.create("ws://localhost:3001/ws");
    public static final String DEFAULT_CLIENT_VERSION = "0.1.0";
    public static final String DEFAULT_HANDSHAKE_TYPE = "connection:hello";
    public static final int DEFAULT_MAX_FRAME_PAYLOAD_LENGTH = 10 * 1024 * 1024;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public UplinkClientConfig {
        Objects.requireNonNull(serverUri, "serverUri");
        Objects.requireNonNull(fireAndForgetTypes, "fireAndForgetTypes");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(clientVersion, "clientVersion");
        Objects.requireNonNull(handshakeType, "handshakeType");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        String scheme = serverUri.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("serverUri must use ws or wss: " + serverUri);
        }
        if (handshakeType.isBlank()) {
            throw new IllegalArgumentException("handshakeType must not be blank");
        }
        if (maxFramePayloadLength <= 0) {
            throw new IllegalArgumentException("maxFramePayloadLength must be positive");
        }
        if (connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connectTimeout must be positive: " + connectTimeout);
        }
        fireAndForgetTypes = Collections.unmodifiableSet(new LinkedHashSet<>(fireAndForgetTypes));
    }

    /**
     * Whether sends of {@code type} skip correlation.
     */
    public boolean isFireAndForget(String type) {
        return fireAndForgetTypes.contains(type);
    }

    public static UplinkClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private URI serverUri = DEFAULT_SERVER_URI;
        private Set<String> fireAndForgetTypes = FireAndForgetTypes.defaults();
        private UplinkTimingPolicy timingPolicy = UplinkTimingPolicy.defaults();
        private String clientVersion = DEFAULT_CLIENT_VERSION;
        private String handshakeType = DEFAULT_HANDSHAKE_TYPE;
        private int maxFramePayloadLength = DEFAULT_MAX_FRAME_PAYLOAD_LENGTH;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

        public Builder withServerUri(URI serverUri) {
            this.serverUri = serverUri;
            return this;
        }

        public Builder withServerUri(String serverUri) {
            return withServerUri(URI.create(serverUri));
        }

        public Builder withFireAndForgetTypes(Set<String> types) {
            this.fireAndForgetTypes = types;
            return this;
        }

        public Builder withTimingPolicy(UplinkTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withClientVersion(String clientVersion) {
            this.clientVersion = clientVersion;
            return this;
        }

        public Builder withHandshakeType(String handshakeType) {
            this.handshakeType = handshakeType;
            return this;
        }

        public Builder withMaxFramePayloadLength(int length) {
            this.maxFramePayloadLength = length;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public UplinkClientConfig build() {
            return new UplinkClientConfig(
                serverUri,
                fireAndForgetTypes,
                timingPolicy,
                clientVersion,
                handshakeType,
                maxFramePayloadLength,
                connectTimeout
            );
        }
    }
}
