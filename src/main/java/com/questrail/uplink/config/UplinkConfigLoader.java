package com.questrail.uplink.config;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Loads {@link UplinkClientConfig} from a {@link Properties} stream.
 *
 * <h2>Keys</h2>
 * <pre>
 *   uplink.server-uri                 ws:// or wss:// URI
 *   uplink.client-version             version reported in the handshake
 *   uplink.handshake-type             handshake message type
 *   uplink.correlation-timeout-ms     positive integer
 *   uplink.backoff-ms                 comma-separated delays, e.g. 1000,2000,4000
 *   uplink.fire-and-forget            comma-separated types; replaces the default set
 *   uplink.max-frame-payload-length   positive integer, bytes
 *   uplink.connect-timeout-ms         positive integer; bounds TCP connect and HTTP upgrade each
 * </pre>
 *
 * <p>Absent keys keep the defaults. Invalid values raise
 * {@link IllegalArgumentException} naming the offending key.</p>
 */
public final class UplinkConfigLoader {

    public static final String SERVER_URI = "uplink.server-uri";
    public static final String CLIENT_VERSION = "uplink.client-version";
    public static final String HANDSHAKE_TYPE = "uplink.handshake-type";
    public static final String CORRELATION_TIMEOUT_MS = "uplink.correlation-timeout-ms";
    public static final String BACKOFF_MS = "uplink.backoff-ms";
    public static final String FIRE_AND_FORGET = "uplink.fire-and-forget";
    public static final String MAX_FRAME_PAYLOAD_LENGTH = "uplink.max-frame-payload-length";
    public static final String CONNECT_TIMEOUT_MS = "uplink.connect-timeout-ms";

    private UplinkConfigLoader() {}

    /**
     * Reads properties from {@code in} (not closed) and builds a configuration.
     *
     * @throws IOException if the stream cannot be read
     */
    public static UplinkClientConfig load(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        Properties props = new Properties();
        props.load(in);
        return fromProperties(props);
    }

    public static UplinkClientConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        UplinkClientConfig.Builder builder = UplinkClientConfig.builder();

        String uri = trimmed(props, SERVER_URI);
        if (uri != null) {
            try {
                builder.withServerUri(URI.create(uri));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(SERVER_URI + " is not a valid URI: " + uri, e);
            }
        }

        String version = trimmed(props, CLIENT_VERSION);
        if (version != null) {
            builder.withClientVersion(version);
        }

        String handshakeType = trimmed(props, HANDSHAKE_TYPE);
        if (handshakeType != null) {
            builder.withHandshakeType(handshakeType);
        }

        UplinkTimingPolicy timing = UplinkTimingPolicy.defaults();
        String timeout = trimmed(props, CORRELATION_TIMEOUT_MS);
        if (timeout != null) {
            timing = timing.withCorrelationTimeout(Duration.ofMillis(positiveLong(CORRELATION_TIMEOUT_MS, timeout)));
        }
        String backoff = trimmed(props, BACKOFF_MS);
        if (backoff != null) {
            List<Duration> delays = new ArrayList<>();
            for (String part : split(backoff)) {
                delays.add(Duration.ofMillis(nonNegativeLong(BACKOFF_MS, part)));
            }
            if (delays.isEmpty()) {
                throw new IllegalArgumentException(BACKOFF_MS + " must list at least one delay");
            }
            timing = new UplinkTimingPolicy(timing.correlationTimeout(), delays);
        }
        builder.withTimingPolicy(timing);

        String fireAndForget = props.getProperty(FIRE_AND_FORGET);
        if (fireAndForget != null) {
            Set<String> types = new LinkedHashSet<>(split(fireAndForget));
            builder.withFireAndForgetTypes(types);
        }

        String maxFrame = trimmed(props, MAX_FRAME_PAYLOAD_LENGTH);
        if (maxFrame != null) {
            long value = positiveLong(MAX_FRAME_PAYLOAD_LENGTH, maxFrame);
            if (value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(MAX_FRAME_PAYLOAD_LENGTH + " is too large: " + maxFrame);
            }
            builder.withMaxFramePayloadLength((int) value);
        }

        String connectTimeout = trimmed(props, CONNECT_TIMEOUT_MS);
        if (connectTimeout != null) {
            builder.withConnectTimeout(Duration.ofMillis(positiveLong(CONNECT_TIMEOUT_MS, connectTimeout)));
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid uplink configuration: " + e.getMessage(), e);
        }
    }

    private static String trimmed(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    private static List<String> split(String csv) {
        List<String> parts = new ArrayList<>();
        for (String part : csv.split(",")) {
            String p = part.trim();
            if (!p.isEmpty()) {
                parts.add(p);
            }
        }
        return parts;
    }

    private static long positiveLong(String key, String raw) {
        long value = parseLong(key, raw);
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + raw);
        }
        return value;
    }

    private static long nonNegativeLong(String key, String raw) {
        long value = parseLong(key, raw);
        if (value < 0) {
            throw new IllegalArgumentException(key + " must be non-negative: " + raw);
        }
        return value;
    }

    private static long parseLong(String key, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw, e);
        }
    }
}
