package com.questrail.uplink.transport.netty;

import com.questrail.uplink.api.TransportException;
import com.questrail.uplink.transport.SocketEndpoint;
import com.questrail.uplink.transport.SocketEndpointFactory;
import com.questrail.uplink.transport.SocketEndpointListener;

import io.netty.channel.EventLoopGroup;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Creates {@link NettyWebSocketEndpoint}s that share one event loop group.
 *
 * <p>The group is owned by the caller (see {@code UplinkRuntime}). A client
 * TLS context is built on first use of a {@code wss} URI and reused.</p>
 */
public final class NettyWebSocketEndpointFactory implements SocketEndpointFactory
{
    private final EventLoopGroup group;
    private final int maxFramePayloadLength;
    private final Duration connectTimeout;

    private volatile SslContext sslContext;

    public NettyWebSocketEndpointFactory(EventLoopGroup group, int maxFramePayloadLength, Duration connectTimeout)
    {
        this.group = Objects.requireNonNull(group, "group");
        if (maxFramePayloadLength <= 0) {
            throw new IllegalArgumentException("maxFramePayloadLength must be positive");
        }
        this.maxFramePayloadLength = maxFramePayloadLength;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public SocketEndpoint create(URI uri, SocketEndpointListener listener)
    {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(listener, "listener");

        SslContext ssl = "wss".equalsIgnoreCase(uri.getScheme()) ? clientSslContext() : null;
        return new NettyWebSocketEndpoint(uri, group, ssl, maxFramePayloadLength, connectTimeout, listener);
    }

    private SslContext clientSslContext()
    {
        SslContext ctx = sslContext;
        if (ctx == null) {
            synchronized (this) {
                ctx = sslContext;
                if (ctx == null) {
                    try {
                        ctx = SslContextBuilder.forClient().build();
                    } catch (SSLException e) {
                        throw new TransportException("Cannot build client TLS context", e);
                    }
                    sslContext = ctx;
                }
            }
        }
        return ctx;
    }
}
