package com.questrail.uplink.transport.netty;

import com.questrail.uplink.api.TransportException;
import com.questrail.uplink.transport.SocketEndpoint;
import com.questrail.uplink.transport.SocketEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.util.concurrent.ScheduledFuture;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyWebSocketEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link SocketEndpoint} port: one RFC 6455
 * client connection.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not parse
 * envelopes, correlate requests or reconnect.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   [SslHandler] → HttpClientCodec → HttpObjectAggregator
 *       → WebSocketFrameAggregator → ClientHandler
 * </pre>
 * The handshaker swaps the HTTP codec for WebSocket frame codecs once the
 * upgrade response arrives. Continuation frames are reassembled before they
 * reach the listener.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code ByteBuf}, frames) never leave this package.
 * The listener sees text, lifecycle signals and {@link TransportException}s.
 *
 * <h2>Event contract</h2>
 * All listener callbacks run on the channel's event loop. Close is reported at
 * most once, including when the TCP connect itself fails.
 *
 * <h2>Opening deadline</h2>
 * The connect timeout bounds the TCP connect and, once the channel is active,
 * the HTTP upgrade. A server that accepts the connection but never answers the
 * upgrade gets an error and then a 1006 close, never silence.
 */
public final class NettyWebSocketEndpoint implements SocketEndpoint
{
    static final int CLOSE_NORMAL = 1000;
    static final int CLOSE_NO_STATUS = 1005;
    static final int CLOSE_ABNORMAL = 1006;

    private final URI uri;
    private final EventLoopGroup group;
    private final SslContext sslContext;
    private final int maxFramePayloadLength;
    private final long connectTimeoutMillis;
    private final SocketEndpointListener listener;

    private final AtomicBoolean opened = new AtomicBoolean(false);
    private final AtomicBoolean closeReported = new AtomicBoolean(false);

    private volatile Channel channel;
    private volatile ChannelFuture connectFuture;
    private volatile boolean handshakeComplete;
    private volatile int closeCode = CLOSE_ABNORMAL;
    private volatile String closeReason = "";

    /**
     * @param sslContext TLS context for {@code wss}; {@code null} for plain {@code ws}
     */
    public NettyWebSocketEndpoint(URI uri,
                                  EventLoopGroup group,
                                  SslContext sslContext,
                                  int maxFramePayloadLength,
                                  Duration connectTimeout,
                                  SocketEndpointListener listener)
    {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.group = Objects.requireNonNull(group, "group");
        this.sslContext = sslContext;
        this.maxFramePayloadLength = maxFramePayloadLength;
        this.connectTimeoutMillis = Objects.requireNonNull(connectTimeout, "connectTimeout").toMillis();
        if (connectTimeoutMillis <= 0 || connectTimeoutMillis > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("connectTimeout out of range: " + connectTimeout);
        }
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void open()
    {
        if (!opened.compareAndSet(false, true)) {
            throw new IllegalStateException("Endpoint already opened: " + uri);
        }

        final String host = uri.getHost();
        final int port = portOf(uri);

        // A fresh handshaker per endpoint: it tracks handshake state for one channel.
        final WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), maxFramePayloadLength);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeoutMillis)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(8192));
                        p.addLast(new WebSocketFrameAggregator(maxFramePayloadLength));
                        p.addLast(new ClientHandler(handshaker));
                    }
                });

        ChannelFuture f = bootstrap.connect(host, port);
        connectFuture = f;
        channel = f.channel();
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                return;
            }
            // The channel never became active, so channelInactive will not report the close.
            if (!future.isCancelled()) {
                reportError(new TransportException("Connect to " + uri + " failed", future.cause()));
            }
            reportClose(CLOSE_ABNORMAL, future.isCancelled() ? "connect cancelled" : "connect failed");
        });
    }

    @Override
    public void sendText(String text)
    {
        Objects.requireNonNull(text, "text");

        Channel ch = channel;
        if (ch == null || !handshakeComplete || !ch.isActive()) {
            throw new TransportException("WebSocket is not open");
        }

        ch.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                reportError(new TransportException("Write to " + uri + " failed", future.cause()));
                future.channel().close();
            }
        });
    }

    @Override
    public void close()
    {
        Channel ch = channel;
        if (ch == null) {
            return;
        }

        if (handshakeComplete && ch.isActive()) {
            closeCode = CLOSE_NORMAL;
            ch.writeAndFlush(new CloseWebSocketFrame(CLOSE_NORMAL, "client closing"))
                    .addListener(ChannelFutureListener.CLOSE);
            return;
        }

        ChannelFuture pendingConnect = connectFuture;
        if (pendingConnect != null && !pendingConnect.isDone()) {
            pendingConnect.cancel(false);
        }
        ch.close();
    }

    @Override
    public boolean isOpen()
    {
        Channel ch = channel;
        return handshakeComplete && ch != null && ch.isActive() && !closeReported.get();
    }

    URI uri()
    {
        return uri;
    }

    static int portOf(URI uri)
    {
        int port = uri.getPort();
        if (port != -1) {
            return port;
        }
        return "wss".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    private void reportError(Throwable cause)
    {
        if (!closeReported.get()) {
            listener.onError(cause);
        }
    }

    private void reportClose(int code, String reason)
    {
        if (closeReported.compareAndSet(false, true)) {
            handshakeComplete = false;
            listener.onClose(code, reason == null ? "" : reason);
        }
    }

    /**
     * ClientHandler
     * -------------------------------------------------------------------------
     * Completes the opening handshake, then forwards text frames to the port
     * listener and answers control frames.
     */
    private final class ClientHandler extends SimpleChannelInboundHandler<Object>
    {
        private final WebSocketClientHandshaker handshaker;
        private ScheduledFuture<?> upgradeDeadline;

        private ClientHandler(WebSocketClientHandshaker handshaker)
        {
            this.handshaker = handshaker;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            handshaker.handshake(ctx.channel());
            upgradeDeadline = ctx.executor().schedule(() -> {
                if (!handshaker.isHandshakeComplete() && ctx.channel().isActive()) {
                    reportError(new TransportException("WebSocket upgrade with " + uri
                            + " timed out after " + connectTimeoutMillis + " ms"));
                    ctx.close();
                }
            }, connectTimeoutMillis, TimeUnit.MILLISECONDS);
        }

        private void cancelUpgradeDeadline()
        {
            if (upgradeDeadline != null) {
                upgradeDeadline.cancel(false);
                upgradeDeadline = null;
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg)
        {
            Channel ch = ctx.channel();

            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse response) {
                    cancelUpgradeDeadline();
                    try {
                        handshaker.finishHandshake(ch, response);
                    } catch (WebSocketHandshakeException e) {
                        reportError(new TransportException("WebSocket handshake with " + uri + " rejected", e));
                        ctx.close();
                        return;
                    }
                    handshakeComplete = true;
                    listener.onOpen();
                }
                return;
            }

            if (msg instanceof FullHttpResponse response) {
                throw new IllegalStateException("Unexpected HTTP response after handshake (status=" + response.status() + ")");
            }

            if (!(msg instanceof WebSocketFrame)) {
                return;
            }

            if (msg instanceof TextWebSocketFrame text) {
                listener.onText(text.text());
            }
            else if (msg instanceof PingWebSocketFrame ping) {
                ch.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            }
            else if (msg instanceof CloseWebSocketFrame closeFrame) {
                int status = closeFrame.statusCode();
                closeCode = status == -1 ? CLOSE_NO_STATUS : status;
                closeReason = closeFrame.reasonText();
                handshaker.close(ch, closeFrame.retainedDuplicate());
            }
            // Pong and binary frames carry nothing for this client.
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            cancelUpgradeDeadline();
            reportClose(closeCode, closeReason);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            reportError(new TransportException("WebSocket channel failure on " + uri, cause));
            ctx.close();
        }
    }
}
