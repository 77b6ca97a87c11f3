package com.questrail.uplink;

import com.questrail.uplink.api.UplinkClient;
import com.questrail.uplink.codec.JsonMessageCodec;
import com.questrail.uplink.config.UplinkClientConfig;
import com.questrail.uplink.handshake.HandshakeProvider;
import com.questrail.uplink.internal.time.ScheduledExecutorScheduler;
import com.questrail.uplink.internal.time.SystemMonotonicClock;
import com.questrail.uplink.observability.Slf4jUplinkObservabilitySink;
import com.questrail.uplink.observability.UplinkObservabilitySink;
import com.questrail.uplink.transport.netty.NettyWebSocketEndpointFactory;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * UplinkRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a production uplink client.
 *
 * <p>Owns one Netty event loop group and one single-threaded scheduler, and
 * wires them into an {@link UplinkTransportClient}. Closing the runtime
 * disconnects the client before releasing either.</p>
 */
public final class UplinkRuntime implements AutoCloseable {
    private final UplinkTransportClient client;
    private final ScheduledExecutorService schedulerExecutor;
    private final EventLoopGroup eventLoopGroup;

    private UplinkRuntime(UplinkTransportClient client,
                          ScheduledExecutorService schedulerExecutor,
                          EventLoopGroup eventLoopGroup) {
        this.client = client;
        this.schedulerExecutor = schedulerExecutor;
        this.eventLoopGroup = eventLoopGroup;
    }

    public UplinkClient client() {
        return client;
    }

    public UplinkTransportClient transportClient() {
        return client;
    }

    /**
     * Convenience for {@code client().connect()}.
     */
    public void start() {
        client.connect();
    }

    @Override
    public void close() {
        client.disconnect();

        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            eventLoopGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Single daemon thread for request timeouts and reconnect delays. Answered
     * requests cancel their timeout, so cancelled tasks leave the queue at once.
     */
    static ScheduledThreadPoolExecutor newTimerExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "uplink-timer");
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UplinkClientConfig config = UplinkClientConfig.defaults();
        private UplinkObservabilitySink observabilitySink = new Slf4jUplinkObservabilitySink();
        private HandshakeProvider handshakeProvider;
        private int ioThreads = 1;

        public Builder withConfig(UplinkClientConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withObservabilitySink(UplinkObservabilitySink sink) {
            this.observabilitySink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withHandshakeProvider(HandshakeProvider handshakeProvider) {
            this.handshakeProvider = handshakeProvider;
            return this;
        }

        public Builder withIoThreads(int ioThreads) {
            if (ioThreads <= 0) {
                throw new IllegalArgumentException("ioThreads must be positive");
            }
            this.ioThreads = ioThreads;
            return this;
        }

        public UplinkRuntime build() {
            ScheduledThreadPoolExecutor executor = newTimerExecutor();
            EventLoopGroup group = new NioEventLoopGroup(ioThreads);

            UplinkTransportClient.Builder clientBuilder = UplinkTransportClient.builder(config)
                    .withEndpointFactory(new NettyWebSocketEndpointFactory(
                            group, config.maxFramePayloadLength(), config.connectTimeout()))
                    .withScheduler(new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE))
                    .withClock(SystemMonotonicClock.INSTANCE)
                    .withCodec(new JsonMessageCodec())
                    .withObservabilitySink(observabilitySink);
            if (handshakeProvider != null) {
                clientBuilder.withHandshakeProvider(handshakeProvider);
            }

            return new UplinkRuntime(clientBuilder.build(), executor, group);
        }
    }
}
