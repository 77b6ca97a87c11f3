package com.questrail.uplink;

import com.questrail.uplink.api.ConnectionStatus;
import com.questrail.uplink.api.DisconnectedException;
import com.questrail.uplink.api.MalformedMessageException;
import com.questrail.uplink.api.MessageHandler;
import com.questrail.uplink.api.StatusListener;
import com.questrail.uplink.api.Subscription;
import com.questrail.uplink.api.TransportException;
import com.questrail.uplink.api.UplinkClient;
import com.questrail.uplink.api.UplinkException;
import com.questrail.uplink.api.UplinkMessage;
import com.questrail.uplink.codec.JsonMessageCodec;
import com.questrail.uplink.codec.MessageCodec;
import com.questrail.uplink.config.UplinkClientConfig;
import com.questrail.uplink.handshake.ClientHello;
import com.questrail.uplink.handshake.DefaultHandshakeProvider;
import com.questrail.uplink.handshake.HandshakeProvider;
import com.questrail.uplink.internal.exec.CorrelationIdGenerator;
import com.questrail.uplink.internal.exec.CorrelationTable;
import com.questrail.uplink.internal.exec.HandlerRegistry;
import com.questrail.uplink.internal.exec.OperationQueue;
import com.questrail.uplink.internal.exec.OperationQueue.QueuedOperation;
import com.questrail.uplink.internal.exec.ReconnectBackoff;
import com.questrail.uplink.internal.exec.SerialEventLoop;
import com.questrail.uplink.internal.time.Cancellable;
import com.questrail.uplink.internal.time.MonotonicClock;
import com.questrail.uplink.internal.time.MonotonicScheduler;
import com.questrail.uplink.internal.time.SystemMonotonicClock;
import com.questrail.uplink.internal.time.SystemWallClock;
import com.questrail.uplink.internal.time.WallClock;
import com.questrail.uplink.observability.GuardedObservabilitySink;
import com.questrail.uplink.observability.NullObservabilitySink;
import com.questrail.uplink.observability.UplinkErrorEvent;
import com.questrail.uplink.observability.UplinkErrorKind;
import com.questrail.uplink.observability.UplinkObservabilitySink;
import com.questrail.uplink.observability.UplinkProtocolEvent;
import com.questrail.uplink.observability.UplinkStatusTransitionEvent;
import com.questrail.uplink.transport.SocketEndpoint;
import com.questrail.uplink.transport.SocketEndpointFactory;
import com.questrail.uplink.transport.SocketEndpointListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * UplinkTransportClient
 * =============================================================================
 * Default {@link UplinkClient}: one WebSocket at a time, correlated requests,
 * an offline queue and capped reconnect backoff.
 *
 * <h2>Execution Model</h2>
 * Every state change runs as a task on a {@link SerialEventLoop}. Public
 * methods, socket callbacks and timer callbacks only submit tasks:
 *
 * <pre>
 *   caller ──connect/send/disconnect──┐
 *   socket ──open/text/close/error────┼─→ SerialEventLoop → client state
 *   timers ──timeout/reconnect────────┘
 * </pre>
 *
 * <p>A caller that submits into an idle loop runs its task before returning,
 * so {@code connect()} has already moved to {@link ConnectionStatus#CONNECTING}
 * when it returns. A handler that calls back into the client has its call
 * appended behind the dispatch in progress.</p>
 *
 * <h2>State Machine</h2>
 * <pre>
 *   DISCONNECTED ──connect──→ CONNECTING ──open──→ CONNECTED
 *        ↑                        ↑                    │
 *        │                        │ timer              │ unexpected close
 *   disconnect (any state)    RECONNECTING ←───────────┘
 * </pre>
 *
 * <h2>Stale Sockets</h2>
 * Events are honoured only from the socket created by the most recent
 * connection attempt. After {@link #disconnect()} no socket is current, so a
 * late close from the torn-down socket cannot schedule a reconnect.
 *
 * <h2>Timers</h2>
 * Correlation timeouts are cancelled when their entry leaves the
 * {@link CorrelationTable}. The reconnect timer carries a generation number;
 * a timer that fires after it was superseded or cancelled does nothing.
 */
public final class UplinkTransportClient implements UplinkClient
{
    private static final Logger log = LoggerFactory.getLogger(UplinkTransportClient.class);

    private final UplinkClientConfig config;
    private final SocketEndpointFactory endpointFactory;
    private final MessageCodec codec;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final UplinkObservabilitySink sink;
    private final HandshakeProvider handshakeProvider;
    private final CorrelationIdGenerator idGenerator;

    private final SerialEventLoop loop;
    private final CorrelationTable correlations = new CorrelationTable();
    private final OperationQueue queue = new OperationQueue();
    private final ReconnectBackoff backoff;
    private final HandlerRegistry handlers = new HandlerRegistry();
    private final Set<StatusListener> statusListeners = new CopyOnWriteArraySet<>();

    private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;

    // Event-loop confined.
    private SocketEndpoint endpoint;
    private EndpointEvents currentEvents;
    private Cancellable reconnectTimer = Cancellable.NONE;
    private long reconnectGeneration;

    private UplinkTransportClient(Builder b)
    {
        this.config = b.config;
        this.endpointFactory = Objects.requireNonNull(b.endpointFactory, "endpointFactory");
        this.scheduler = Objects.requireNonNull(b.scheduler, "scheduler");
        this.codec = Objects.requireNonNull(b.codec, "codec");
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");
        this.sink = GuardedObservabilitySink.wrap(b.observabilitySink);
        this.handshakeProvider = b.handshakeProvider != null
                ? b.handshakeProvider
                : new DefaultHandshakeProvider(config.clientVersion());
        this.idGenerator = Objects.requireNonNull(b.idGenerator, "idGenerator");
        this.backoff = new ReconnectBackoff(config.timingPolicy());
        this.loop = new SerialEventLoop(e -> log.error("Unexpected failure on uplink event loop", e));
    }

    public static Builder builder(UplinkClientConfig config)
    {
        return new Builder(config);
    }

    // -------------------------------------------------------------------------
    // UplinkClient
    // -------------------------------------------------------------------------

    @Override
    public void connect()
    {
        loop.execute(this::doConnect);
    }

    @Override
    public void disconnect()
    {
        loop.execute(this::doDisconnect);
    }

    @Override
    public CompletableFuture<Optional<UplinkMessage>> send(String type, Object payload)
    {
        return send(type, payload, config.timingPolicy().correlationTimeout());
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if {@code type} is blank or {@code timeout} is not positive
     */
    @Override
    public CompletableFuture<Optional<UplinkMessage>> send(String type, Object payload, Duration timeout)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timeout, "timeout");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }

        CompletableFuture<Optional<UplinkMessage>> future = new CompletableFuture<>();
        loop.execute(() -> doSend(type, payload, timeout, future));
        return future;
    }

    @Override
    public void on(String type, MessageHandler handler)
    {
        handlers.add(type, handler);
    }

    @Override
    public void off(String type, MessageHandler handler)
    {
        handlers.remove(type, handler);
    }

    @Override
    public Subscription onStatusChange(StatusListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        statusListeners.add(listener);
        return () -> statusListeners.remove(listener);
    }

    @Override
    public ConnectionStatus status()
    {
        return status;
    }

    @Override
    public int reconnectAttempt()
    {
        return backoff.attempts();
    }

    /** Correlated requests awaiting a response. */
    public int pendingRequestCount()
    {
        return correlations.size();
    }

    /** Sends buffered until the next successful open. */
    public int queuedOperationCount()
    {
        return queue.size();
    }

    public UplinkClientConfig config()
    {
        return config;
    }

    // -------------------------------------------------------------------------
    // Lifecycle (event loop)
    // -------------------------------------------------------------------------

    private void doConnect()
    {
        if (endpoint != null
                && (status == ConnectionStatus.CONNECTING || status == ConnectionStatus.CONNECTED)) {
            return;
        }

        cancelReconnectTimer();
        setStatus(ConnectionStatus.CONNECTING);

        EndpointEvents events = new EndpointEvents();
        currentEvents = events;
        try {
            endpoint = endpointFactory.create(config.serverUri(), events);
            endpoint.open();
        } catch (RuntimeException e) {
            reportError(UplinkErrorKind.TRANSPORT_ERROR, "Cannot open socket to " + config.serverUri(), e);
            handleClose();
        }
    }

    private void doDisconnect()
    {
        cancelReconnectTimer();
        backoff.reset();

        currentEvents = null;
        SocketEndpoint closing = endpoint;
        endpoint = null;

        int rejectedPending = correlations.rejectAll(new DisconnectedException());
        int rejectedQueued = queue.rejectAll(new DisconnectedException());
        if (rejectedPending + rejectedQueued > 0) {
            log.debug("Disconnect rejected {} pending and {} queued requests", rejectedPending, rejectedQueued);
        }

        if (closing != null) {
            try {
                closing.close();
            } catch (RuntimeException e) {
                reportError(UplinkErrorKind.TRANSPORT_ERROR, "Socket close failed", e);
            }
        }

        setStatus(ConnectionStatus.DISCONNECTED);
    }

    private void handleOpen()
    {
        backoff.reset();
        setStatus(ConnectionStatus.CONNECTED);
        sendHandshake();
        flushQueue();
    }

    private void handleText(String text)
    {
        final UplinkMessage message;
        try {
            message = codec.decode(text);
        } catch (MalformedMessageException e) {
            reportError(UplinkErrorKind.MALFORMED_MESSAGE, "Dropped malformed inbound frame", e);
            return;
        }

        String id = message.id();
        if (id != null && correlations.resolve(id, message)) {
            protocolEvent(UplinkProtocolEvent.Kind.RESPONSE, message.type(), id, null);
            return;
        }

        if (message.type() == null) {
            reportError(UplinkErrorKind.MALFORMED_MESSAGE,
                    "Dropped untyped frame with unknown id " + id, null);
            return;
        }

        for (MessageHandler handler : handlers.handlersFor(message.type())) {
            try {
                handler.onMessage(message);
            } catch (RuntimeException e) {
                reportError(UplinkErrorKind.HANDLER_FAILURE, "Handler for " + message.type() + " failed", e);
            }
        }
    }

    private void handleClose()
    {
        endpoint = null;
        if (status == ConnectionStatus.DISCONNECTED) {
            return;
        }
        scheduleReconnect();
    }

    private void scheduleReconnect()
    {
        cancelReconnectTimer();

        int attempt = backoff.recordAttempt();
        Duration delay = backoff.delayFor(attempt);
        setStatus(ConnectionStatus.RECONNECTING);

        final long generation = reconnectGeneration;
        reconnectTimer = scheduler.scheduleAfter(delay, clock, () -> loop.execute(() -> {
            if (generation != reconnectGeneration) {
                return;
            }
            reconnectTimer = Cancellable.NONE;
            doConnect();
        }));
        protocolEvent(UplinkProtocolEvent.Kind.RECONNECT_SCHEDULED, null, null,
                "attempt=" + attempt + " delayMs=" + delay.toMillis());
    }

    private void cancelReconnectTimer()
    {
        reconnectGeneration++;
        reconnectTimer.cancel();
        reconnectTimer = Cancellable.NONE;
    }

    private void setStatus(ConnectionStatus next)
    {
        ConnectionStatus previous = status;
        if (previous == next) {
            return;
        }
        status = next;
        int attempt = backoff.attempts();

        sink.onStatusTransition(new UplinkStatusTransitionEvent(wallClock.now(), previous, next, attempt));

        for (StatusListener listener : statusListeners) {
            try {
                listener.onStatusChange(next, attempt);
            } catch (RuntimeException e) {
                reportError(UplinkErrorKind.LISTENER_FAILURE, "Status listener failed on " + next, e);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Outbound (event loop)
    // -------------------------------------------------------------------------

    private boolean canWrite()
    {
        return status == ConnectionStatus.CONNECTED && endpoint != null && endpoint.isOpen();
    }

    private void doSend(String type,
                        Object payload,
                        Duration timeout,
                        CompletableFuture<Optional<UplinkMessage>> future)
    {
        if (future.isDone()) {
            return;
        }

        if (!canWrite()) {
            queue.enqueue(new QueuedOperation(type, payload, timeout, future));
            protocolEvent(UplinkProtocolEvent.Kind.QUEUED, type, null, null);
            return;
        }

        if (config.isFireAndForget(type)) {
            sendFireAndForget(type, payload, future);
        } else {
            sendCorrelated(type, payload, timeout, future);
        }
    }

    private void sendFireAndForget(String type, Object payload, CompletableFuture<Optional<UplinkMessage>> future)
    {
        final String frame;
        try {
            frame = codec.encode(type, null, payload, wallClock.now().toEpochMilli());
        } catch (UplinkException e) {
            reportError(UplinkErrorKind.SEND_FAILURE, "Cannot encode " + type, e);
            future.completeExceptionally(e);
            return;
        }

        try {
            endpoint.sendText(frame);
        } catch (TransportException e) {
            reportError(UplinkErrorKind.SEND_FAILURE, "Write of " + type + " failed", e);
            future.completeExceptionally(new DisconnectedException(e));
            return;
        }

        protocolEvent(UplinkProtocolEvent.Kind.SENT, type, null, null);
        future.complete(Optional.empty());
    }

    private void sendCorrelated(String type,
                                Object payload,
                                Duration timeout,
                                CompletableFuture<Optional<UplinkMessage>> future)
    {
        final String id = idGenerator.nextId();

        final String frame;
        try {
            frame = codec.encode(type, id, payload, wallClock.now().toEpochMilli());
        } catch (UplinkException e) {
            reportError(UplinkErrorKind.SEND_FAILURE, "Cannot encode " + type, e);
            future.completeExceptionally(e);
            return;
        }

        Cancellable timeoutHandle = scheduler.scheduleAfter(timeout, clock,
                () -> loop.execute(() -> expire(id)));
        try {
            correlations.register(id, type, timeout, future, timeoutHandle);
        } catch (IllegalStateException e) {
            reportError(UplinkErrorKind.SEND_FAILURE, "Correlation id collision for " + type, e);
            future.completeExceptionally(new UplinkException(e.getMessage(), e));
            return;
        }

        try {
            endpoint.sendText(frame);
        } catch (TransportException e) {
            reportError(UplinkErrorKind.SEND_FAILURE, "Write of " + type + " failed", e);
            correlations.fail(id, new DisconnectedException(e));
            return;
        }

        protocolEvent(UplinkProtocolEvent.Kind.SENT, type, id, null);
    }

    private void expire(String id)
    {
        correlations.expire(id).ifPresent(type ->
                protocolEvent(UplinkProtocolEvent.Kind.TIMEOUT, type, id, null));
    }

    private void sendHandshake()
    {
        String type = config.handshakeType();
        try {
            ClientHello hello = handshakeProvider.hello();
            endpoint.sendText(codec.encode(type, null, hello, wallClock.now().toEpochMilli()));
            protocolEvent(UplinkProtocolEvent.Kind.SENT, type, null, null);
        } catch (RuntimeException e) {
            reportError(UplinkErrorKind.HANDSHAKE_FAILURE, "Handshake " + type + " failed", e);
        }
    }

    private void flushQueue()
    {
        List<QueuedOperation> pending = queue.drain();
        if (pending.isEmpty()) {
            return;
        }
        protocolEvent(UplinkProtocolEvent.Kind.FLUSHED, null, null, "count=" + pending.size());
        for (QueuedOperation op : pending) {
            doSend(op.type(), op.payload(), op.timeout(), op.future());
        }
    }

    // -------------------------------------------------------------------------
    // Observability
    // -------------------------------------------------------------------------

    private void protocolEvent(UplinkProtocolEvent.Kind kind, String type, String id, String detail)
    {
        sink.onProtocolEvent(new UplinkProtocolEvent(wallClock.now(), kind, type, id, detail));
    }

    private void reportError(UplinkErrorKind kind, String message, Throwable cause)
    {
        sink.onError(new UplinkErrorEvent(wallClock.now(), kind, message, cause));
    }

    // -------------------------------------------------------------------------
    // Socket events
    // -------------------------------------------------------------------------

    /**
     * One instance per socket. Callbacks hop onto the event loop and are
     * dropped unless this instance still belongs to the current socket.
     */
    private final class EndpointEvents implements SocketEndpointListener
    {
        @Override
        public void onOpen()
        {
            loop.execute(() -> {
                if (currentEvents == this) {
                    handleOpen();
                }
            });
        }

        @Override
        public void onText(String text)
        {
            loop.execute(() -> {
                if (currentEvents == this) {
                    handleText(text);
                }
            });
        }

        @Override
        public void onClose(int code, String reason)
        {
            loop.execute(() -> {
                if (currentEvents == this) {
                    log.debug("Socket closed (code={}, reason={})", code, reason);
                    handleClose();
                }
            });
        }

        @Override
        public void onError(Throwable cause)
        {
            loop.execute(() -> {
                if (currentEvents == this) {
                    reportError(UplinkErrorKind.TRANSPORT_ERROR, "Socket error", cause);
                }
            });
        }
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder
    {
        private final UplinkClientConfig config;
        private SocketEndpointFactory endpointFactory;
        private MonotonicScheduler scheduler;
        private MessageCodec codec = new JsonMessageCodec();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private UplinkObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private HandshakeProvider handshakeProvider;
        private CorrelationIdGenerator idGenerator = CorrelationIdGenerator.randomUuid();

        private Builder(UplinkClientConfig config)
        {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder withEndpointFactory(SocketEndpointFactory endpointFactory)
        {
            this.endpointFactory = endpointFactory;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler)
        {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withCodec(MessageCodec codec)
        {
            this.codec = codec;
            return this;
        }

        public Builder withClock(MonotonicClock clock)
        {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(UplinkObservabilitySink sink)
        {
            this.observabilitySink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withHandshakeProvider(HandshakeProvider handshakeProvider)
        {
            this.handshakeProvider = handshakeProvider;
            return this;
        }

        public Builder withIdGenerator(CorrelationIdGenerator idGenerator)
        {
            this.idGenerator = idGenerator;
            return this;
        }

        public UplinkTransportClient build()
        {
            return new UplinkTransportClient(this);
        }
    }
}
