package com.questrail.uplink;

import com.questrail.uplink.api.ConnectionStatus;
import com.questrail.uplink.api.MessageHandler;
import com.questrail.uplink.api.Subscription;
import com.questrail.uplink.api.UplinkMessage;
import com.questrail.uplink.config.UplinkClientConfig;
import com.questrail.uplink.observability.UplinkErrorEvent;
import com.questrail.uplink.observability.UplinkErrorKind;
import com.questrail.uplink.observability.UplinkObservabilitySink;
import com.questrail.uplink.observability.UplinkProtocolEvent;
import com.questrail.uplink.observability.UplinkStatusTransitionEvent;
import com.questrail.uplink.time.DeterministicScheduler;
import com.questrail.uplink.time.ManualMonotonicClock;
import com.questrail.uplink.transport.FakeSocketEndpoint;
import com.questrail.uplink.transport.FakeSocketEndpointFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UplinkTransportClientDispatchTest {

    private UplinkClientFixture f;
    private FakeSocketEndpoint socket;

    @BeforeEach
    void setUp() {
        f = new UplinkClientFixture();
        socket = f.connectAndOpen();
    }

    @Test
    void handlersRunInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        f.client.on("dashboard:update", m -> calls.add("first"));
        f.client.on("dashboard:update", m -> calls.add("second"));
        f.client.on("coaching:tip", m -> calls.add("other"));

        socket.simulateText("{\"type\":\"dashboard:update\",\"payload\":{\"score\":3},\"timestamp\":5}");

        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void handlerReceivesDecodedMessage() {
        List<UplinkMessage> received = new ArrayList<>();
        f.client.on("hints:update", received::add);

        socket.simulateText("{\"type\":\"hints:update\",\"payload\":{\"level\":2},\"timestamp\":42}");

        UplinkMessage message = received.get(0);
        assertEquals(2, message.payload().get("level").asInt());
        assertEquals(42, message.timestamp());
        assertTrue(message.correlationId().isEmpty());
    }

    @Test
    void throwingHandlerDoesNotStopOthers() {
        List<String> calls = new ArrayList<>();
        f.client.on("plan:changed", m -> { throw new IllegalStateException("handler bug"); });
        f.client.on("plan:changed", m -> calls.add("ok"));

        socket.simulateText("{\"type\":\"plan:changed\",\"payload\":{}}");
        socket.simulateText("{\"type\":\"plan:changed\",\"payload\":{}}");

        assertEquals(List.of("ok", "ok"), calls);
        assertEquals(2, f.sink.getErrors(UplinkErrorKind.HANDLER_FAILURE).size());
        assertEquals(ConnectionStatus.CONNECTED, f.client.status());
    }

    @Test
    void malformedInputIsDropped() {
        List<UplinkMessage> received = new ArrayList<>();
        f.client.on("x", received::add);

        socket.simulateText("not json");
        socket.simulateText("[1,2,3]");
        socket.simulateText("{\"payload\":{}}");

        assertTrue(received.isEmpty());
        assertEquals(3, f.sink.getErrors(UplinkErrorKind.MALFORMED_MESSAGE).size());
        assertEquals(ConnectionStatus.CONNECTED, f.client.status());
    }

    @Test
    void unknownIdIsBroadcast() {
        List<UplinkMessage> received = new ArrayList<>();
        f.client.on("session:event", received::add);

        socket.simulateText("{\"type\":\"session:event\",\"id\":\"never-sent\",\"payload\":{}}");

        assertEquals(1, received.size());
    }

    @Test
    void offRemovesOnlyThatHandler() {
        List<String> calls = new ArrayList<>();
        MessageHandler removed = m -> calls.add("removed");
        f.client.on("tab:focus", removed);
        f.client.on("tab:focus", m -> calls.add("kept"));

        f.client.off("tab:focus", removed);
        socket.simulateText("{\"type\":\"tab:focus\",\"payload\":{}}");

        assertEquals(List.of("kept"), calls);
    }

    @Test
    void handlerMaySendWithoutReentering() {
        List<String> order = new ArrayList<>();
        f.client.on("coaching:tip", m -> {
            f.client.send("coaching:dismiss", null);
            order.add("handler done with " + socket.sent().size() + " frames");
        });

        socket.simulateText("{\"type\":\"coaching:tip\",\"payload\":{}}");

        assertEquals(List.of("handler done with 0 frames"), order);
        assertEquals(List.of("coaching:dismiss"), UplinkClientFixture.types(socket));
    }

    @Test
    void unsubscribeStopsStatusNotifications() {
        List<ConnectionStatus> seen = new ArrayList<>();
        Subscription subscription = f.client.onStatusChange((status, attempt) -> seen.add(status));

        socket.simulateClose();
        subscription.unsubscribe();
        f.advanceMillis(1000);

        assertEquals(List.of(ConnectionStatus.RECONNECTING), seen);
    }

    @Test
    void throwingStatusListenerIsIsolated() {
        List<ConnectionStatus> seen = new ArrayList<>();
        f.client.onStatusChange((status, attempt) -> { throw new IllegalStateException("listener bug"); });
        f.client.onStatusChange((status, attempt) -> seen.add(status));

        f.client.disconnect();

        assertEquals(List.of(ConnectionStatus.DISCONNECTED), seen);
        assertEquals(1, f.sink.getErrors(UplinkErrorKind.LISTENER_FAILURE).size());
        assertEquals(ConnectionStatus.DISCONNECTED, f.client.status());
    }

    @Test
    void failingSinkNeverAltersClientState() {
        UplinkObservabilitySink broken = new UplinkObservabilitySink() {
            @Override
            public void onStatusTransition(UplinkStatusTransitionEvent event) {
                throw new IllegalStateException("sink down");
            }

            @Override
            public void onProtocolEvent(UplinkProtocolEvent event) {
                throw new IllegalStateException("sink down");
            }

            @Override
            public void onError(UplinkErrorEvent event) {
                throw new IllegalStateException("sink down");
            }
        };
        ManualMonotonicClock clock = new ManualMonotonicClock();
        FakeSocketEndpointFactory sockets = new FakeSocketEndpointFactory();
        UplinkTransportClient client = UplinkTransportClient.builder(UplinkClientConfig.defaults())
                .withEndpointFactory(sockets)
                .withScheduler(new DeterministicScheduler(clock))
                .withClock(clock)
                .withObservabilitySink(broken)
                .build();

        client.connect();
        sockets.latest().simulateOpen();
        sockets.latest().simulateText("garbage");

        assertEquals(ConnectionStatus.CONNECTED, client.status());
        assertTrue(client.send("editor:selection", null).isDone());
    }
}
