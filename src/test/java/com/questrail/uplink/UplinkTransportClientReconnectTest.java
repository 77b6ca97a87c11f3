package com.questrail.uplink;

import com.questrail.uplink.api.ConnectionStatus;
import com.questrail.uplink.observability.UplinkProtocolEvent;
import com.questrail.uplink.transport.FakeSocketEndpoint;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UplinkTransportClientReconnectTest {

    private static final long[] EXPECTED_DELAYS_MS = {1000, 2000, 4000, 8000, 16000, 30000, 30000, 30000};

    private UplinkClientFixture f;

    @BeforeEach
    void setUp() {
        f = new UplinkClientFixture();
    }

    @Test
    void unexpectedCloseSchedulesRetryAfterFirstDelay() {
        FakeSocketEndpoint socket = f.connectAndOpen();

        socket.simulateClose();

        assertEquals(ConnectionStatus.RECONNECTING, f.client.status());
        assertEquals(1, f.client.reconnectAttempt());

        f.advanceMillis(999);
        assertEquals(1, f.sockets.createdCount());

        f.advanceMillis(1);
        assertEquals(2, f.sockets.createdCount());
        assertEquals(ConnectionStatus.CONNECTING, f.client.status());
        assertEquals(1, f.client.reconnectAttempt(), "counter holds until an open succeeds");
    }

    @Test
    void delaysFollowTheTableAndCapAtThirtySeconds() {
        f.connectAndOpen().simulateClose();

        for (int attempt = 1; attempt <= EXPECTED_DELAYS_MS.length; attempt++) {
            assertEquals(attempt, f.client.reconnectAttempt());
            long delay = EXPECTED_DELAYS_MS[attempt - 1];

            f.advanceMillis(delay - 1);
            assertEquals(attempt, f.sockets.createdCount(), "retry " + attempt + " fired early");

            f.advanceMillis(1);
            assertEquals(attempt + 1, f.sockets.createdCount(), "retry " + attempt + " did not fire");

            // The retry never reaches open.
            f.sockets.latest().simulateClose();
        }
    }

    @Test
    void secondCloseBeforeRetryUsesSecondDelay() {
        FakeSocketEndpoint socket = f.connectAndOpen();

        socket.simulateClose();
        socket.simulateClose();

        assertEquals(2, f.client.reconnectAttempt());
        assertEquals(1, f.scheduler.liveTaskCount(), "first retry is replaced, not stacked");

        f.advanceMillis(1000);
        assertEquals(1, f.sockets.createdCount());

        f.advanceMillis(1000);
        assertEquals(2, f.sockets.createdCount());
    }

    @Test
    void successfulOpenResetsTheSchedule() {
        f.connectAndOpen().simulateClose();
        f.advanceMillis(1000);
        f.sockets.latest().simulateClose();
        assertEquals(2, f.client.reconnectAttempt());

        f.advanceMillis(2000);
        f.sockets.latest().simulateOpen();
        assertEquals(0, f.client.reconnectAttempt());
        assertEquals(ConnectionStatus.CONNECTED, f.client.status());

        f.sockets.latest().simulateClose();
        assertEquals(1, f.client.reconnectAttempt());
        f.advanceMillis(1000);
        assertEquals(4, f.sockets.createdCount());
    }

    @Test
    void statusFollowsTheReconnectCycle() {
        f.connectAndOpen().simulateClose();
        f.advanceMillis(1000);
        f.sockets.latest().simulateOpen();

        assertEquals(List.of(
                ConnectionStatus.CONNECTING,
                ConnectionStatus.CONNECTED,
                ConnectionStatus.RECONNECTING,
                ConnectionStatus.CONNECTING,
                ConnectionStatus.CONNECTED), f.statuses);
        assertEquals(List.of(0, 0, 1, 1, 0), f.attempts);
    }

    @Test
    void closeBeforeOpenAlsoRetries() {
        f.client.connect();
        f.sockets.latest().simulateClose();

        assertEquals(ConnectionStatus.RECONNECTING, f.client.status());
        assertEquals(1, f.client.reconnectAttempt());
    }

    @Test
    void disconnectCancelsScheduledRetry() {
        f.connectAndOpen().simulateClose();

        f.client.disconnect();
        f.advanceMillis(120_000);

        assertEquals(ConnectionStatus.DISCONNECTED, f.client.status());
        assertEquals(0, f.client.reconnectAttempt());
        assertEquals(1, f.sockets.createdCount());
    }

    @Test
    void explicitConnectWhileReconnectingSkipsTheWait() {
        f.connectAndOpen().simulateClose();

        f.client.connect();
        assertEquals(2, f.sockets.createdCount());
        assertEquals(ConnectionStatus.CONNECTING, f.client.status());

        f.advanceMillis(1000);
        assertEquals(2, f.sockets.createdCount(), "cancelled retry must not open another socket");
    }

    @Test
    void reconnectSchedulingIsReported() {
        f.connectAndOpen().simulateClose();

        var scheduled = f.sink.getProtocolEvents(UplinkProtocolEvent.Kind.RECONNECT_SCHEDULED);
        assertEquals(1, scheduled.size());
        assertEquals("attempt=1 delayMs=1000", scheduled.get(0).detail());
    }
}
