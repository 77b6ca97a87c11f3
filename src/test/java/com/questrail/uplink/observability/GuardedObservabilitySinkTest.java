package com.questrail.uplink.observability;

import com.questrail.uplink.api.ConnectionStatus;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class GuardedObservabilitySinkTest {

    @Test
    void forwardsEvents() {
        RecordingObservabilitySink recording = new RecordingObservabilitySink();
        UplinkObservabilitySink guarded = GuardedObservabilitySink.wrap(recording);

        guarded.onStatusTransition(new UplinkStatusTransitionEvent(
                Instant.EPOCH, ConnectionStatus.DISCONNECTED, ConnectionStatus.CONNECTING, 0));
        guarded.onError(new UplinkErrorEvent(Instant.EPOCH, UplinkErrorKind.TRANSPORT_ERROR, "x", null));

        assertEquals(2, recording.getAllEvents().size());
    }

    @Test
    void swallowsSinkFailures() {
        UplinkObservabilitySink throwing = new UplinkObservabilitySink() {
            @Override
            public void onStatusTransition(UplinkStatusTransitionEvent event) {
                throw new IllegalStateException();
            }

            @Override
            public void onProtocolEvent(UplinkProtocolEvent event) {
                throw new IllegalStateException();
            }

            @Override
            public void onError(UplinkErrorEvent event) {
                throw new IllegalStateException();
            }
        };
        UplinkObservabilitySink guarded = GuardedObservabilitySink.wrap(throwing);

        assertDoesNotThrow(() -> guarded.onProtocolEvent(
                UplinkProtocolEvent.of(Instant.EPOCH, UplinkProtocolEvent.Kind.SENT, "t", null)));
        assertDoesNotThrow(() -> guarded.onError(
                new UplinkErrorEvent(Instant.EPOCH, UplinkErrorKind.SEND_FAILURE, "x", null)));
    }

    @Test
    void doesNotDoubleWrap() {
        UplinkObservabilitySink once = GuardedObservabilitySink.wrap(new RecordingObservabilitySink());

        assertSame(once, GuardedObservabilitySink.wrap(once));
        assertSame(NullObservabilitySink.INSTANCE, GuardedObservabilitySink.wrap(NullObservabilitySink.INSTANCE));
    }

    @Test
    void slf4jSinkHandlesEveryEventShape() {
        Slf4jUplinkObservabilitySink sink = new Slf4jUplinkObservabilitySink();

        assertDoesNotThrow(() -> {
            sink.onStatusTransition(new UplinkStatusTransitionEvent(
                    Instant.EPOCH, ConnectionStatus.CONNECTED, ConnectionStatus.RECONNECTING, 1));
            sink.onProtocolEvent(new UplinkProtocolEvent(
                    Instant.EPOCH, UplinkProtocolEvent.Kind.RECONNECT_SCHEDULED, null, null, "attempt=1 delayMs=1000"));
            sink.onProtocolEvent(UplinkProtocolEvent.of(Instant.EPOCH, UplinkProtocolEvent.Kind.SENT, "t", "id"));
            sink.onError(new UplinkErrorEvent(Instant.EPOCH, UplinkErrorKind.TRANSPORT_ERROR, "down", new RuntimeException()));
            sink.onError(new UplinkErrorEvent(Instant.EPOCH, UplinkErrorKind.HANDLER_FAILURE, "bug", null));
        });
    }
}
