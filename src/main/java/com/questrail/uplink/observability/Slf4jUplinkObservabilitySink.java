package com.questrail.uplink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of UplinkObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jUplinkObservabilitySink implements UplinkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jUplinkObservabilitySink.class);

    @Override
    public void onStatusTransition(UplinkStatusTransitionEvent event) {
        if (event.reconnectAttempt() > 0) {
            log.info("Uplink status: {} -> {} (attempt {})",
                event.previous(), event.current(), event.reconnectAttempt());
        } else {
            log.info("Uplink status: {} -> {}", event.previous(), event.current());
        }
    }

    @Override
    public void onProtocolEvent(UplinkProtocolEvent event) {
        if (!log.isDebugEnabled()) {
            return;
        }
        if (event.detail() != null) {
            log.debug("Uplink {} type={} id={} {}",
                event.kind(), event.messageType(), event.correlationId(), event.detail());
        } else {
            log.debug("Uplink {} type={} id={}", event.kind(), event.messageType(), event.correlationId());
        }
    }

    @Override
    public void onError(UplinkErrorEvent event) {
        if (event.kind() == UplinkErrorKind.TRANSPORT_ERROR) {
            log.warn("Uplink {}: {}", event.kind(), event.message(), event.cause());
        } else {
            log.error("Uplink {}: {}", event.kind(), event.message(), event.cause());
        }
    }
}
