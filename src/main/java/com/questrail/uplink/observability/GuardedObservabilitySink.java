package com.questrail.uplink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wraps a sink so that its failures are logged and never reach the caller.
 */
public final class GuardedObservabilitySink implements UplinkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(GuardedObservabilitySink.class);

    private final UplinkObservabilitySink delegate;

    private GuardedObservabilitySink(UplinkObservabilitySink delegate) {
        this.delegate = delegate;
    }

    public static UplinkObservabilitySink wrap(UplinkObservabilitySink delegate) {
        Objects.requireNonNull(delegate, "delegate");
        if (delegate instanceof GuardedObservabilitySink || delegate instanceof NullObservabilitySink) {
            return delegate;
        }
        return new GuardedObservabilitySink(delegate);
    }

    @Override
    public void onStatusTransition(UplinkStatusTransitionEvent event) {
        try {
            delegate.onStatusTransition(event);
        } catch (RuntimeException e) {
            log.warn("Observability sink failed on status transition {}", event, e);
        }
    }

    @Override
    public void onProtocolEvent(UplinkProtocolEvent event) {
        try {
            delegate.onProtocolEvent(event);
        } catch (RuntimeException e) {
            log.warn("Observability sink failed on protocol event {}", event, e);
        }
    }

    @Override
    public void onError(UplinkErrorEvent event) {
        try {
            delegate.onError(event);
        } catch (RuntimeException e) {
            log.warn("Observability sink failed on error event {}", event, e);
        }
    }
}
