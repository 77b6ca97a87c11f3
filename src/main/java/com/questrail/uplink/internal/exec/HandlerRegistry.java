package com.questrail.uplink.internal.exec;

import com.questrail.uplink.api.MessageHandler;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Broadcast handlers by message type.
 *
 * <p>Handlers for one type keep insertion order and set semantics. Removing the
 * last handler of a type drops the type's entry. Dispatch works on a snapshot,
 * so a handler may register or remove handlers while being invoked.</p>
 *
 * <p>Registration happens on caller threads, dispatch on the event loop; all
 * access goes through this object's monitor.</p>
 */
public final class HandlerRegistry {

    private final Map<String, Set<MessageHandler>> handlers = new HashMap<>();

    public synchronized void add(String type, MessageHandler handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        handlers.computeIfAbsent(type, t -> new LinkedHashSet<>()).add(handler);
    }

    public synchronized void remove(String type, MessageHandler handler) {
        Set<MessageHandler> existing = handlers.get(type);
        if (existing == null) {
            return;
        }
        existing.remove(handler);
        if (existing.isEmpty()) {
            handlers.remove(type);
        }
    }

    /**
     * Snapshot of the handlers registered for {@code type}, in registration order.
     */
    public synchronized List<MessageHandler> handlersFor(String type) {
        Set<MessageHandler> existing = handlers.get(type);
        return existing == null ? List.of() : List.copyOf(existing);
    }

    synchronized boolean hasHandlers(String type) {
        return handlers.containsKey(type);
    }

    /**
     * Number of message types with at least one handler.
     */
    synchronized int typeCount() {
        return handlers.size();
    }
}
