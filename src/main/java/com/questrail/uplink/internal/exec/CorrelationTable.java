package com.questrail.uplink.internal.exec;

import com.questrail.uplink.api.RequestTimeoutException;
import com.questrail.uplink.api.UplinkException;
import com.questrail.uplink.api.UplinkMessage;
import com.questrail.uplink.internal.time.Cancellable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CorrelationTable
 * =============================================================================
 * Pending correlated requests, keyed by correlation id.
 *
 * <h2>Lifecycle of an entry</h2>
 * <ul>
 *   <li>Registered when a correlated send is written to an open socket.</li>
 *   <li>Removed by exactly one of: a response with the same id
 *       ({@link #resolve}), its timeout ({@link #expire}), a failed write
 *       ({@link #fail}), or an explicit disconnect ({@link #rejectAll}).</li>
 * </ul>
 *
 * <p>Removal always cancels the entry's timeout handle, so a removed entry has
 * no timer left that could fire against it. An id is never registered twice
 * while pending.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Mutated only from the client's event loop. The backing map is concurrent
 * so {@link #size()} can be read from any thread.</p>
 */
public final class CorrelationTable {

    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    /**
     * A correlated request awaiting its response.
     */
    private record Pending(String messageType,
                           Duration timeout,
                           CompletableFuture<Optional<UplinkMessage>> future,
                           Cancellable timeoutHandle) {
    }

    /**
     * Registers a pending request.
     *
     * @throws IllegalStateException if {@code id} is already pending
     */
    public void register(String id,
                         String messageType,
                         Duration timeout,
                         CompletableFuture<Optional<UplinkMessage>> future,
                         Cancellable timeoutHandle) {
        Objects.requireNonNull(id, "id");
        Pending entry = new Pending(
                Objects.requireNonNull(messageType, "messageType"),
                Objects.requireNonNull(timeout, "timeout"),
                Objects.requireNonNull(future, "future"),
                Objects.requireNonNull(timeoutHandle, "timeoutHandle"));

        if (pending.putIfAbsent(id, entry) != null) {
            timeoutHandle.cancel();
            throw new IllegalStateException("Correlation id already pending: " + id);
        }
    }

    boolean isPending(String id) {
        return id != null && pending.containsKey(id);
    }

    /**
     * Completes the request with {@code response} if {@code id} is pending.
     *
     * @return {@code true} if a pending request consumed the response
     */
    public boolean resolve(String id, UplinkMessage response) {
        if (id == null) {
            return false;
        }
        Pending entry = pending.remove(id);
        if (entry == null) {
            return false;
        }
        entry.timeoutHandle().cancel();
        entry.future().complete(Optional.of(response));
        return true;
    }

    /**
     * Fails the request with a timeout if it is still pending.
     *
     * @return the message type of the expired request, if it was still pending
     */
    public Optional<String> expire(String id) {
        Pending entry = pending.remove(id);
        if (entry == null) {
            return Optional.empty();
        }
        entry.future().completeExceptionally(
                new RequestTimeoutException(entry.messageType(), entry.timeout()));
        return Optional.of(entry.messageType());
    }

    /**
     * Fails a single pending request with {@code error}.
     */
    public boolean fail(String id, UplinkException error) {
        Pending entry = pending.remove(id);
        if (entry == null) {
            return false;
        }
        entry.timeoutHandle().cancel();
        entry.future().completeExceptionally(error);
        return true;
    }

    /**
     * Fails every pending request with {@code error} and empties the table.
     *
     * @return number of requests rejected
     */
    public int rejectAll(UplinkException error) {
        Objects.requireNonNull(error, "error");
        List<Pending> drained = new ArrayList<>();
        for (String id : new ArrayList<>(pending.keySet())) {
            Pending entry = pending.remove(id);
            if (entry != null) {
                drained.add(entry);
            }
        }
        for (Pending entry : drained) {
            entry.timeoutHandle().cancel();
            entry.future().completeExceptionally(error);
        }
        return drained.size();
    }

    public int size() {
        return pending.size();
    }
}
