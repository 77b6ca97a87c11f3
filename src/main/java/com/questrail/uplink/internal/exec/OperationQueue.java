package com.questrail.uplink.internal.exec;

import com.questrail.uplink.api.UplinkException;
import com.questrail.uplink.api.UplinkMessage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * OperationQueue
 * =============================================================================
 * FIFO buffer of sends issued while the client was not connected.
 *
 * <ul>
 *   <li>Unbounded; backpressure is the caller's concern.</li>
 *   <li>{@link #drain()} hands every entry back exactly once, in call order, and
 *       leaves the queue empty.</li>
 *   <li>{@link #rejectAll(UplinkException)} settles every remaining entry with an
 *       error.</li>
 * </ul>
 *
 * <p>Mutated only from the client's event loop.</p>
 */
public final class OperationQueue {

    /**
     * A deferred send and the future its caller is holding.
     */
    public record QueuedOperation(String type,
                                  Object payload,
                                  Duration timeout,
                                  CompletableFuture<Optional<UplinkMessage>> future) {
        public QueuedOperation {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(timeout, "timeout");
            Objects.requireNonNull(future, "future");
        }
    }

    private final Queue<QueuedOperation> operations = new ConcurrentLinkedQueue<>();

    public void enqueue(QueuedOperation operation) {
        operations.add(Objects.requireNonNull(operation, "operation"));
    }

    /**
     * Removes and returns every queued operation, oldest first.
     */
    public List<QueuedOperation> drain() {
        List<QueuedOperation> drained = new ArrayList<>(operations.size());
        QueuedOperation next;
        while ((next = operations.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    /**
     * Fails every queued operation with {@code error}.
     *
     * @return number of operations rejected
     */
    public int rejectAll(UplinkException error) {
        Objects.requireNonNull(error, "error");
        List<QueuedOperation> drained = drain();
        for (QueuedOperation op : drained) {
            op.future().completeExceptionally(error);
        }
        return drained.size();
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
