package com.questrail.uplink.internal.exec;

import com.questrail.uplink.api.DisconnectedException;
import com.questrail.uplink.internal.exec.OperationQueue.QueuedOperation;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class OperationQueueTest {

    private final OperationQueue queue = new OperationQueue();

    private static QueuedOperation op(String type) {
        return new QueuedOperation(type, null, Duration.ofSeconds(30), new CompletableFuture<>());
    }

    @Test
    void drainReturnsFifoOrderAndEmpties() {
        queue.enqueue(op("a"));
        queue.enqueue(op("b"));
        queue.enqueue(op("c"));

        List<QueuedOperation> drained = queue.drain();

        assertEquals(List.of("a", "b", "c"), drained.stream().map(QueuedOperation::type).toList());
        assertTrue(queue.isEmpty());
        assertTrue(queue.drain().isEmpty());
    }

    @Test
    void rejectAllFailsEveryFuture() {
        QueuedOperation first = op("a");
        QueuedOperation second = op("b");
        queue.enqueue(first);
        queue.enqueue(second);

        assertEquals(2, queue.rejectAll(new DisconnectedException()));

        for (QueuedOperation o : List.of(first, second)) {
            ExecutionException e = assertThrows(ExecutionException.class, o.future()::get);
            assertInstanceOf(DisconnectedException.class, e.getCause());
        }
        assertEquals(0, queue.size());
    }

    @Test
    void operationRequiresTypeAndFuture() {
        assertThrows(NullPointerException.class,
                () -> new QueuedOperation(null, null, Duration.ofSeconds(1), new CompletableFuture<>()));
        assertThrows(NullPointerException.class,
                () -> new QueuedOperation("a", null, Duration.ofSeconds(1), null));
    }
}
