package com.questrail.uplink.internal.exec;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.questrail.uplink.api.DisconnectedException;
import com.questrail.uplink.api.RequestTimeoutException;
import com.questrail.uplink.api.UplinkMessage;
import com.questrail.uplink.internal.time.Cancellable;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationTableTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final CorrelationTable table = new CorrelationTable();
    private final AtomicInteger cancellations = new AtomicInteger();
    private final Cancellable handle = () -> {
        cancellations.incrementAndGet();
        return true;
    };

    private static UplinkMessage response(String id) {
        return new UplinkMessage("file:content", id, JsonNodeFactory.instance.objectNode(), 0L);
    }

    @Test
    void resolveCompletesAndCancelsTimer() throws Exception {
        CompletableFuture<Optional<UplinkMessage>> future = new CompletableFuture<>();
        table.register("a", "file:open", TIMEOUT, future, handle);

        assertTrue(table.resolve("a", response("a")));

        assertEquals("file:content", future.get().orElseThrow().type());
        assertEquals(1, cancellations.get());
        assertFalse(table.isPending("a"));
        assertFalse(table.resolve("a", response("a")), "second response finds nothing");
    }

    @Test
    void resolveUnknownOrNullIdIsIgnored() {
        assertFalse(table.resolve("missing", response("missing")));
        assertFalse(table.resolve(null, response(null)));
    }

    @Test
    void expireFailsWithTimeoutNamingType() {
        CompletableFuture<Optional<UplinkMessage>> future = new CompletableFuture<>();
        table.register("a", "file:open", TIMEOUT, future, handle);

        assertEquals(Optional.of("file:open"), table.expire("a"));
        assertEquals(Optional.empty(), table.expire("a"));

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(RequestTimeoutException.class, e.getCause());
        assertEquals("Request timed out after 30000ms: file:open", e.getCause().getMessage());
        assertEquals(0, table.size());
    }

    @Test
    void duplicateIdIsRejectedAndItsTimerCancelled() {
        table.register("a", "x", TIMEOUT, new CompletableFuture<>(), Cancellable.NONE);

        assertThrows(IllegalStateException.class,
                () -> table.register("a", "y", TIMEOUT, new CompletableFuture<>(), handle));
        assertEquals(1, cancellations.get());
        assertEquals(1, table.size());
    }

    @Test
    void failSettlesOnlyThatRequest() {
        CompletableFuture<Optional<UplinkMessage>> failed = new CompletableFuture<>();
        CompletableFuture<Optional<UplinkMessage>> other = new CompletableFuture<>();
        table.register("a", "x", TIMEOUT, failed, handle);
        table.register("b", "y", TIMEOUT, other, Cancellable.NONE);

        assertTrue(table.fail("a", new DisconnectedException()));

        assertTrue(failed.isCompletedExceptionally());
        assertFalse(other.isDone());
        assertEquals(1, table.size());
    }

    @Test
    void rejectAllEmptiesTable() {
        CompletableFuture<Optional<UplinkMessage>> a = new CompletableFuture<>();
        CompletableFuture<Optional<UplinkMessage>> b = new CompletableFuture<>();
        table.register("a", "x", TIMEOUT, a, handle);
        table.register("b", "y", TIMEOUT, b, handle);

        assertEquals(2, table.rejectAll(new DisconnectedException()));

        assertTrue(a.isCompletedExceptionally());
        assertTrue(b.isCompletedExceptionally());
        assertEquals(2, cancellations.get());
        assertEquals(0, table.size());
        assertEquals(0, table.rejectAll(new DisconnectedException()));
    }
}
