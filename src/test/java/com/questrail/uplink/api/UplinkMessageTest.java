package com.questrail.uplink.api;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UplinkMessageTest {

    public record FileContent(String path, String text) { }

    @Test
    void payloadBindsToCallerType() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("path", "/a.ts").put("text", "hello");
        UplinkMessage message = new UplinkMessage("file:content", "r-1", payload, 0L);

        FileContent content = message.payloadAs(FileContent.class);

        assertEquals("/a.ts", content.path());
        assertEquals("hello", content.text());
    }

    @Test
    void payloadThatDoesNotFitIsMalformed() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("path", "/a.ts").put("unexpected", 1);
        UplinkMessage message = new UplinkMessage("file:content", null, payload, 0L);

        assertThrows(MalformedMessageException.class, () -> message.payloadAs(FileContent.class));
    }

    @Test
    void nullPayloadBecomesEmptyObject() {
        UplinkMessage message = new UplinkMessage("t", null, null, 0L);

        assertTrue(message.payload().isObject());
        assertTrue(message.correlationId().isEmpty());
    }

    @Test
    void blankTypeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new UplinkMessage(" ", null, null, 0L));
    }

    @Test
    void typeMayBeMissingOnlyWhenIdIsPresent() {
        assertEquals("r-2", new UplinkMessage(null, "r-2", null, 0L).id());
        assertThrows(NullPointerException.class, () -> new UplinkMessage(null, null, null, 0L));
    }

    @Test
    void statusLabelsAreLowerCase() {
        assertEquals("reconnecting", ConnectionStatus.RECONNECTING.toString());
        assertEquals("disconnected", ConnectionStatus.DISCONNECTED.label());
    }
}
