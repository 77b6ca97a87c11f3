package com.questrail.uplink.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.uplink.api.MalformedMessageException;
import com.questrail.uplink.api.UplinkException;
import com.questrail.uplink.api.UplinkMessage;

import java.util.Objects;

/**
 * JsonMessageCodec
 * =============================================================================
 * Jackson implementation of {@link MessageCodec}.
 *
 * <h2>Outbound</h2>
 * <pre>
 *   {"type":"file:open","id":"…","payload":{…},"timestamp":1700000000000}
 * </pre>
 * {@code id} is omitted for uncorrelated messages.
 *
 * <h2>Inbound</h2>
 * <ul>
 *   <li>Text must parse as a JSON object.</li>
 *   <li>{@code id} is taken when it is a string or a number; anything else is ignored.</li>
 *   <li>{@code type} is taken when it is a non-blank string. It may be missing only
 *       when an {@code id} is present, since a response is matched by id alone.</li>
 *   <li>Missing or {@code null} {@code payload} becomes an empty object.</li>
 *   <li>Missing or non-numeric {@code timestamp} becomes 0.</li>
 * </ul>
 */
public final class JsonMessageCodec implements MessageCodec {

    private final ObjectMapper mapper;

    public JsonMessageCodec() {
        this(new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS));
    }

    public JsonMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String encode(String type, String id, Object payload, long timestamp) {
        Objects.requireNonNull(type, "type");

        ObjectNode root = mapper.createObjectNode();
        root.put("type", type);
        if (id != null) {
            root.put("id", id);
        }

        final JsonNode payloadNode;
        try {
            payloadNode = payload == null ? mapper.createObjectNode() : mapper.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            throw new UplinkException("Cannot serialize payload of '" + type + "'", e);
        }
        root.set("payload", payloadNode);
        root.put("timestamp", timestamp);

        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UplinkException("Cannot serialize message '" + type + "'", e);
        }
    }

    @Override
    public UplinkMessage decode(String text) {
        if (text == null) {
            throw new MalformedMessageException("Inbound message is null");
        }

        final JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Inbound message is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException("Inbound message is not a JSON object");
        }

        String id = null;
        JsonNode idNode = root.get("id");
        if (idNode != null && (idNode.isTextual() || idNode.isNumber())) {
            id = idNode.asText();
        }

        String type = null;
        JsonNode typeNode = root.get("type");
        if (typeNode != null && typeNode.isTextual() && !typeNode.asText().isBlank()) {
            type = typeNode.asText();
        }
        if (type == null && id == null) {
            throw new MalformedMessageException("Inbound message has neither type nor id");
        }

        JsonNode payload = root.get("payload");
        if (payload == null || payload.isNull()) {
            payload = mapper.createObjectNode();
        }

        JsonNode timestampNode = root.get("timestamp");
        long timestamp = timestampNode != null && timestampNode.isNumber() ? timestampNode.asLong() : 0L;

        return new UplinkMessage(type, id, payload, timestamp);
    }
}
