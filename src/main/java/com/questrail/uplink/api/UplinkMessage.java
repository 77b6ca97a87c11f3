package com.questrail.uplink.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * UplinkMessage
 * =============================================================================
 * Decoded wire envelope shared by both directions:
 *
 * <pre>
 *   { "type": string, "id"?: string, "payload": object, "timestamp": number }
 * </pre>
 *
 * <p>{@code id} is present only on correlated requests and their matching
 * responses. Inbound messages whose id is absent or unknown are routed to
 * broadcast handlers. A response settles its request by id alone, so an
 * inbound message carrying an id may lack a type.</p>
 *
 * <p>The payload is kept as a Jackson tree so that collaborators can bind it
 * to their own types with {@link #payloadAs(Class)}.</p>
 *
 * @param type      message type; never blank, {@code null} only when {@code id} is set
 * @param id        correlation id, or {@code null}
 * @param payload   payload tree, never {@code null} (an empty object when absent on the wire)
 * @param timestamp sender wall-clock time in epoch milliseconds (observational only)
 */
public record UplinkMessage(String type, String id, JsonNode payload, long timestamp)
{
    private static final ObjectMapper PAYLOAD_MAPPER = new ObjectMapper();

    public UplinkMessage {
        if (type == null && id == null) {
            throw new NullPointerException("type");
        }
        if (type != null && type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        if (payload == null) {
            payload = JsonNodeFactory.instance.objectNode();
        }
    }

    /**
     * Returns the message type; empty only for an untyped response.
     */
    public Optional<String> messageType() {
        return Optional.ofNullable(type);
    }

    /**
     * Returns the correlation id, if this message carries one.
     */
    public Optional<String> correlationId() {
        return Optional.ofNullable(id);
    }

    /**
     * Binds the payload to the given type.
     *
     * @throws MalformedMessageException if the payload does not fit the type
     */
    public <T> T payloadAs(Class<T> target) {
        Objects.requireNonNull(target, "target");
        try {
            return PAYLOAD_MAPPER.treeToValue(payload, target);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedMessageException(
                    "Payload of '" + type + "' cannot be read as " + target.getSimpleName(), e);
        }
    }
}
