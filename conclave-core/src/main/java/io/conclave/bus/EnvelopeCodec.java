package io.conclave.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * JSON wire format of a {@link MessageEnvelope}.
 *
 * <pre>{@code
 * {
 *   "message_id": "01J9...",
 *   "timestamp": "2024-05-01T10:15:30.120Z",
 *   "source_role": "hub",
 *   "exchange": "agent.activities",
 *   "routing_key": "hub.activity.user_prompt",
 *   "data": { ... }
 * }
 * }</pre>
 */
public final class EnvelopeCodec {
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Encodes an envelope as UTF-8 JSON.
     *
     * @param envelope the envelope
     * @return the encoded body
     * @throws IllegalArgumentException if the payload cannot be serialized
     */
    public byte[] encode(MessageEnvelope envelope) {
        ObjectNode root = mapper.createObjectNode();
        root.put("message_id", envelope.messageId());
        root.put("timestamp", envelope.timestamp().toString());
        root.put("source_role", envelope.sourceRole());
        root.put("exchange", envelope.exchange());
        root.put("routing_key", envelope.routingKey());
        root.set("data", mapper.valueToTree(envelope.payload()));
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode envelope " + envelope.messageId(), e);
        }
    }

    /**
     * Decodes a message body.
     *
     * @param body the raw body
     * @return the decoded envelope
     * @throws IllegalArgumentException if the body is not a valid envelope
     */
    public MessageEnvelope decode(byte[] body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new IllegalArgumentException("Message body is not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Expected JSON object");
        }
        String routingKey = root.path("routing_key").asText("");
        if (routingKey.isEmpty()) {
            throw new IllegalArgumentException("Missing routing_key");
        }
        MessageEnvelope.Builder builder = MessageEnvelope.builder(routingKey)
                .exchange(root.path("exchange").asText(""))
                .sourceRole(root.hasNonNull("source_role") ? root.get("source_role").asText() : null);
        if (root.hasNonNull("message_id")) {
            builder.messageId(root.get("message_id").asText());
        }
        if (root.hasNonNull("timestamp")) {
            try {
                builder.timestamp(Instant.parse(root.get("timestamp").asText()));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid timestamp", e);
            }
        }
        JsonNode data = root.get("data");
        if (data != null && data.isObject()) {
            builder.payload(mapper.convertValue(data, PAYLOAD_TYPE));
        }
        return builder.build();
    }
}
