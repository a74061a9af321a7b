package com.example.gamesession.event;

import com.example.gamesession.engine.GameAction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON codec for the WebSocket frames.
 * Outbound: {@link OutboundEvent} with a {@code type} discriminator.
 * Inbound client frames: {@code {"type":"clientReady"}}, {@code {"type":"leaveSession"}},
 * {@code {"type":"submitAction","action":{"type":"...","params":{...}}}}.
 */
@Component
public class EventCodec {

    private static final TypeReference<Map<String, Object>> PARAMS = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    /** Default ctor for tests (no Spring context). */
    public EventCodec() {
        this(JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build());
    }

    /** Spring-injected mapper (preferred at runtime). */
    @Autowired
    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(OutboundEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode " + event.kind().wireName(), e);
        }
    }

    /** Tree form used as the replay payload. */
    public JsonNode toTree(OutboundEvent event) {
        return objectMapper.valueToTree(event);
    }

    public JsonNode toTree(Object payload) {
        return objectMapper.valueToTree(payload);
    }

    /**
     * Decodes a client text frame; identity comes from the connection, never from the frame.
     *
     * @throws IllegalArgumentException for malformed JSON or an unknown/transport-only type
     */
    public InboundEvent decodeClientFrame(String text, String sessionId, String participantId) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed frame: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("frame is not a JSON object");
        }
        String type = root.path("type").asText(null);
        InboundKind kind = InboundKind.fromClientFrame(type)
                .orElseThrow(() -> new IllegalArgumentException("unknown frame type: " + type));

        switch (kind) {
            case CLIENT_READY:
                return new InboundEvent.ClientReady(sessionId, participantId);
            case LEAVE_SESSION:
                return new InboundEvent.LeaveSession(sessionId, participantId);
            case SUBMIT_ACTION:
                return new InboundEvent.SubmitAction(sessionId, participantId, readAction(root.path("action")));
            default:
                throw new IllegalArgumentException("not a client frame: " + kind.wireName());
        }
    }

    private GameAction readAction(JsonNode node) {
        String type = node.path("type").asText("");
        if (type.isBlank()) throw new IllegalArgumentException("submitAction without action.type");
        Map<String, Object> params = node.has("params")
                ? objectMapper.convertValue(node.get("params"), PARAMS)
                : Map.of();
        return new GameAction(type, params);
    }
}
