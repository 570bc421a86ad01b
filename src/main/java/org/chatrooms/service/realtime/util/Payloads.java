package org.chatrooms.service.realtime.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.chatrooms.dto.StoredMessage;
import org.chatrooms.exception.ErrorCode;
import org.chatrooms.exception.InvalidPayloadException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire shapes of the chat socket.
 * Inbound:  {"content": "..."}
 * Outbound: {"id", "chatroom_id", "sender_id", "content", "created_at"}
 * Error:    {"error": "CODE", "detail": "..."}
 */
@Component
public class Payloads {

    private final ObjectMapper objectMapper;

    public Payloads(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Extracts the raw content of an inbound frame. Any other shape is rejected.
     */
    public String readContent(String raw) {
        JsonNode node;
        try {
            node = objectMapper.readTree(raw == null ? "" : raw);
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("Payload is not valid JSON");
        }
        if (node == null || !node.isObject() || node.size() != 1 || !node.has("content")) {
            throw new InvalidPayloadException("Expected a JSON object {\"content\": string}");
        }
        JsonNode content = node.get("content");
        if (!content.isTextual()) {
            throw new InvalidPayloadException("\"content\" must be a string");
        }
        return content.textValue();
    }

    public Map<String, Object> message(StoredMessage m) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", m.getId());
        out.put("chatroom_id", m.getChatroomId());
        out.put("sender_id", m.getSenderId());
        out.put("content", m.getContent());
        out.put("created_at", m.getCreatedAt() != null ? m.getCreatedAt().toString() : null);
        return out;
    }

    /**
     * REST representation: the wire fields plus {@code is_edited}.
     */
    public Map<String, Object> messageResource(StoredMessage m) {
        Map<String, Object> out = message(m);
        out.put("is_edited", m.isEdited());
        return out;
    }

    public TextMessage messageFrame(StoredMessage m) {
        return toFrame(message(m));
    }

    public TextMessage errorFrame(ErrorCode code, String detail) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", code.name());
        out.put("detail", detail);
        return toFrame(out);
    }

    private TextMessage toFrame(Object payload) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize outbound frame", e);
        }
    }
}
