package com.entity.sync.protocol.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson codec for text frames of the form {@code {"type": "...", "data": {...}}}.
 */
public class ProtocolMessageCodec {

    private static final TypeReference<Map<String, Object>> FRAME_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ProtocolMessageCodec() {
        this(new ObjectMapper());
    }

    public ProtocolMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ProtocolMessage message) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", message.type().wireName());
        frame.put("data", message.data());
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode " + message.type(), e);
        }
    }

    @SuppressWarnings("unchecked")
    public ProtocolMessage decode(String text) {
        Map<String, Object> frame;
        try {
            frame = objectMapper.readValue(text, FRAME_TYPE);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed frame: " + e.getOriginalMessage(), e);
        }
        if (frame == null || !(frame.get("type") instanceof String typeName)) {
            throw new ProtocolException("Frame has no type");
        }
        MessageType type = MessageType.fromWireName(typeName)
                .orElseThrow(() -> new ProtocolException("Unknown message type: " + typeName));
        Object data = frame.get("data");
        if (data != null && !(data instanceof Map)) {
            throw new ProtocolException("Frame data must be an object");
        }
        return new ProtocolMessage(type, (Map<String, Object>) data);
    }
}
