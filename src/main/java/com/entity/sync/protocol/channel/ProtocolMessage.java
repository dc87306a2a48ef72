package com.entity.sync.protocol.channel;

import com.entity.sync.core.model.Payloads;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A typed message with a JSON-like data section.
 */
public record ProtocolMessage(MessageType type, Map<String, Object> data) {

    public static final String REQUEST_ID = "request_id";

    public ProtocolMessage {
        Objects.requireNonNull(type, "type is required");
        data = data != null ? Payloads.deepCopy(data) : Map.of();
    }

    public Optional<String> string(String key) {
        Object value = data.get(key);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    public Optional<Long> number(String key) {
        Object value = data.get(key);
        if (value instanceof Number n) {
            return Optional.of(n.longValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Long.parseLong(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public boolean flag(String key) {
        Object value = data.get(key);
        return value instanceof Boolean b ? b : value != null && Boolean.parseBoolean(String.valueOf(value));
    }

    public Optional<String> requestId() {
        return string(REQUEST_ID);
    }
}
