package com.entity.sync.protocol.channel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolMessageCodecTest {

    private final ProtocolMessageCodec codec = new ProtocolMessageCodec();

    @Test
    @DisplayName("Should write the wire type name and data section")
    void testEncode() {
        String frame = codec.encode(new ProtocolMessage(MessageType.CHARACTER_DELETE_REQUEST,
                Map.of("character_id", "c-42")));

        assertEquals("{\"type\":\"character_delete_request\",\"data\":{\"character_id\":\"c-42\"}}", frame);
    }

    @Test
    @DisplayName("Should read nested data")
    void testDecode() {
        ProtocolMessage message = codec.decode("""
                {"type": "character_list_response",
                 "data": {"request_id": "r-1", "characters": [{"character_id": "c-1"}]}}
                """);

        assertEquals(MessageType.CHARACTER_LIST_RESPONSE, message.type());
        assertEquals("r-1", message.requestId().orElseThrow());
        assertEquals(List.of(Map.of("character_id", "c-1")), message.data().get("characters"));
    }

    @Test
    @DisplayName("Should accept frames without data")
    void testNoData() {
        ProtocolMessage message = codec.decode("{\"type\":\"character_list_request\"}");

        assertTrue(message.data().isEmpty());
        assertTrue(message.requestId().isEmpty());
    }

    @Test
    @DisplayName("Should reject malformed frames")
    void testMalformed() {
        assertThrows(ProtocolException.class, () -> codec.decode("{not json"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"data\":{}}"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"type\":\"chat_message\"}"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"type\":\"character_update\",\"data\":[1]}"));
    }

    @Test
    @DisplayName("Should read flags and numbers leniently")
    void testAccessors() {
        ProtocolMessage message = new ProtocolMessage(MessageType.CHARACTER_SAVE_RESPONSE,
                Map.of("success", "true", "version", "7", "bad", "x"));

        assertTrue(message.flag("success"));
        assertFalse(message.flag("missing"));
        assertEquals(7L, message.number("version").orElseThrow());
        assertTrue(message.number("bad").isEmpty());
    }
}
