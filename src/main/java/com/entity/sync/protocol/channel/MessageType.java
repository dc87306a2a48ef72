package com.entity.sync.protocol.channel;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Character message types exchanged with the game server.
 *
 * Client to server: save, update, delete, list and load requests.
 * Server to client: the matching responses, plus {@link #CHARACTER_UPDATE} broadcasts
 * of changes made by other clients.
 */
public enum MessageType {
    CHARACTER_SAVE_REQUEST("character_save_request"),
    CHARACTER_SAVE_RESPONSE("character_save_response"),
    CHARACTER_UPDATE("character_update"),
    CHARACTER_UPDATE_RESPONSE("character_update_response"),
    CHARACTER_DELETE_REQUEST("character_delete_request"),
    CHARACTER_DELETE_RESPONSE("character_delete_response"),
    CHARACTER_LIST_REQUEST("character_list_request"),
    CHARACTER_LIST_RESPONSE("character_list_response"),
    CHARACTER_LOAD_REQUEST("character_load_request"),
    CHARACTER_LOAD_RESPONSE("character_load_response");

    private static final Map<String, MessageType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MessageType::wireName, Function.identity()));

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWireName(String wireName) {
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }
}
