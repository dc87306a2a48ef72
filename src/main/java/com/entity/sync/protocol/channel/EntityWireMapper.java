package com.entity.sync.protocol.channel;

import com.entity.sync.core.model.RemoteChange;
import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.core.model.SyncStatus;
import com.entity.sync.protocol.DeleteResponse;
import com.entity.sync.protocol.ListResponse;
import com.entity.sync.protocol.LoadResponse;
import com.entity.sync.protocol.SaveResponse;
import com.entity.sync.protocol.UpdateResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps entities and responses to and from the server's character wire format.
 */
public class EntityWireMapper {
    private static final Logger log = LoggerFactory.getLogger(EntityWireMapper.class);

    static final String CHARACTER_ID = "character_id";
    static final String NAME = "name";
    static final String OWNER_USER_ID = "owner_user_id";
    static final String CONTROLLED_BY = "controlled_by";
    static final String DATA = "data";
    static final String VERSION = "version";
    static final String UPDATES = "updates";
    static final String CURRENT_VERSION = "current_version";
    static final String CHARACTERS = "characters";
    static final String CHARACTER_DATA = "character_data";
    static final String SUCCESS = "success";
    static final String ERROR = "error";
    static final String OPERATION = "operation";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";

    public Map<String, Object> toWire(SyncEntity entity) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put(CHARACTER_ID, entity.getId());
        wire.put(NAME, entity.getName());
        if (entity.getOwnerId() != null) {
            wire.put(OWNER_USER_ID, entity.getOwnerId());
        }
        wire.put(CONTROLLED_BY, new ArrayList<>(entity.getControlledBy()));
        wire.put(DATA, entity.getPayload());
        wire.put(VERSION, entity.getVersion());
        return wire;
    }

    /**
     * Reads a server character. Accepts both {@code character_id} and {@code id},
     * and {@code controlled_by} or {@code controlledBy}.
     *
     * @return empty when the record has no id
     */
    @SuppressWarnings("unchecked")
    public Optional<SyncEntity> fromWire(Map<String, ?> wire) {
        Object id = wire.get(CHARACTER_ID) != null ? wire.get(CHARACTER_ID) : wire.get("id");
        if (id == null) {
            return Optional.empty();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        Object data = wire.get(DATA) != null ? wire.get(DATA) : wire.get(CHARACTER_DATA);
        if (data instanceof Map<?, ?> map) {
            payload.putAll((Map<String, Object>) map);
        }
        Object name = wire.get(NAME) != null ? wire.get(NAME) : wire.get("character_name");
        if (name != null) {
            payload.put(SyncEntity.NAME_FIELD, String.valueOf(name));
        } else {
            payload.putIfAbsent(SyncEntity.NAME_FIELD, "Unnamed");
        }
        Object owner = wire.get(OWNER_USER_ID) != null ? wire.get(OWNER_USER_ID) : wire.get("ownerId");
        Object controllers = wire.get(CONTROLLED_BY) != null ? wire.get(CONTROLLED_BY) : wire.get("controlledBy");

        SyncEntity.Builder builder = SyncEntity.builder()
                .id(String.valueOf(id))
                .payload(payload)
                .version(Math.max(1, toLong(wire.get(VERSION)).orElse(1L)))
                .ownerId(owner != null ? String.valueOf(owner) : null)
                .controlledBy(toStringSet(controllers))
                .syncStatus(SyncStatus.SYNCED);
        parseInstant(wire.get(CREATED_AT)).ifPresent(builder::createdAt);
        parseInstant(wire.get(UPDATED_AT)).ifPresent(builder::updatedAt);
        return Optional.of(builder.build());
    }

    public SaveResponse toSaveResponse(ProtocolMessage message) {
        if (!message.flag(SUCCESS)) {
            return SaveResponse.failed(message.string(ERROR).orElse(null));
        }
        return new SaveResponse(true, message.string(CHARACTER_ID).orElse(null),
                message.number(VERSION).orElse(null), null);
    }

    public UpdateResponse toUpdateResponse(ProtocolMessage message) {
        if (message.flag(SUCCESS)) {
            return UpdateResponse.ok(message.number(VERSION).orElse(null));
        }
        return new UpdateResponse(false, null, message.number(CURRENT_VERSION).orElse(null),
                message.string(ERROR).orElse(null));
    }

    public DeleteResponse toDeleteResponse(ProtocolMessage message) {
        return message.flag(SUCCESS) ? DeleteResponse.ok() : DeleteResponse.failed(message.string(ERROR).orElse(null));
    }

    public ListResponse toListResponse(ProtocolMessage message) {
        List<SyncEntity> entities = new ArrayList<>();
        if (message.data().get(CHARACTERS) instanceof Collection<?> characters) {
            for (Object character : characters) {
                if (character instanceof Map<?, ?> map) {
                    fromWireSafely(map).ifPresent(entities::add);
                }
            }
        }
        return new ListResponse(entities);
    }

    public LoadResponse toLoadResponse(ProtocolMessage message) {
        if (message.data().containsKey(SUCCESS) && !message.flag(SUCCESS)) {
            return LoadResponse.failed(message.string(ERROR).orElse("load failed"));
        }
        Object nested = message.data().get(CHARACTER_DATA);
        Map<?, ?> wire = nested instanceof Map<?, ?> map ? map : message.data();
        return fromWireSafely(wire)
                .map(LoadResponse::of)
                .orElseGet(() -> LoadResponse.failed(message.string(ERROR).orElse("no character in response")));
    }

    /**
     * Reads a {@link MessageType#CHARACTER_UPDATE} broadcast: a delete, a full save or a delta.
     */
    @SuppressWarnings("unchecked")
    public Optional<RemoteChange> toRemoteChange(ProtocolMessage message) {
        Optional<String> entityId = message.string(CHARACTER_ID);
        String operation = message.string(OPERATION).orElse("");
        if ("delete".equals(operation)) {
            return entityId.map(RemoteChange::delete);
        }
        if ("save".equals(operation) || "create".equals(operation)) {
            if (!(message.data().get(CHARACTER_DATA) instanceof Map<?, ?> characterData)) {
                return Optional.empty();
            }
            Map<String, Object> wire = new LinkedHashMap<>((Map<String, Object>) characterData);
            entityId.ifPresent(id -> wire.putIfAbsent(CHARACTER_ID, id));
            message.number(VERSION).ifPresent(v -> wire.put(VERSION, v));
            return fromWireSafely(wire).map(RemoteChange::upsert);
        }
        if (entityId.isPresent() && message.data().get(UPDATES) instanceof Map<?, ?> updates) {
            return Optional.of(RemoteChange.delta(entityId.get(), (Map<String, Object>) updates,
                    message.number(VERSION).orElse(null)));
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    private Optional<SyncEntity> fromWireSafely(Map<?, ?> wire) {
        try {
            return fromWire((Map<String, ?>) wire);
        } catch (RuntimeException e) {
            log.warn("Skipping malformed character record: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Long> toLong(Object value) {
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

    private static Set<String> toStringSet(Object value) {
        Set<String> result = new LinkedHashSet<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null) {
                    result.add(String.valueOf(element));
                }
            }
        }
        return result;
    }

    private static Optional<Instant> parseInstant(Object value) {
        if (!(value instanceof String s) || s.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(s));
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp '{}'", s);
            return Optional.empty();
        }
    }
}
