package com.entity.sync.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A change made by another client and broadcast by the server.
 *
 * @param type     the kind of change
 * @param entityId the affected entity
 * @param entity   the full entity for {@link Type#UPSERT}, null otherwise
 * @param updates  the partial payload for {@link Type#DELTA}, empty otherwise
 * @param version  the server version after the change, null when the server did not send one
 */
public record RemoteChange(Type type, String entityId, SyncEntity entity, Map<String, Object> updates, Long version) {

    public enum Type { UPSERT, DELTA, DELETE }

    public RemoteChange {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(entityId, "entityId is required");
        if (type == Type.UPSERT) {
            Objects.requireNonNull(entity, "entity is required for UPSERT");
        }
        updates = updates != null ? Payloads.deepCopy(updates) : Map.of();
    }

    public static RemoteChange upsert(SyncEntity entity) {
        return new RemoteChange(Type.UPSERT, entity.getId(), entity, null, entity.getVersion());
    }

    public static RemoteChange delta(String entityId, Map<String, Object> updates, Long version) {
        return new RemoteChange(Type.DELTA, entityId, null, updates, version);
    }

    public static RemoteChange delete(String entityId) {
        return new RemoteChange(Type.DELETE, entityId, null, null, null);
    }
}
