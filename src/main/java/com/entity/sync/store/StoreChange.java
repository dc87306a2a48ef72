package com.entity.sync.store;

import com.entity.sync.core.model.SyncEntity;

/**
 * A change applied to the {@link EntityStore}.
 *
 * @param type     what happened
 * @param entityId the affected id
 * @param previous the value before the change, null for {@link Type#ADDED}
 * @param current  the value after the change, null for {@link Type#REMOVED}
 */
public record StoreChange(Type type, String entityId, SyncEntity previous, SyncEntity current) {

    public enum Type { ADDED, UPDATED, REMOVED }

    static StoreChange of(String entityId, SyncEntity previous, SyncEntity current) {
        if (current == null) {
            return new StoreChange(Type.REMOVED, entityId, previous, null);
        }
        return new StoreChange(previous == null ? Type.ADDED : Type.UPDATED, entityId, previous, current);
    }
}
