package com.entity.sync.mutation;

/**
 * Thrown when a mutation targets an id that is not in the store.
 */
public class EntityNotFoundException extends RuntimeException {

    private final String entityId;

    public EntityNotFoundException(String entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
