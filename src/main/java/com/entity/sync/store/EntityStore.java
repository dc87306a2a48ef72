package com.entity.sync.store;

import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.core.model.SyncStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Client-side cache of entities keyed by id.
 * All reads by the presentation layer go through the store; reads never block.
 */
public interface EntityStore {

    /**
     * Inserts or replaces an entity. No version check is performed.
     *
     * @param entity the entity to store
     * @return the previous value, if any
     */
    Optional<SyncEntity> upsert(SyncEntity entity);

    /**
     * Shallow-merges a partial payload and/or sets a status on an existing entity.
     *
     * @param id      the entity id
     * @param partial partial payload to merge, may be null
     * @param status  new status, may be null to keep the current one
     * @return the patched entity, or empty if the id is absent (no-op)
     */
    Optional<SyncEntity> patch(String id, Map<String, ?> partial, SyncStatus status);

    /**
     * Atomically replaces an existing entity with the result of the given function.
     *
     * @return the new value, or empty if the id is absent
     */
    Optional<SyncEntity> update(String id, UnaryOperator<SyncEntity> fn);

    /**
     * Atomically removes {@code oldId} and stores {@code entity} in its place.
     * Used when a temporary id is replaced by the server-assigned id.
     */
    void replace(String oldId, SyncEntity entity);

    /**
     * Removes an entity.
     *
     * @return the removed value, if any
     */
    Optional<SyncEntity> remove(String id);

    Optional<SyncEntity> get(String id);

    boolean contains(String id);

    /**
     * Returns all entities in insertion order.
     */
    List<SyncEntity> list();

    int size();

    void addListener(StoreListener listener);

    void removeListener(StoreListener listener);
}
