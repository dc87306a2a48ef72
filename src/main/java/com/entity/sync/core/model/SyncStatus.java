package com.entity.sync.core.model;

/**
 * Synchronization status of a locally cached entity.
 * An entity holds exactly one status at a time.
 */
public enum SyncStatus {
    /**
     * Never sent to the server, typically because no transport was available.
     */
    LOCAL,

    /**
     * A request for this entity is outstanding and bounded by a pending operation.
     */
    SYNCING,

    /**
     * Confirmed by the server. No pending operation exists for the entity.
     */
    SYNCED,

    /**
     * A rollback occurred or the server rejected the last mutation.
     * The entity stays visible so the user can retry or discard.
     */
    ERROR
}
