package com.entity.sync.state;

/**
 * Events driving the {@link SyncStateMachine}.
 */
public enum SyncEvent {
    /** A create, update, delete or retry was sent to the server. */
    MUTATION_ISSUED,
    /** The server confirmed the current pending operation. */
    CONFIRMED,
    /** Expiry, transport failure or rejection of the current pending operation. */
    FAILED,
    /** Local-only edit that is not sent to the server. */
    LOCAL_EDIT,
    /** The authoritative copy was adopted from a load, list refresh or broadcast. */
    AUTHORITATIVE_COPY
}
