package com.entity.sync.state;

import com.entity.sync.core.model.SyncStatus;

/**
 * Thrown when an event is not allowed in the current sync status.
 */
public class IllegalSyncTransitionException extends RuntimeException {

    private final SyncStatus from;
    private final SyncEvent event;

    public IllegalSyncTransitionException(SyncStatus from, SyncEvent event) {
        super("Illegal sync transition: " + event + " from " + from);
        this.from = from;
        this.event = event;
    }

    public SyncStatus getFrom() {
        return from;
    }

    public SyncEvent getEvent() {
        return event;
    }
}
