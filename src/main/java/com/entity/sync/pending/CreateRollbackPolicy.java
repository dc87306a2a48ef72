package com.entity.sync.pending;

/**
 * What happens to an optimistically created entity whose create fails.
 */
public enum CreateRollbackPolicy {
    /** Keep the entity with status {@code ERROR} so the user can retry or discard it. */
    MARK_ERROR,
    /** Remove the optimistic entity from the store. */
    REMOVE
}
