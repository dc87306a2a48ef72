package com.entity.sync.pending;

/**
 * Called under the entity lock when a pending operation reaches its deadline unresolved.
 */
@FunctionalInterface
public interface ExpiryHandler {

    void onExpired(PendingOperation operation);
}
