package com.entity.sync.store;

/**
 * Listener for entity store changes. The presentation layer subscribes to re-render.
 */
@FunctionalInterface
public interface StoreListener {

    /**
     * Called after a change has been applied to the store.
     *
     * @param change the applied change
     */
    void onChange(StoreChange change);
}
