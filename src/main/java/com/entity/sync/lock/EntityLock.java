package com.entity.sync.lock;

import java.util.function.Supplier;

/**
 * Per-entity mutual exclusion. Operations against the same entity id never run concurrently;
 * operations against different ids are independent.
 */
public interface EntityLock {

    /**
     * Acquires the lock for the given entity id.
     *
     * @param key the entity id
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    boolean tryLock(String key);

    /**
     * Releases the lock for the given entity id.
     *
     * @param key the entity id
     */
    void unlock(String key);

    /**
     * Runs {@code action} while holding the lock for {@code key} and returns its result.
     */
    default <T> T callLocked(String key, Supplier<T> action) {
        tryLock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     */
    default void runLocked(String key, Runnable action) {
        tryLock(key);
        try {
            action.run();
        } finally {
            unlock(key);
        }
    }
}
