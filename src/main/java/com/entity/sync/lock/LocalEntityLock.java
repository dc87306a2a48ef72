package com.entity.sync.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process entity lock using one {@link ReentrantLock} per entity id.
 * Re-entrant so that a response completing synchronously inside a locked dispatch
 * can take the same lock again.
 * <p>
 * Entries are reference counted and dropped once no thread holds or waits for them,
 * so short-lived ids such as temporary ids do not accumulate.
 */
public class LocalEntityLock implements EntityLock {
    private static final Logger log = LoggerFactory.getLogger(LocalEntityLock.class);

    private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalEntityLock() {
        this(LockConfig.defaults());
    }

    public LocalEntityLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        KeyLock keyLock = locks.compute(key, (k, existing) -> {
            KeyLock held = existing != null ? existing : new KeyLock();
            held.users++;
            return held;
        });
        boolean acquired = false;
        try {
            acquired = keyLock.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for entity '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.trace("Lock acquired: {}", key);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for entity: " + key, e);
        } finally {
            if (!acquired) {
                release(key);
            }
        }
    }

    @Override
    public void unlock(String key) {
        KeyLock keyLock = locks.get(key);
        if (keyLock != null && keyLock.lock.isHeldByCurrentThread()) {
            keyLock.lock.unlock();
            release(key);
            log.trace("Lock released: {}", key);
        }
    }

    /**
     * Number of entity ids currently locked or waited on.
     */
    int trackedKeys() {
        return locks.size();
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, keyLock) -> --keyLock.users == 0 ? null : keyLock);
    }

    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
