package com.entity.sync.store;

import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.core.model.SyncStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Copy-on-write implementation of {@link EntityStore}.
 * Readers see an immutable snapshot; writers are serialized and publish a new snapshot.
 * Constructed once per application session and injected where needed.
 */
public class InMemoryEntityStore implements EntityStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

    private final Object writeLock = new Object();
    private final List<StoreListener> listeners = new CopyOnWriteArrayList<>();
    private volatile Map<String, SyncEntity> snapshot = Map.of();

    @Override
    public Optional<SyncEntity> upsert(SyncEntity entity) {
        Objects.requireNonNull(entity, "entity is required");
        SyncEntity previous;
        synchronized (writeLock) {
            Map<String, SyncEntity> next = new LinkedHashMap<>(snapshot);
            previous = next.put(entity.getId(), entity);
            publish(next);
        }
        fire(StoreChange.of(entity.getId(), previous, entity));
        return Optional.ofNullable(previous);
    }

    @Override
    public Optional<SyncEntity> patch(String id, Map<String, ?> partial, SyncStatus status) {
        return update(id, current -> {
            SyncEntity patched = partial != null && !partial.isEmpty() ? current.merge(partial) : current;
            return status != null ? patched.withStatus(status) : patched;
        });
    }

    @Override
    public Optional<SyncEntity> update(String id, UnaryOperator<SyncEntity> fn) {
        SyncEntity previous;
        SyncEntity updated;
        synchronized (writeLock) {
            previous = snapshot.get(id);
            if (previous == null) {
                log.debug("Ignoring update of unknown entity {}", id);
                return Optional.empty();
            }
            updated = Objects.requireNonNull(fn.apply(previous), "update function returned null");
            if (!id.equals(updated.getId())) {
                throw new IllegalArgumentException("update must not change the id; use replace()");
            }
            Map<String, SyncEntity> next = new LinkedHashMap<>(snapshot);
            next.put(id, updated);
            publish(next);
        }
        fire(StoreChange.of(id, previous, updated));
        return Optional.of(updated);
    }

    @Override
    public void replace(String oldId, SyncEntity entity) {
        Objects.requireNonNull(entity, "entity is required");
        SyncEntity removed;
        SyncEntity previous;
        synchronized (writeLock) {
            Map<String, SyncEntity> current = snapshot;
            removed = current.get(oldId);
            previous = oldId.equals(entity.getId()) ? null : current.get(entity.getId());
            Map<String, SyncEntity> next = new LinkedHashMap<>();
            boolean placed = false;
            for (Map.Entry<String, SyncEntity> e : current.entrySet()) {
                if (e.getKey().equals(oldId)) {
                    next.put(entity.getId(), entity);
                    placed = true;
                } else if (!e.getKey().equals(entity.getId())) {
                    next.put(e.getKey(), e.getValue());
                }
            }
            if (!placed) {
                next.put(entity.getId(), entity);
            }
            publish(next);
        }
        if (oldId.equals(entity.getId())) {
            fire(StoreChange.of(oldId, removed, entity));
            return;
        }
        if (removed != null) {
            fire(StoreChange.of(oldId, removed, null));
        }
        fire(StoreChange.of(entity.getId(), previous, entity));
    }

    @Override
    public Optional<SyncEntity> remove(String id) {
        SyncEntity removed;
        synchronized (writeLock) {
            if (!snapshot.containsKey(id)) {
                return Optional.empty();
            }
            Map<String, SyncEntity> next = new LinkedHashMap<>(snapshot);
            removed = next.remove(id);
            publish(next);
        }
        fire(StoreChange.of(id, removed, null));
        return Optional.of(removed);
    }

    @Override
    public Optional<SyncEntity> get(String id) {
        return Optional.ofNullable(snapshot.get(id));
    }

    @Override
    public boolean contains(String id) {
        return snapshot.containsKey(id);
    }

    @Override
    public List<SyncEntity> list() {
        return List.copyOf(snapshot.values());
    }

    @Override
    public int size() {
        return snapshot.size();
    }

    @Override
    public void addListener(StoreListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    @Override
    public void removeListener(StoreListener listener) {
        listeners.remove(listener);
    }

    private void publish(Map<String, SyncEntity> next) {
        snapshot = Collections.unmodifiableMap(next);
    }

    private void fire(StoreChange change) {
        for (StoreListener listener : listeners) {
            try {
                listener.onChange(change);
            } catch (RuntimeException e) {
                log.warn("Store listener failed on {} of {}: {}", change.type(), change.entityId(), e.getMessage(), e);
            }
        }
    }
}
