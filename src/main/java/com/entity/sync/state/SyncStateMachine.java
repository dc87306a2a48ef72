package com.entity.sync.state;

import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.core.model.SyncStatus;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Legal sync status transitions per entity.
 *
 * <pre>
 * LOCAL   --MUTATION_ISSUED-->    SYNCING
 * SYNCED  --MUTATION_ISSUED-->    SYNCING
 * ERROR   --MUTATION_ISSUED-->    SYNCING
 * SYNCING --MUTATION_ISSUED-->    SYNCING   (superseding)
 * SYNCING --CONFIRMED-->          SYNCED
 * SYNCING --FAILED-->             ERROR
 * LOCAL/SYNCING/ERROR --LOCAL_EDIT--> unchanged
 * SYNCING/SYNCED/ERROR --AUTHORITATIVE_COPY--> SYNCED
 * </pre>
 *
 * Outbound mutations never skip {@code SYNCING}. Removal is not a status.
 */
public class SyncStateMachine {

    private final Map<SyncStatus, Map<SyncEvent, SyncStatus>> transitions = new EnumMap<>(SyncStatus.class);

    public SyncStateMachine() {
        allow(SyncStatus.LOCAL, SyncEvent.MUTATION_ISSUED, SyncStatus.SYNCING);
        allow(SyncStatus.SYNCED, SyncEvent.MUTATION_ISSUED, SyncStatus.SYNCING);
        allow(SyncStatus.ERROR, SyncEvent.MUTATION_ISSUED, SyncStatus.SYNCING);
        allow(SyncStatus.SYNCING, SyncEvent.MUTATION_ISSUED, SyncStatus.SYNCING);

        allow(SyncStatus.SYNCING, SyncEvent.CONFIRMED, SyncStatus.SYNCED);
        allow(SyncStatus.SYNCING, SyncEvent.FAILED, SyncStatus.ERROR);

        allow(SyncStatus.LOCAL, SyncEvent.LOCAL_EDIT, SyncStatus.LOCAL);
        allow(SyncStatus.SYNCING, SyncEvent.LOCAL_EDIT, SyncStatus.SYNCING);
        allow(SyncStatus.ERROR, SyncEvent.LOCAL_EDIT, SyncStatus.ERROR);

        allow(SyncStatus.SYNCING, SyncEvent.AUTHORITATIVE_COPY, SyncStatus.SYNCED);
        allow(SyncStatus.SYNCED, SyncEvent.AUTHORITATIVE_COPY, SyncStatus.SYNCED);
        allow(SyncStatus.ERROR, SyncEvent.AUTHORITATIVE_COPY, SyncStatus.SYNCED);
    }

    /**
     * Status of a freshly created entity before any event: {@code SYNCING} is reached
     * through {@link SyncEvent#MUTATION_ISSUED}, so creation always starts from {@code LOCAL}.
     */
    public SyncStatus initialStatus() {
        return SyncStatus.LOCAL;
    }

    /**
     * Returns the status reached from {@code from} on {@code event}.
     *
     * @throws IllegalSyncTransitionException if the pair is not allowed
     */
    public SyncStatus next(SyncStatus from, SyncEvent event) {
        return lookup(from, event).orElseThrow(() -> new IllegalSyncTransitionException(from, event));
    }

    public boolean canTransition(SyncStatus from, SyncEvent event) {
        return lookup(from, event).isPresent();
    }

    /**
     * Returns {@code entity} with the status reached on {@code event}.
     */
    public SyncEntity apply(SyncEntity entity, SyncEvent event) {
        SyncStatus next = next(entity.getSyncStatus(), event);
        return next == entity.getSyncStatus() ? entity : entity.withStatus(next);
    }

    private Optional<SyncStatus> lookup(SyncStatus from, SyncEvent event) {
        Map<SyncEvent, SyncStatus> byEvent = transitions.get(from);
        return byEvent == null ? Optional.empty() : Optional.ofNullable(byEvent.get(event));
    }

    private void allow(SyncStatus from, SyncEvent event, SyncStatus to) {
        transitions.computeIfAbsent(from, k -> new EnumMap<>(SyncEvent.class)).put(event, to);
    }
}
