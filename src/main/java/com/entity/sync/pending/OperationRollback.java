package com.entity.sync.pending;

import com.entity.sync.core.model.FailureReason;
import com.entity.sync.core.model.OperationKind;
import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.core.model.SyncStatus;
import com.entity.sync.metrics.SyncMetrics;
import com.entity.sync.notify.SyncNotification;
import com.entity.sync.notify.SyncNotifier;
import com.entity.sync.state.SyncEvent;
import com.entity.sync.state.SyncStateMachine;
import com.entity.sync.store.EntityStore;
import com.entity.sync.store.TombstoneCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restores the store after a pending operation failed or expired.
 * Must be called under the entity lock by the caller that resolved the operation.
 */
public class OperationRollback implements ExpiryHandler {
    private static final Logger log = LoggerFactory.getLogger(OperationRollback.class);

    private final EntityStore store;
    private final TombstoneCache tombstones;
    private final SyncStateMachine stateMachine;
    private final SyncNotifier notifier;
    private final SyncMetrics metrics;
    private final CreateRollbackPolicy createPolicy;

    public OperationRollback(EntityStore store, TombstoneCache tombstones, SyncStateMachine stateMachine,
                             SyncNotifier notifier, SyncMetrics metrics, CreateRollbackPolicy createPolicy) {
        this.store = store;
        this.tombstones = tombstones;
        this.stateMachine = stateMachine;
        this.notifier = notifier;
        this.metrics = metrics;
        this.createPolicy = createPolicy;
    }

    @Override
    public void onExpired(PendingOperation operation) {
        rollback(operation, FailureReason.TIMEOUT, null);
    }

    /**
     * Rolls back a resolved operation.
     *
     * @param detail server error text or exception message, may be null
     */
    public void rollback(PendingOperation op, FailureReason reason, String detail) {
        String id = op.getEntityId();
        SyncStatus failed = stateMachine.next(SyncStatus.SYNCING, SyncEvent.FAILED);
        SyncEntity original = op.getOriginalState();
        String name = displayName(original, id);

        switch (op.getKind()) {
            case CREATE -> {
                if (createPolicy == CreateRollbackPolicy.REMOVE) {
                    store.remove(id);
                    tombstones.add(id);
                } else if (store.update(id, e -> e.withStatus(failed)).isEmpty()) {
                    log.debug("Create rollback for {} found nothing to mark", id);
                }
            }
            case UPDATE -> {
                if (original != null) {
                    store.upsert(original.withStatus(failed));
                } else {
                    store.patch(id, null, failed);
                }
            }
            case DELETE -> {
                tombstones.forget(id);
                if (original != null) {
                    store.upsert(original.withStatus(failed));
                }
            }
        }

        metrics.incrementRollback(op.getKind(), reason);
        log.warn("Rolled back {} #{} on {} ({}){}", op.getKind(), op.getSequence(), id, reason,
                detail != null ? ": " + detail : "");
        notifier.notify(SyncNotification.error(id, message(op.getKind(), name, reason, detail)));
    }

    private static String message(OperationKind kind, String name, FailureReason reason, String detail) {
        String verb = switch (kind) {
            case CREATE -> "create";
            case UPDATE -> "save changes to";
            case DELETE -> "delete";
        };
        String cause = switch (reason) {
            case TIMEOUT -> "the server did not respond in time";
            case TRANSPORT -> detail != null ? "connection problem (" + detail + ")" : "connection problem";
            case REJECTED -> detail != null ? detail : "Unknown error";
        };
        return "Failed to " + verb + " '" + name + "': " + cause;
    }

    private static String displayName(SyncEntity entity, String fallback) {
        if (entity == null || entity.getName() == null) {
            return fallback;
        }
        return entity.getName();
    }
}
