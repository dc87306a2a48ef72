package com.entity.sync.conflict;

import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.core.model.SyncStatus;
import com.entity.sync.core.model.VersionConflict;
import com.entity.sync.lock.EntityLock;
import com.entity.sync.logging.LogContext;
import com.entity.sync.metrics.SyncMetrics;
import com.entity.sync.notify.SyncNotification;
import com.entity.sync.notify.SyncNotifier;
import com.entity.sync.pending.PendingOperation;
import com.entity.sync.pending.PendingOperationRegistry;
import com.entity.sync.protocol.LoadResponse;
import com.entity.sync.protocol.ProtocolClient;
import com.entity.sync.schedule.ScheduledTask;
import com.entity.sync.schedule.SyncScheduler;
import com.entity.sync.state.SyncEvent;
import com.entity.sync.state.SyncStateMachine;
import com.entity.sync.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resolves version conflicts by adopting the server's copy.
 *
 * <p>On a conflict the user is warned, the authoritative copy is requested and, when it arrives
 * within the reconciliation window, it replaces the local entity with status {@code SYNCED}
 * and the pending update is cleared. No field-level merge is attempted. If no copy arrives
 * in time the attempt is dropped silently and the pending operation's expiry decides the
 * entity's state.</p>
 */
public class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private final ProtocolClient protocolClient;
    private final EntityStore store;
    private final PendingOperationRegistry registry;
    private final EntityLock entityLock;
    private final SyncScheduler scheduler;
    private final SyncStateMachine stateMachine;
    private final SyncNotifier notifier;
    private final SyncMetrics metrics;
    private final Duration window;
    private final Map<String, Attempt> attempts = new ConcurrentHashMap<>();

    public ConflictResolver(ProtocolClient protocolClient, EntityStore store, PendingOperationRegistry registry,
                            EntityLock entityLock, SyncScheduler scheduler, SyncStateMachine stateMachine,
                            SyncNotifier notifier, SyncMetrics metrics, Duration window) {
        this.protocolClient = protocolClient;
        this.store = store;
        this.registry = registry;
        this.entityLock = entityLock;
        this.scheduler = scheduler;
        this.stateMachine = stateMachine;
        this.notifier = notifier;
        this.metrics = metrics;
        this.window = window;
    }

    /**
     * Starts reconciliation for a conflicting update. Called under the entity lock.
     * A previous attempt for the same entity is replaced.
     */
    public void onConflict(PendingOperation operation, VersionConflict conflict) {
        String id = conflict.entityId();
        metrics.incrementConflictDetected();
        log.warn("Version conflict on {}: claimed v{}, server has v{}",
                id, conflict.claimedVersion(), conflict.currentVersion());
        String name = store.get(id).map(SyncEntity::getName).orElse(id);
        notifier.notify(SyncNotification.warning(id,
                "'" + name + "' was modified elsewhere. Loading the latest version..."));

        Attempt attempt = new Attempt(conflict, operation);
        Attempt previous = attempts.put(id, attempt);
        if (previous != null && previous.finish()) {
            metrics.incrementConflictAbandoned();
            log.debug("Replaced reconciliation attempt for {}", id);
        }
        attempt.timer = scheduler.schedule(() -> expire(attempt), window);

        CompletableFuture<LoadResponse> future;
        try {
            future = protocolClient.requestLoad(id);
        } catch (RuntimeException e) {
            abandon(attempt, "load could not be sent: " + e.getMessage());
            return;
        }
        future.whenComplete((response, error) -> handleLoad(attempt, response, error));
    }

    /**
     * Offers an authoritative copy obtained outside the reconciliation's own load.
     *
     * @return true if a reconciliation was waiting for it
     */
    public boolean onAuthoritativeCopy(SyncEntity copy) {
        Attempt attempt = attempts.get(copy.getId());
        if (attempt == null) {
            return false;
        }
        reconcile(attempt, copy);
        return true;
    }

    public boolean isReconciling(String entityId) {
        return attempts.containsKey(entityId);
    }

    /**
     * Drops any reconciliation in progress for the entity, typically because a newer
     * mutation superseded the conflicting update.
     */
    public void abandon(String entityId) {
        Attempt attempt = attempts.get(entityId);
        if (attempt != null) {
            abandon(attempt, "superseded by a newer mutation");
        }
    }

    public void clear() {
        attempts.values().forEach(Attempt::finish);
        attempts.clear();
    }

    private void handleLoad(Attempt attempt, LoadResponse response, Throwable error) {
        String id = attempt.conflict.entityId();
        try {
            entityLock.runLocked(id, () -> {
                if (error != null) {
                    abandon(attempt, "load failed: " + error.getMessage());
                } else if (response == null || response.entity() == null) {
                    abandon(attempt, response != null && response.error() != null
                            ? "load failed: " + response.error() : "load returned no entity");
                } else {
                    reconcile(attempt, response.entity());
                }
            });
        } catch (RuntimeException e) {
            log.error("Reconciliation of {} failed", id, e);
        }
    }

    private void reconcile(Attempt attempt, SyncEntity copy) {
        String id = attempt.conflict.entityId();
        entityLock.runLocked(id, () -> {
            if (attempts.get(id) != attempt || attempt.done.get()) {
                return;
            }
            Optional<PendingOperation> current = registry.get(id);
            if (current.isPresent() && current.get() != attempt.operation) {
                abandon(attempt, "superseded by " + current.get().getKind() + " #" + current.get().getSequence());
                return;
            }
            if (!store.contains(id)) {
                abandon(attempt, "entity no longer present");
                return;
            }
            if (!attempts.remove(id, attempt) || !attempt.finish()) {
                return;
            }
            try (LogContext ctx = LogContext.forReconciliation(id)) {
                registry.confirm(attempt.operation);
                SyncStatus from = store.get(id).map(SyncEntity::getSyncStatus).orElse(SyncStatus.SYNCING);
                SyncStatus to = stateMachine.next(from, SyncEvent.AUTHORITATIVE_COPY);
                SyncEntity adopted = copy.getId().equals(id) ? copy.withStatus(to) : copy.withId(id).withStatus(to);
                store.upsert(adopted);
                metrics.incrementConflictReconciled();
                log.info("Reconciled {} with server v{}", id, adopted.getVersion());
                notifier.notify(SyncNotification.success(id,
                        "'" + displayName(adopted) + "' synchronized with the latest version"));
            }
        });
    }

    private void abandon(Attempt attempt, String reason) {
        String id = attempt.conflict.entityId();
        if (attempts.remove(id, attempt) && attempt.finish()) {
            metrics.incrementConflictAbandoned();
            log.info("Abandoned reconciliation of {}: {}", id, reason);
        }
    }

    private void expire(Attempt attempt) {
        String id = attempt.conflict.entityId();
        entityLock.runLocked(id, () -> abandon(attempt, "no authoritative copy within " + window));
    }

    private static String displayName(SyncEntity entity) {
        return entity.getName() != null ? entity.getName() : entity.getId();
    }

    private static final class Attempt {
        private final VersionConflict conflict;
        private final PendingOperation operation;
        private final AtomicBoolean done = new AtomicBoolean(false);
        private volatile ScheduledTask timer;

        private Attempt(VersionConflict conflict, PendingOperation operation) {
            this.conflict = conflict;
            this.operation = operation;
        }

        private boolean finish() {
            if (!done.compareAndSet(false, true)) {
                return false;
            }
            ScheduledTask t = timer;
            if (t != null) {
                t.cancel();
            }
            return true;
        }
    }
}
