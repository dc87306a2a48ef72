package com.entity.sync.pending;

import com.entity.sync.core.model.Mutation;
import com.entity.sync.core.model.OperationKind;
import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.lock.EntityLock;
import com.entity.sync.lock.LockAcquisitionException;
import com.entity.sync.logging.LogContext;
import com.entity.sync.schedule.ScheduledTask;
import com.entity.sync.schedule.SyncScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks at most one in-flight operation per entity id and enforces its deadline.
 * Registering a new operation for an id supersedes the previous one: its timer is cancelled
 * and any late response for it is recognized as stale by {@link #isCurrent(PendingOperation)}.
 */
public class PendingOperationRegistry {
    private static final Logger log = LoggerFactory.getLogger(PendingOperationRegistry.class);
    static final Duration EXPIRY_RETRY_DELAY = Duration.ofMillis(500);

    private final Map<String, PendingOperation> operations = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final SyncScheduler scheduler;
    private final EntityLock entityLock;
    private final ExpiryHandler expiryHandler;

    public PendingOperationRegistry(SyncScheduler scheduler, EntityLock entityLock, ExpiryHandler expiryHandler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler is required");
        this.entityLock = Objects.requireNonNull(entityLock, "entityLock is required");
        this.expiryHandler = Objects.requireNonNull(expiryHandler, "expiryHandler is required");
    }

    /**
     * Registers an operation and starts its deadline timer.
     * Any operation already registered for the id is superseded.
     */
    public PendingOperation register(String entityId, OperationKind kind, SyncEntity originalState,
                                     Mutation mutation, Duration timeout) {
        Instant now = scheduler.now();
        PendingOperation op = new PendingOperation(sequence.incrementAndGet(), entityId, kind,
                originalState, mutation, now, now.plus(timeout));
        PendingOperation previous = operations.put(entityId, op);
        if (previous != null && previous.markResolved()) {
            log.debug("Superseded {} #{} on {} with {} #{}",
                    previous.getKind(), previous.getSequence(), entityId, kind, op.getSequence());
        }
        ScheduledTask timer = scheduler.schedule(() -> fireExpiry(op), timeout);
        op.attachTimer(timer);
        log.debug("Registered {} #{} on {} (deadline {})", kind, op.getSequence(), entityId, op.getDeadline());
        return op;
    }

    /**
     * Confirms whatever operation is pending for the id.
     *
     * @return false when nothing was pending; a second call is harmless
     */
    public boolean confirm(String entityId) {
        PendingOperation op = operations.get(entityId);
        return op != null && resolve(op);
    }

    /**
     * Confirms {@code op} only if it is still the current operation for its entity.
     */
    public boolean confirm(PendingOperation op) {
        return resolve(op);
    }

    /**
     * Marks {@code op} failed if it is still current. The caller performs the rollback.
     *
     * @return true if the caller now owns the rollback
     */
    public boolean fail(PendingOperation op) {
        return resolve(op);
    }

    /**
     * Drops the pending operation for the id without rollback.
     */
    public Optional<PendingOperation> cancel(String entityId) {
        PendingOperation op = operations.get(entityId);
        if (op != null && resolve(op)) {
            log.debug("Cancelled {} #{} on {}", op.getKind(), op.getSequence(), entityId);
            return Optional.of(op);
        }
        return Optional.empty();
    }

    /**
     * Whether {@code op} is still the unresolved operation registered for its entity.
     */
    public boolean isCurrent(PendingOperation op) {
        return !op.isResolved() && operations.get(op.getEntityId()) == op;
    }

    public Optional<PendingOperation> get(String entityId) {
        return Optional.ofNullable(operations.get(entityId));
    }

    public boolean isPending(String entityId) {
        return operations.containsKey(entityId);
    }

    public int size() {
        return operations.size();
    }

    /**
     * Resolves every pending operation without rollback and stops all timers.
     */
    public void clear() {
        for (PendingOperation op : List.copyOf(operations.values())) {
            resolve(op);
        }
    }

    private boolean resolve(PendingOperation op) {
        if (operations.get(op.getEntityId()) != op || !op.markResolved()) {
            return false;
        }
        operations.remove(op.getEntityId(), op);
        return true;
    }

    private void fireExpiry(PendingOperation op) {
        try {
            entityLock.runLocked(op.getEntityId(), () -> {
                if (!resolve(op)) {
                    return;
                }
                try (LogContext ctx = LogContext.forMutation(op.getEntityId(), op.getKind(), op.getSequence())) {
                    log.warn("Pending {} on {} expired after {}", op.getKind(), op.getEntityId(),
                            Duration.between(op.getIssuedAt(), op.getDeadline()));
                    expiryHandler.onExpired(op);
                }
            });
        } catch (LockAcquisitionException e) {
            if (!isCurrent(op)) {
                return;
            }
            log.warn("Expiry of {} #{} on {} could not take the entity lock; retrying in {}",
                    op.getKind(), op.getSequence(), op.getEntityId(), EXPIRY_RETRY_DELAY);
            op.attachTimer(scheduler.schedule(() -> fireExpiry(op), EXPIRY_RETRY_DELAY));
        }
    }
}
