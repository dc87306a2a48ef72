package com.entity.sync.pending;

import com.entity.sync.core.model.Mutation;
import com.entity.sync.core.model.OperationKind;
import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.schedule.ScheduledTask;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A mutation sent to the server and not yet confirmed, failed or expired.
 * Confirmation, failure, expiry and superseding all race on {@link #markResolved()};
 * exactly one of them wins.
 */
public final class PendingOperation {

    private final long sequence;
    private final String entityId;
    private final OperationKind kind;
    private final SyncEntity originalState;
    private final Mutation mutation;
    private final Instant issuedAt;
    private final Instant deadline;
    private final AtomicBoolean resolved = new AtomicBoolean(false);
    private volatile ScheduledTask timer;

    PendingOperation(long sequence, String entityId, OperationKind kind, SyncEntity originalState,
                     Mutation mutation, Instant issuedAt, Instant deadline) {
        this.sequence = sequence;
        this.entityId = Objects.requireNonNull(entityId, "entityId is required");
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.originalState = originalState;
        this.mutation = mutation;
        this.issuedAt = issuedAt;
        this.deadline = deadline;
    }

    public long getSequence() {
        return sequence;
    }

    public String getEntityId() {
        return entityId;
    }

    public OperationKind getKind() {
        return kind;
    }

    /**
     * The entity as it was before this operation (the last confirmed state when superseding),
     * used for rollback. For creates this is the optimistic entity.
     */
    public SyncEntity getOriginalState() {
        return originalState;
    }

    public Mutation getMutation() {
        return mutation;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public boolean isResolved() {
        return resolved.get();
    }

    /**
     * Marks this operation resolved and cancels its timer.
     *
     * @return true for the single caller that won the race
     */
    boolean markResolved() {
        if (!resolved.compareAndSet(false, true)) {
            return false;
        }
        cancelTimer();
        return true;
    }

    void attachTimer(ScheduledTask timer) {
        this.timer = timer;
        if (resolved.get()) {
            timer.cancel();
        }
    }

    private void cancelTimer() {
        ScheduledTask t = timer;
        if (t != null) {
            t.cancel();
        }
    }

    @Override
    public String toString() {
        return "PendingOperation{" +
                "seq=" + sequence +
                ", entityId='" + entityId + '\'' +
                ", kind=" + kind +
                ", deadline=" + deadline +
                ", resolved=" + resolved.get() +
                '}';
    }
}
