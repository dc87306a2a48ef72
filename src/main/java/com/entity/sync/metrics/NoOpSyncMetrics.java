package com.entity.sync.metrics;

import com.entity.sync.core.model.FailureReason;
import com.entity.sync.core.model.OperationKind;

import java.time.Duration;

/**
 * No-op implementation of {@link SyncMetrics}.
 */
public class NoOpSyncMetrics implements SyncMetrics {

    @Override
    public void incrementMutationIssued(OperationKind kind) {
    }

    @Override
    public void recordMutationConfirmed(OperationKind kind, Duration roundTrip) {
    }

    @Override
    public void incrementRollback(OperationKind kind, FailureReason reason) {
    }

    @Override
    public void incrementStaleResponse(OperationKind kind) {
    }

    @Override
    public void incrementConflictDetected() {
    }

    @Override
    public void incrementConflictReconciled() {
    }

    @Override
    public void incrementConflictAbandoned() {
    }
}
