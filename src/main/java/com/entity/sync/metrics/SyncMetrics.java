package com.entity.sync.metrics;

import com.entity.sync.core.model.FailureReason;
import com.entity.sync.core.model.OperationKind;

import java.time.Duration;

/**
 * Interface for recording synchronization metrics.
 * The default {@link NoOpSyncMetrics} does nothing, so the engine works
 * without a meter registry.
 */
public interface SyncMetrics {

    void incrementMutationIssued(OperationKind kind);

    void recordMutationConfirmed(OperationKind kind, Duration roundTrip);

    void incrementRollback(OperationKind kind, FailureReason reason);

    void incrementStaleResponse(OperationKind kind);

    void incrementConflictDetected();

    void incrementConflictReconciled();

    void incrementConflictAbandoned();
}
