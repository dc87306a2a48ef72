package com.entity.sync.metrics;

import com.entity.sync.core.model.FailureReason;
import com.entity.sync.core.model.OperationKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link SyncMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code sync.mutation.issued} - Counter (tag: kind)</li>
 *   <li>{@code sync.mutation.confirmed} - Timer of the request round trip (tag: kind)</li>
 *   <li>{@code sync.mutation.rollback} - Counter (tags: kind, reason)</li>
 *   <li>{@code sync.response.stale} - Counter (tag: kind)</li>
 *   <li>{@code sync.conflict.detected} - Counter</li>
 *   <li>{@code sync.conflict.reconciled} - Counter</li>
 *   <li>{@code sync.conflict.abandoned} - Counter</li>
 * </ul>
 */
public class MicrometerSyncMetrics implements SyncMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter conflictDetectedCounter;
    private final Counter conflictReconciledCounter;
    private final Counter conflictAbandonedCounter;

    public MicrometerSyncMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.conflictDetectedCounter = Counter.builder("sync.conflict.detected")
                .description("Number of version conflicts reported by the server")
                .register(registry);
        this.conflictReconciledCounter = Counter.builder("sync.conflict.reconciled")
                .description("Number of conflicts resolved by adopting the authoritative copy")
                .register(registry);
        this.conflictAbandonedCounter = Counter.builder("sync.conflict.abandoned")
                .description("Number of conflict reconciliations given up")
                .register(registry);
    }

    @Override
    public void incrementMutationIssued(OperationKind kind) {
        counterCache.computeIfAbsent("issued:" + kind.name(), k ->
                Counter.builder("sync.mutation.issued")
                        .description("Number of mutations sent to the server")
                        .tag("kind", kind.name())
                        .register(registry)).increment();
    }

    @Override
    public void recordMutationConfirmed(OperationKind kind, Duration roundTrip) {
        Timer timer = timerCache.computeIfAbsent(kind.name(), k ->
                Timer.builder("sync.mutation.confirmed")
                        .description("Round trip of confirmed mutations")
                        .tag("kind", kind.name())
                        .register(registry));
        timer.record(roundTrip);
    }

    @Override
    public void incrementRollback(OperationKind kind, FailureReason reason) {
        String key = "rollback:" + kind.name() + ":" + reason.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("sync.mutation.rollback")
                        .description("Number of mutations rolled back or marked failed")
                        .tag("kind", kind.name())
                        .tag("reason", reason.name())
                        .register(registry)).increment();
    }

    @Override
    public void incrementStaleResponse(OperationKind kind) {
        counterCache.computeIfAbsent("stale:" + kind.name(), k ->
                Counter.builder("sync.response.stale")
                        .description("Number of responses ignored because their operation was superseded")
                        .tag("kind", kind.name())
                        .register(registry)).increment();
    }

    @Override
    public void incrementConflictDetected() {
        conflictDetectedCounter.increment();
    }

    @Override
    public void incrementConflictReconciled() {
        conflictReconciledCounter.increment();
    }

    @Override
    public void incrementConflictAbandoned() {
        conflictAbandonedCounter.increment();
    }
}
