package com.entity.sync.api;

import com.entity.sync.lock.LockConfig;
import com.entity.sync.pending.CreateRollbackPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for the synchronization engine.
 * Configures deadlines, rollback behavior and tombstone retention.
 */
public class SyncOptions {

    private static final Duration DEFAULT_PENDING_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_RECONCILE_WINDOW = Duration.ofSeconds(5);
    private static final Duration DEFAULT_TOMBSTONE_TTL = Duration.ofMinutes(5);
    private static final long DEFAULT_TOMBSTONE_MAX_SIZE = 10_000;
    private static final String DEFAULT_TEMP_ID_PREFIX = "temp-";

    private final Duration pendingTimeout;
    private final Duration reconcileWindow;
    private final CreateRollbackPolicy createRollbackPolicy;
    private final String tempIdPrefix;
    private final Duration tombstoneTtl;
    private final long tombstoneMaxSize;
    private final LockConfig lockConfig;

    private SyncOptions(Builder builder) {
        this.pendingTimeout = builder.pendingTimeout;
        this.reconcileWindow = builder.reconcileWindow;
        this.createRollbackPolicy = builder.createRollbackPolicy;
        this.tempIdPrefix = builder.tempIdPrefix;
        this.tombstoneTtl = builder.tombstoneTtl;
        this.tombstoneMaxSize = builder.tombstoneMaxSize;
        this.lockConfig = builder.lockConfig;
    }

    /**
     * How long a pending operation may wait for its response before it is rolled back.
     */
    public Duration getPendingTimeout() {
        return pendingTimeout;
    }

    /**
     * How long a conflict reconciliation waits for the authoritative copy.
     */
    public Duration getReconcileWindow() {
        return reconcileWindow;
    }

    public CreateRollbackPolicy getCreateRollbackPolicy() {
        return createRollbackPolicy;
    }

    public String getTempIdPrefix() {
        return tempIdPrefix;
    }

    public Duration getTombstoneTtl() {
        return tombstoneTtl;
    }

    public long getTombstoneMaxSize() {
        return tombstoneMaxSize;
    }

    public LockConfig getLockConfig() {
        return lockConfig;
    }

    /**
     * Creates default options.
     */
    public static SyncOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration pendingTimeout = DEFAULT_PENDING_TIMEOUT;
        private Duration reconcileWindow = DEFAULT_RECONCILE_WINDOW;
        private CreateRollbackPolicy createRollbackPolicy = CreateRollbackPolicy.MARK_ERROR;
        private String tempIdPrefix = DEFAULT_TEMP_ID_PREFIX;
        private Duration tombstoneTtl = DEFAULT_TOMBSTONE_TTL;
        private long tombstoneMaxSize = DEFAULT_TOMBSTONE_MAX_SIZE;
        private LockConfig lockConfig = LockConfig.defaults();

        public Builder pendingTimeout(Duration pendingTimeout) {
            validatePositive(pendingTimeout, "pendingTimeout");
            this.pendingTimeout = pendingTimeout;
            return this;
        }

        public Builder reconcileWindow(Duration reconcileWindow) {
            validatePositive(reconcileWindow, "reconcileWindow");
            this.reconcileWindow = reconcileWindow;
            return this;
        }

        public Builder createRollbackPolicy(CreateRollbackPolicy createRollbackPolicy) {
            this.createRollbackPolicy = Objects.requireNonNull(createRollbackPolicy, "createRollbackPolicy is required");
            return this;
        }

        public Builder tempIdPrefix(String tempIdPrefix) {
            if (tempIdPrefix == null || tempIdPrefix.isBlank()) {
                throw new IllegalArgumentException("tempIdPrefix must not be blank");
            }
            this.tempIdPrefix = tempIdPrefix;
            return this;
        }

        public Builder tombstoneTtl(Duration tombstoneTtl) {
            validatePositive(tombstoneTtl, "tombstoneTtl");
            this.tombstoneTtl = tombstoneTtl;
            return this;
        }

        public Builder tombstoneMaxSize(long tombstoneMaxSize) {
            if (tombstoneMaxSize <= 0) {
                throw new IllegalArgumentException("tombstoneMaxSize must be > 0");
            }
            this.tombstoneMaxSize = tombstoneMaxSize;
            return this;
        }

        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = Objects.requireNonNull(lockConfig, "lockConfig is required");
            return this;
        }

        public SyncOptions build() {
            return new SyncOptions(this);
        }

        private static void validatePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be a positive duration");
            }
        }
    }
}
