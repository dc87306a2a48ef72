package com.entity.sync.api;

import com.entity.sync.conflict.ConflictResolver;
import com.entity.sync.core.model.RemoteChange;
import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.core.model.SyncStatus;
import com.entity.sync.lock.EntityLock;
import com.entity.sync.lock.LocalEntityLock;
import com.entity.sync.logging.LogContext;
import com.entity.sync.metrics.NoOpSyncMetrics;
import com.entity.sync.metrics.SyncMetrics;
import com.entity.sync.mutation.BulkDeleteResult;
import com.entity.sync.mutation.MutationQueue;
import com.entity.sync.mutation.PayloadValidator;
import com.entity.sync.notify.NoOpSyncNotifier;
import com.entity.sync.notify.SyncNotifier;
import com.entity.sync.pending.OperationRollback;
import com.entity.sync.pending.PendingOperationRegistry;
import com.entity.sync.protocol.ListResponse;
import com.entity.sync.protocol.LoadResponse;
import com.entity.sync.protocol.ProtocolClient;
import com.entity.sync.schedule.ExecutorSyncScheduler;
import com.entity.sync.schedule.SyncScheduler;
import com.entity.sync.state.SyncEvent;
import com.entity.sync.state.SyncStateMachine;
import com.entity.sync.store.EntityStore;
import com.entity.sync.store.InMemoryEntityStore;
import com.entity.sync.store.StoreListener;
import com.entity.sync.store.TombstoneCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Main entry point for the presentation layer.
 *
 * <p>Mutations are applied to the local store immediately and return without waiting for
 * the server; their outcome shows up as a status change on the entity and, on failure,
 * a notification. Reads never block.</p>
 *
 * <pre>
 * EntitySyncService sync = EntitySyncService.builder()
 *         .protocolClient(client)
 *         .currentUser(session::userId)
 *         .notifier(toasts::show)
 *         .build();
 *
 * SyncEntity hero = sync.create(Map.of("name", "Aria", "hp", 12));
 * </pre>
 */
public class EntitySyncService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EntitySyncService.class);

    private final ProtocolClient protocolClient;
    private final EntityStore store;
    private final TombstoneCache tombstones;
    private final EntityLock entityLock;
    private final SyncScheduler scheduler;
    private final boolean ownsScheduler;
    private final SyncStateMachine stateMachine;
    private final PendingOperationRegistry registry;
    private final ConflictResolver conflictResolver;
    private final MutationQueue mutationQueue;
    private final SyncOptions options;

    private EntitySyncService(Builder builder) {
        this.protocolClient = builder.protocolClient;
        this.options = builder.options;
        this.store = builder.store != null ? builder.store : new InMemoryEntityStore();
        this.tombstones = builder.tombstones != null
                ? builder.tombstones : new TombstoneCache(options.getTombstoneMaxSize(), options.getTombstoneTtl());
        this.entityLock = builder.entityLock != null
                ? builder.entityLock : new LocalEntityLock(options.getLockConfig());
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = builder.scheduler != null ? builder.scheduler : new ExecutorSyncScheduler();
        this.stateMachine = new SyncStateMachine();

        SyncNotifier notifier = builder.notifier != null ? builder.notifier : new NoOpSyncNotifier();
        SyncMetrics metrics = builder.metrics != null ? builder.metrics : new NoOpSyncMetrics();
        Supplier<String> currentUser = builder.currentUser != null ? builder.currentUser : () -> null;

        OperationRollback rollback = new OperationRollback(
                store, tombstones, stateMachine, notifier, metrics, options.getCreateRollbackPolicy());
        this.registry = new PendingOperationRegistry(scheduler, entityLock, rollback);
        this.conflictResolver = new ConflictResolver(protocolClient, store, registry, entityLock, scheduler,
                stateMachine, notifier, metrics, options.getReconcileWindow());
        this.mutationQueue = new MutationQueue(store, registry, rollback, conflictResolver, protocolClient,
                stateMachine, tombstones, entityLock, scheduler, notifier, metrics, new PayloadValidator(),
                options, currentUser);

        log.info("EntitySyncService initialized (pendingTimeout={}, reconcileWindow={}, createRollback={})",
                options.getPendingTimeout(), options.getReconcileWindow(), options.getCreateRollbackPolicy());
    }

    // ========== Mutations ==========

    /**
     * Creates an entity optimistically under a temporary id.
     */
    public SyncEntity create(Map<String, ?> payload) {
        return mutationQueue.create(payload);
    }

    /**
     * Updates an entity based on its current version.
     */
    public SyncEntity update(String id, Map<String, ?> partial) {
        return mutationQueue.update(id, partial);
    }

    /**
     * Updates an entity, telling the server which version the edit is based on.
     */
    public SyncEntity update(String id, Map<String, ?> partial, long expectedVersion) {
        return mutationQueue.update(id, partial, expectedVersion);
    }

    public void delete(String id) {
        mutationQueue.delete(id);
    }

    public BulkDeleteResult deleteAll(Collection<String> ids) {
        return mutationQueue.deleteAll(ids);
    }

    public SyncEntity cloneEntity(String id) {
        return mutationQueue.cloneEntity(id);
    }

    /**
     * Re-sends the failed mutation of an {@code ERROR} entity, or the create of a {@code LOCAL} one.
     */
    public boolean retry(String id) {
        return mutationQueue.retry(id);
    }

    /**
     * Abandons a failed mutation. Never-synced entities are removed; server entities are
     * reloaded from the server.
     */
    public boolean discard(String id) {
        boolean discarded = mutationQueue.discard(id);
        if (discarded && !mutationQueue.isTemporary(id)) {
            load(id).exceptionally(e -> {
                log.warn("Reload of {} after discard failed: {}", id, e.getMessage());
                return Optional.empty();
            });
        }
        return discarded;
    }

    // ========== Reads ==========

    public Optional<SyncEntity> get(String id) {
        return store.get(id);
    }

    public List<SyncEntity> list() {
        return store.list();
    }

    public Optional<SyncStatus> getStatus(String id) {
        return store.get(id).map(SyncEntity::getSyncStatus);
    }

    public boolean isPending(String id) {
        return registry.isPending(id);
    }

    public int pendingCount() {
        return registry.size();
    }

    public void addListener(StoreListener listener) {
        store.addListener(listener);
    }

    public void removeListener(StoreListener listener) {
        store.removeListener(listener);
    }

    // ========== Server-driven updates ==========

    /**
     * Fetches one entity and adopts it as {@code SYNCED}, unless a local mutation is pending.
     * During a conflict reconciliation the copy is handed to the resolver.
     *
     * @return the entity as stored after the load
     */
    public CompletableFuture<Optional<SyncEntity>> load(String id) {
        CompletableFuture<LoadResponse> future;
        try {
            future = protocolClient.requestLoad(id);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return future.thenApply(response -> entityLock.callLocked(id, () -> {
            SyncEntity copy = response != null ? response.entity() : null;
            if (copy == null) {
                log.debug("Load of {} returned nothing{}", id,
                        response != null && response.error() != null ? ": " + response.error() : "");
                return store.get(id);
            }
            if (conflictResolver.onAuthoritativeCopy(copy)) {
                return store.get(id);
            }
            if (registry.isPending(id) || tombstones.contains(id)) {
                log.debug("Not adopting loaded copy of {}: local mutation outstanding", id);
                return store.get(id);
            }
            adopt(copy);
            return store.get(id);
        }));
    }

    /**
     * Fetches the list of entities visible to the user and merges it into the store.
     * Entities with pending mutations, reconciliations or failed mutations keep their local
     * state. Entities that were synced when the list was requested and are missing from it
     * are removed; anything confirmed while the list was in flight is kept.
     *
     * @return the store contents after the refresh
     */
    public CompletableFuture<List<SyncEntity>> refreshAll() {
        Set<String> syncedAtRequest = new HashSet<>();
        for (SyncEntity local : store.list()) {
            if (local.getSyncStatus() == SyncStatus.SYNCED && !mutationQueue.isTemporary(local.getId())) {
                syncedAtRequest.add(local.getId());
            }
        }
        CompletableFuture<ListResponse> future;
        try {
            future = protocolClient.requestList();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return future.thenApply(response -> {
            applyList(response != null ? response.entities() : List.of(), syncedAtRequest);
            return store.list();
        });
    }

    /**
     * Applies a change broadcast by the server on behalf of another client.
     */
    public void applyRemoteChange(RemoteChange change) {
        String id = change.entityId();
        entityLock.runLocked(id, () -> {
            try (LogContext ctx = LogContext.forRefresh("remote-" + change.type().name().toLowerCase())
                    .with(LogContext.ENTITY_ID, id)) {
                if (change.type() == RemoteChange.Type.DELETE) {
                    registry.cancel(id);
                    conflictResolver.abandon(id);
                    mutationQueue.forget(id);
                    tombstones.add(id);
                    if (store.remove(id).isPresent()) {
                        log.info("Entity {} deleted by another client", id);
                    }
                    return;
                }
                if (registry.isPending(id) || conflictResolver.isReconciling(id)) {
                    log.debug("Ignoring remote {} of {}: local mutation outstanding", change.type(), id);
                    return;
                }
                if (change.type() == RemoteChange.Type.UPSERT) {
                    applyRemoteUpsert(change.entity());
                } else {
                    applyRemoteDelta(change);
                }
            }
        });
    }

    /**
     * Sends every entity created while the transport was unavailable.
     *
     * @return the number of entities sent
     */
    public int onTransportAvailable() {
        return mutationQueue.flushLocal();
    }

    public SyncOptions getOptions() {
        return options;
    }

    /**
     * Stops all deadline timers without rolling anything back. The scheduler is closed
     * only when it was created by this service.
     */
    @Override
    public void close() {
        registry.clear();
        conflictResolver.clear();
        if (ownsScheduler) {
            scheduler.close();
        }
        log.info("EntitySyncService closed");
    }

    private void applyList(List<SyncEntity> entities, Set<String> syncedAtRequest) {
        try (LogContext ctx = LogContext.forRefresh("refresh")) {
            Set<String> serverIds = new HashSet<>();
            int adopted = 0;
            for (SyncEntity entity : entities) {
                serverIds.add(entity.getId());
                boolean taken = entityLock.callLocked(entity.getId(), () -> {
                    String id = entity.getId();
                    if (tombstones.contains(id) || registry.isPending(id) || conflictResolver.isReconciling(id)) {
                        return false;
                    }
                    Optional<SyncEntity> existing = store.get(id);
                    if (existing.map(e -> e.getSyncStatus() == SyncStatus.ERROR).orElse(false)) {
                        return false;
                    }
                    if (existing.isPresent() && existing.get().getVersion() > entity.getVersion()) {
                        log.debug("Keeping {} v{} over listed v{}", id, existing.get().getVersion(), entity.getVersion());
                        return false;
                    }
                    return adopt(entity);
                });
                if (taken) {
                    adopted++;
                }
            }
            int removed = 0;
            for (String id : syncedAtRequest) {
                if (serverIds.contains(id)) {
                    continue;
                }
                boolean dropped = entityLock.callLocked(id, () -> {
                    Optional<SyncEntity> current = store.get(id);
                    if (current.isEmpty() || current.get().getSyncStatus() != SyncStatus.SYNCED
                            || registry.isPending(id)) {
                        return false;
                    }
                    store.remove(id);
                    mutationQueue.forget(id);
                    return true;
                });
                if (dropped) {
                    removed++;
                }
            }
            log.info("Refreshed from server: {} received, {} adopted, {} removed", entities.size(), adopted, removed);
        }
    }

    private void applyRemoteUpsert(SyncEntity entity) {
        String id = entity.getId();
        if (tombstones.contains(id)) {
            log.debug("Ignoring remote upsert of deleted entity {}", id);
            return;
        }
        Optional<SyncEntity> existing = store.get(id);
        if (existing.isPresent() && entity.getVersion() < existing.get().getVersion()) {
            log.debug("Ignoring stale remote upsert of {} (v{} < v{})",
                    id, entity.getVersion(), existing.get().getVersion());
            return;
        }
        adopt(entity);
    }

    private void applyRemoteDelta(RemoteChange change) {
        String id = change.entityId();
        Optional<SyncEntity> existing = store.get(id);
        if (existing.isEmpty()) {
            log.debug("Ignoring remote delta for unknown entity {}", id);
            return;
        }
        SyncEntity current = existing.get();
        if (change.version() != null && change.version() <= current.getVersion()) {
            log.debug("Ignoring stale remote delta of {} (v{} <= v{})", id, change.version(), current.getVersion());
            return;
        }
        if (!stateMachine.canTransition(current.getSyncStatus(), SyncEvent.AUTHORITATIVE_COPY)) {
            return;
        }
        store.update(id, e -> {
            SyncEntity merged = stateMachine.apply(e.merge(change.updates()), SyncEvent.AUTHORITATIVE_COPY);
            return change.version() != null ? merged.withVersion(change.version()) : merged;
        });
        log.debug("Applied remote delta to {} ({})", id, change.updates().keySet());
    }

    /**
     * Stores an authoritative copy as {@code SYNCED}. Never-sent local entities are left alone.
     */
    private boolean adopt(SyncEntity copy) {
        Optional<SyncEntity> existing = store.get(copy.getId());
        SyncStatus from = existing.map(SyncEntity::getSyncStatus).orElse(SyncStatus.SYNCED);
        if (!stateMachine.canTransition(from, SyncEvent.AUTHORITATIVE_COPY)) {
            return false;
        }
        store.upsert(copy.withStatus(stateMachine.next(from, SyncEvent.AUTHORITATIVE_COPY)));
        return true;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ProtocolClient protocolClient;
        private SyncOptions options = SyncOptions.defaults();
        private EntityStore store;
        private TombstoneCache tombstones;
        private EntityLock entityLock;
        private SyncScheduler scheduler;
        private SyncNotifier notifier;
        private SyncMetrics metrics;
        private Supplier<String> currentUser;

        /**
         * Sets the client used to reach the server. Required.
         */
        public Builder protocolClient(ProtocolClient protocolClient) {
            this.protocolClient = protocolClient;
            return this;
        }

        /**
         * Sets sync options.
         */
        public Builder options(SyncOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        /**
         * Sets a custom entity store.
         * Defaults to {@link InMemoryEntityStore} if not set.
         */
        public Builder store(EntityStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets a custom tombstone cache.
         * Defaults to one sized and timed from the options.
         */
        public Builder tombstones(TombstoneCache tombstones) {
            this.tombstones = tombstones;
            return this;
        }

        /**
         * Sets a custom entity lock.
         * Defaults to {@link LocalEntityLock} if not set.
         */
        public Builder entityLock(EntityLock entityLock) {
            this.entityLock = entityLock;
            return this;
        }

        /**
         * Sets the scheduler for deadlines. A scheduler passed here is not closed by the service.
         * Defaults to an {@link ExecutorSyncScheduler} owned by the service.
         */
        public Builder scheduler(SyncScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Sets the receiver of user-facing notifications.
         * Defaults to {@link NoOpSyncNotifier} if not set.
         */
        public Builder notifier(SyncNotifier notifier) {
            this.notifier = notifier;
            return this;
        }

        /**
         * Sets a custom metrics implementation.
         * Defaults to {@link NoOpSyncMetrics} if not set.
         */
        public Builder metrics(SyncMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the supplier of the signed-in user's id. Mutations fail while it returns null.
         */
        public Builder currentUser(Supplier<String> currentUser) {
            this.currentUser = currentUser;
            return this;
        }

        public EntitySyncService build() {
            if (protocolClient == null) {
                throw new IllegalStateException("ProtocolClient is required");
            }
            return new EntitySyncService(this);
        }
    }
}
