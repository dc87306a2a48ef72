package com.entity.sync.mutation;

import com.entity.sync.api.SyncOptions;
import com.entity.sync.conflict.ConflictResolver;
import com.entity.sync.core.model.FailureReason;
import com.entity.sync.core.model.Mutation;
import com.entity.sync.core.model.OperationKind;
import com.entity.sync.core.model.Payloads;
import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.core.model.SyncStatus;
import com.entity.sync.core.model.VersionConflict;
import com.entity.sync.lock.EntityLock;
import com.entity.sync.logging.LogContext;
import com.entity.sync.metrics.SyncMetrics;
import com.entity.sync.notify.SyncNotification;
import com.entity.sync.notify.SyncNotifier;
import com.entity.sync.pending.OperationRollback;
import com.entity.sync.pending.PendingOperation;
import com.entity.sync.pending.PendingOperationRegistry;
import com.entity.sync.protocol.DeleteResponse;
import com.entity.sync.protocol.ProtocolClient;
import com.entity.sync.protocol.SaveResponse;
import com.entity.sync.protocol.UpdateResponse;
import com.entity.sync.schedule.SyncScheduler;
import com.entity.sync.state.SyncEvent;
import com.entity.sync.state.SyncStateMachine;
import com.entity.sync.store.EntityStore;
import com.entity.sync.store.TombstoneCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Applies mutations optimistically and sends them to the server.
 *
 * <p>Every public operation runs under the entity lock, applies its change to the store
 * immediately and returns without waiting for the server. Responses are handled on the
 * completing thread under the same lock: a response whose operation is no longer current
 * is stale and ignored.</p>
 */
public class MutationQueue {
    private static final Logger log = LoggerFactory.getLogger(MutationQueue.class);

    static final String COPY_SUFFIX = " (Copy)";

    private final EntityStore store;
    private final PendingOperationRegistry registry;
    private final OperationRollback rollback;
    private final ConflictResolver conflictResolver;
    private final ProtocolClient protocolClient;
    private final SyncStateMachine stateMachine;
    private final TombstoneCache tombstones;
    private final EntityLock entityLock;
    private final SyncScheduler scheduler;
    private final SyncNotifier notifier;
    private final SyncMetrics metrics;
    private final PayloadValidator validator;
    private final TempIdGenerator tempIds;
    private final Duration pendingTimeout;
    private final Supplier<String> currentUser;

    private final Map<String, Mutation> lastMutations = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> deferredEdits = new ConcurrentHashMap<>();

    public MutationQueue(EntityStore store, PendingOperationRegistry registry, OperationRollback rollback,
                         ConflictResolver conflictResolver, ProtocolClient protocolClient,
                         SyncStateMachine stateMachine, TombstoneCache tombstones, EntityLock entityLock,
                         SyncScheduler scheduler, SyncNotifier notifier, SyncMetrics metrics,
                         PayloadValidator validator, SyncOptions options, Supplier<String> currentUser) {
        this.store = store;
        this.registry = registry;
        this.rollback = rollback;
        this.conflictResolver = conflictResolver;
        this.protocolClient = protocolClient;
        this.stateMachine = stateMachine;
        this.tombstones = tombstones;
        this.entityLock = entityLock;
        this.scheduler = scheduler;
        this.notifier = notifier;
        this.metrics = metrics;
        this.validator = validator;
        this.tempIds = new TempIdGenerator(options.getTempIdPrefix());
        this.pendingTimeout = options.getPendingTimeout();
        this.currentUser = currentUser;
    }

    // ========== Create ==========

    /**
     * Creates an entity under a temporary id. When the transport is connected the entity is
     * {@code SYNCING} and a save request is sent; otherwise it stays {@code LOCAL} until
     * {@link #flushLocal()} or {@link #retry(String)}.
     *
     * @return the optimistic entity
     * @throws MissingIdentityException if no user is signed in
     * @throws ValidationException      if the payload is rejected
     */
    public SyncEntity create(Map<String, ?> payload) {
        String userId = requireIdentity();
        validator.validateCreate(payload);
        String tempId = tempIds.next();
        return entityLock.callLocked(tempId, () -> {
            SyncEntity entity = SyncEntity.builder()
                    .id(tempId)
                    .payload(payload)
                    .ownerId(userId)
                    .syncStatus(stateMachine.initialStatus())
                    .build();
            Mutation mutation = Mutation.create(tempId, entity.getPayload());
            lastMutations.put(tempId, mutation);
            if (!protocolClient.isConnected()) {
                store.upsert(entity);
                log.info("Created {} locally; it will be sent when the connection is available", tempId);
                return entity;
            }
            SyncEntity syncing = stateMachine.apply(entity, SyncEvent.MUTATION_ISSUED);
            store.upsert(syncing);
            dispatchCreate(syncing, mutation);
            return syncing;
        });
    }

    /**
     * Creates a deep copy of an entity named {@code "<name> (Copy)"}, owned by the current user.
     */
    public SyncEntity cloneEntity(String id) {
        SyncEntity source = store.get(id).orElseThrow(() -> new EntityNotFoundException(id));
        Map<String, Object> payload = new LinkedHashMap<>(source.getPayload());
        String name = source.getName() != null ? source.getName() : id;
        payload.put(SyncEntity.NAME_FIELD, name + COPY_SUFFIX);
        return create(payload);
    }

    // ========== Update ==========

    /**
     * Updates an entity based on its current version.
     */
    public SyncEntity update(String id, Map<String, ?> partial) {
        return update(id, partial, null);
    }

    /**
     * Applies {@code partial} locally and sends it with {@code expectedVersion}.
     * Entities that only exist locally (temporary ids) are edited locally; if their create is
     * in flight, the edit is sent once the server has assigned an id.
     *
     * @param expectedVersion the version the edit is based on, or null for the current version
     * @return the optimistic entity
     */
    public SyncEntity update(String id, Map<String, ?> partial, Long expectedVersion) {
        String userId = requireIdentity();
        validator.validatePartial(partial);
        return entityLock.callLocked(id, () -> {
            SyncEntity current = requireEditable(id, userId);
            if (tempIds.isTemporary(id)) {
                return editLocally(current, partial);
            }
            long version = expectedVersion != null ? expectedVersion : current.getVersion();
            return dispatchUpdate(current, Payloads.deepCopy(partial), version);
        });
    }

    // ========== Delete ==========

    /**
     * Removes an entity immediately and sends a delete. Entities with a temporary id
     * are discarded locally only.
     */
    public void delete(String id) {
        String userId = requireIdentity();
        entityLock.runLocked(id, () -> {
            SyncEntity current = requireEditable(id, userId);
            if (tempIds.isTemporary(id)) {
                discardLocal(id);
                return;
            }
            dispatchDelete(current);
        });
    }

    /**
     * Deletes every id it can. Unknown ids and entities the user may not edit are reported
     * as failures; the others are deleted as by {@link #delete(String)}.
     */
    public BulkDeleteResult deleteAll(Collection<String> ids) {
        requireIdentity();
        List<String> deleted = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String id : ids) {
            try {
                delete(id);
                deleted.add(id);
            } catch (EntityNotFoundException | AccessDeniedException e) {
                failed.put(id, e.getMessage());
            }
        }
        log.info("Bulk delete: {} deleted, {} failed", deleted.size(), failed.size());
        return new BulkDeleteResult(deleted, failed);
    }

    // ========== Retry / discard ==========

    /**
     * Re-sends the failed or never-sent mutation of an {@code ERROR} or {@code LOCAL} entity.
     *
     * @return true if a request was sent; false when there is nothing to retry or the
     *         transport is not connected
     */
    public boolean retry(String id) {
        requireIdentity();
        return entityLock.callLocked(id, () -> {
            SyncEntity current = store.get(id).orElseThrow(() -> new EntityNotFoundException(id));
            SyncStatus status = current.getSyncStatus();
            if (status != SyncStatus.ERROR && status != SyncStatus.LOCAL) {
                log.debug("Nothing to retry for {} in status {}", id, status);
                return false;
            }
            if (!protocolClient.isConnected()) {
                notifier.notify(SyncNotification.warning(id,
                        "Cannot retry '" + displayName(current) + "' while disconnected"));
                return false;
            }
            if (tempIds.isTemporary(id)) {
                SyncEntity syncing = stateMachine.apply(current, SyncEvent.MUTATION_ISSUED);
                store.upsert(syncing);
                Mutation mutation = Mutation.create(id, syncing.getPayload());
                lastMutations.put(id, mutation);
                dispatchCreate(syncing, mutation);
                return true;
            }
            Mutation last = lastMutations.get(id);
            if (last == null) {
                log.debug("No failed mutation recorded for {}", id);
                return false;
            }
            switch (last.kind()) {
                case UPDATE -> dispatchUpdate(current, last.payload(), current.getVersion());
                case DELETE -> dispatchDelete(current);
                case CREATE -> {
                    log.warn("Recorded create for server id {} cannot be retried", id);
                    return false;
                }
            }
            return true;
        });
    }

    /**
     * Discards a failed mutation. A never-synced entity is removed; for a server entity the
     * failed mutation is forgotten and the caller is expected to reload it.
     *
     * @return true if something was discarded
     */
    public boolean discard(String id) {
        return entityLock.callLocked(id, () -> {
            Optional<SyncEntity> current = store.get(id);
            if (current.isEmpty()) {
                return false;
            }
            if (tempIds.isTemporary(id)) {
                discardLocal(id);
                notifier.notify(SyncNotification.info(id, "Discarded '" + displayName(current.get()) + "'"));
                return true;
            }
            if (current.get().getSyncStatus() != SyncStatus.ERROR) {
                return false;
            }
            lastMutations.remove(id);
            log.info("Discarded failed mutation on {}", id);
            return true;
        });
    }

    /**
     * Sends every {@code LOCAL} entity, typically once the transport becomes available.
     *
     * @return the number of entities sent
     */
    public int flushLocal() {
        if (!protocolClient.isConnected()) {
            return 0;
        }
        int sent = 0;
        for (SyncEntity entity : store.list()) {
            if (entity.getSyncStatus() == SyncStatus.LOCAL && retry(entity.getId())) {
                sent++;
            }
        }
        if (sent > 0) {
            log.info("Sent {} local entities", sent);
        }
        return sent;
    }

    public boolean isTemporary(String id) {
        return tempIds.isTemporary(id);
    }

    /**
     * Forgets everything recorded for an id that was removed by another party.
     */
    public void forget(String id) {
        lastMutations.remove(id);
        deferredEdits.remove(id);
    }

    // ========== Dispatch ==========

    private void dispatchCreate(SyncEntity entity, Mutation mutation) {
        String id = entity.getId();
        deferredEdits.remove(id);
        PendingOperation op = registry.register(id, OperationKind.CREATE, entity, mutation, pendingTimeout);
        metrics.incrementMutationIssued(OperationKind.CREATE);
        CompletableFuture<SaveResponse> future;
        try (LogContext ctx = LogContext.forMutation(id, OperationKind.CREATE, op.getSequence())) {
            log.debug("Sending create for '{}'", entity.getName());
            future = protocolClient.requestSave(entity);
        } catch (RuntimeException e) {
            failTransport(op, e);
            return;
        }
        future.whenComplete((response, error) -> complete(op, () -> handleSave(op, response, error)));
    }

    private SyncEntity dispatchUpdate(SyncEntity current, Map<String, Object> partial, long expectedVersion) {
        String id = current.getId();
        SyncEntity original = confirmedState(current);
        conflictResolver.abandon(id);
        SyncEntity optimistic = stateMachine.apply(current.merge(partial), SyncEvent.MUTATION_ISSUED);
        store.upsert(optimistic);
        Mutation mutation = Mutation.update(id, partial, expectedVersion);
        lastMutations.put(id, mutation);
        PendingOperation op = registry.register(id, OperationKind.UPDATE, original, mutation, pendingTimeout);
        metrics.incrementMutationIssued(OperationKind.UPDATE);
        CompletableFuture<UpdateResponse> future;
        try (LogContext ctx = LogContext.forMutation(id, OperationKind.UPDATE, op.getSequence())) {
            log.debug("Sending update of {} based on v{}", partial.keySet(), expectedVersion);
            future = protocolClient.requestUpdate(id, mutation.payload(), expectedVersion);
        } catch (RuntimeException e) {
            failTransport(op, e);
            return store.get(id).orElse(optimistic);
        }
        future.whenComplete((response, error) -> complete(op, () -> handleUpdate(op, response, error)));
        return optimistic;
    }

    private void dispatchDelete(SyncEntity current) {
        String id = current.getId();
        SyncEntity original = confirmedState(current);
        conflictResolver.abandon(id);
        store.remove(id);
        tombstones.add(id);
        Mutation mutation = Mutation.delete(id);
        lastMutations.put(id, mutation);
        PendingOperation op = registry.register(id, OperationKind.DELETE, original, mutation, pendingTimeout);
        metrics.incrementMutationIssued(OperationKind.DELETE);
        CompletableFuture<DeleteResponse> future;
        try (LogContext ctx = LogContext.forMutation(id, OperationKind.DELETE, op.getSequence())) {
            log.debug("Sending delete");
            future = protocolClient.requestDelete(id);
        } catch (RuntimeException e) {
            failTransport(op, e);
            return;
        }
        future.whenComplete((response, error) -> complete(op, () -> handleDelete(op, response, error)));
    }

    /**
     * The state a rollback must restore: when an update is still pending, its original
     * state is the last confirmed one, not the optimistic copy in the store.
     */
    private SyncEntity confirmedState(SyncEntity current) {
        return registry.get(current.getId())
                .filter(op -> op.getKind() == OperationKind.UPDATE && op.getOriginalState() != null)
                .map(PendingOperation::getOriginalState)
                .orElse(current);
    }

    private SyncEntity editLocally(SyncEntity current, Map<String, ?> partial) {
        String id = current.getId();
        SyncEntity edited = stateMachine.apply(current.merge(partial), SyncEvent.LOCAL_EDIT);
        store.upsert(edited);
        boolean createInFlight = registry.get(id)
                .filter(op -> op.getKind() == OperationKind.CREATE)
                .isPresent();
        if (createInFlight) {
            deferredEdits.merge(id, Payloads.deepCopy(partial), Payloads::shallowMerge);
            log.debug("Deferred edit of {} until its create is confirmed", id);
        }
        return edited;
    }

    private void discardLocal(String tempId) {
        registry.cancel(tempId);
        deferredEdits.remove(tempId);
        lastMutations.remove(tempId);
        store.remove(tempId);
        tombstones.add(tempId);
        log.info("Discarded never-synced entity {}", tempId);
    }

    // ========== Responses ==========

    private void complete(PendingOperation op, Runnable handler) {
        try {
            entityLock.runLocked(op.getEntityId(), () -> {
                try (LogContext ctx = LogContext.forMutation(op.getEntityId(), op.getKind(), op.getSequence())) {
                    handler.run();
                }
            });
        } catch (RuntimeException e) {
            log.error("Handling {} response for {} failed", op.getKind(), op.getEntityId(), e);
        }
    }

    private void handleSave(PendingOperation op, SaveResponse response, Throwable error) {
        String tempId = op.getEntityId();
        if (error != null || response == null) {
            failTransport(op, error);
            return;
        }
        if (!registry.isCurrent(op)) {
            boolean created = response.success() && response.assignedId() != null;
            if (created && !tombstones.contains(tempId) && adoptLateCreate(op, response)) {
                return;
            }
            stale(op);
            if (created && tombstones.contains(tempId)) {
                cleanupDelete(tempId, response.assignedId());
            }
            return;
        }
        if (!response.success() || response.assignedId() == null) {
            if (registry.fail(op)) {
                rollback.rollback(op, FailureReason.REJECTED,
                        response.error() != null ? response.error() : "no id assigned");
            }
            return;
        }
        if (!registry.confirm(op)) {
            stale(op);
            return;
        }
        metrics.recordMutationConfirmed(OperationKind.CREATE, roundTrip(op));
        String assignedId = response.assignedId();
        SyncEntity current = store.get(tempId).orElse(op.getOriginalState());
        SyncEntity confirmed = stateMachine.apply(current, SyncEvent.CONFIRMED).toBuilder()
                .id(assignedId)
                .version(response.version() != null ? response.version() : current.getVersion())
                .build();
        store.replace(tempId, confirmed);
        lastMutations.remove(tempId);
        log.info("Create confirmed: {} -> {} (v{})", tempId, assignedId, confirmed.getVersion());
        notifier.notify(SyncNotification.success(assignedId, "'" + displayName(confirmed) + "' created"));

        Map<String, Object> deferred = deferredEdits.remove(tempId);
        if (deferred != null && !deferred.isEmpty()) {
            entityLock.runLocked(assignedId, () -> store.get(assignedId).ifPresent(entity -> {
                log.debug("Sending edits deferred while {} was being created", tempId);
                dispatchUpdate(entity, deferred, entity.getVersion());
            }));
        }
    }

    /**
     * Keeps the server id of a create that expired but still succeeded, as long as the
     * entity is still failed under its temporary id with nothing newer in flight. Local edits
     * made since the create was sent are pushed as an update against the assigned id.
     *
     * @return false when the response is stale and must be ignored
     */
    private boolean adoptLateCreate(PendingOperation op, SaveResponse response) {
        String tempId = op.getEntityId();
        Optional<SyncEntity> current = store.get(tempId);
        if (registry.isPending(tempId) || current.isEmpty() || current.get().getSyncStatus() != SyncStatus.ERROR) {
            return false;
        }
        SyncEntity local = current.get();
        String assignedId = response.assignedId();
        long version = response.version() != null ? response.version() : local.getVersion();
        SyncEntity adopted = local.toBuilder().id(assignedId).version(version).build();
        lastMutations.remove(tempId);
        deferredEdits.remove(tempId);
        log.info("Create of {} succeeded after its deadline as {} (v{})", tempId, assignedId, version);

        SyncEntity sent = op.getOriginalState();
        if (sent == null || sent.getPayload().equals(local.getPayload())) {
            SyncEntity synced = stateMachine.apply(adopted, SyncEvent.AUTHORITATIVE_COPY);
            store.replace(tempId, synced);
            notifier.notify(SyncNotification.success(assignedId, "'" + displayName(synced) + "' created"));
            return true;
        }
        store.replace(tempId, adopted);
        entityLock.runLocked(assignedId, () -> dispatchUpdate(adopted, local.getPayload(), version));
        return true;
    }

    private void handleUpdate(PendingOperation op, UpdateResponse response, Throwable error) {
        String id = op.getEntityId();
        if (error != null || response == null) {
            failTransport(op, error);
            return;
        }
        if (!registry.isCurrent(op)) {
            stale(op);
            return;
        }
        if (response.success()) {
            if (!registry.confirm(op)) {
                stale(op);
                return;
            }
            metrics.recordMutationConfirmed(OperationKind.UPDATE, roundTrip(op));
            store.update(id, entity -> {
                SyncEntity synced = stateMachine.apply(entity, SyncEvent.CONFIRMED);
                return response.newVersion() != null ? synced.withVersion(response.newVersion()) : synced;
            });
            lastMutations.remove(id);
            log.debug("Update confirmed for {} (v{})", id, response.newVersion());
            return;
        }
        if (response.isConflict()) {
            long claimed = op.getMutation().expectedVersion() != null ? op.getMutation().expectedVersion() : 0L;
            long currentVersion = response.currentVersion() != null ? response.currentVersion() : 0L;
            conflictResolver.onConflict(op, new VersionConflict(id, claimed, currentVersion));
            return;
        }
        if (registry.fail(op)) {
            rollback.rollback(op, FailureReason.REJECTED, response.error());
        }
    }

    private void handleDelete(PendingOperation op, DeleteResponse response, Throwable error) {
        String id = op.getEntityId();
        if (error != null || response == null) {
            failTransport(op, error);
            return;
        }
        if (!registry.isCurrent(op)) {
            stale(op);
            return;
        }
        if (!response.success()) {
            if (registry.fail(op)) {
                rollback.rollback(op, FailureReason.REJECTED, response.error());
            }
            return;
        }
        if (!registry.confirm(op)) {
            stale(op);
            return;
        }
        metrics.recordMutationConfirmed(OperationKind.DELETE, roundTrip(op));
        lastMutations.remove(id);
        log.info("Delete confirmed for {}", id);
        SyncEntity original = op.getOriginalState();
        notifier.notify(SyncNotification.success(id,
                "'" + (original != null ? displayName(original) : id) + "' deleted"));
    }

    private void failTransport(PendingOperation op, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (registry.fail(op)) {
            rollback.rollback(op, FailureReason.TRANSPORT, cause != null ? cause.getMessage() : "empty response");
        } else {
            stale(op);
        }
    }

    private void stale(PendingOperation op) {
        metrics.incrementStaleResponse(op.getKind());
        log.debug("Ignoring stale {} response #{} for {}", op.getKind(), op.getSequence(), op.getEntityId());
    }

    private void cleanupDelete(String tempId, String assignedId) {
        log.info("Create of discarded {} succeeded late as {}; deleting the server copy", tempId, assignedId);
        try {
            protocolClient.requestDelete(assignedId).whenComplete((response, error) -> {
                if (error != null || response == null || !response.success()) {
                    log.warn("Cleanup delete of {} failed: {}", assignedId,
                            error != null ? error.getMessage() : response != null ? response.error() : "no response");
                }
            });
        } catch (RuntimeException e) {
            log.warn("Cleanup delete of {} could not be sent: {}", assignedId, e.getMessage());
        }
    }

    // ========== Helpers ==========

    private String requireIdentity() {
        String userId = currentUser.get();
        if (userId == null || userId.isBlank()) {
            throw new MissingIdentityException("No authenticated user; sign in before changing entities");
        }
        return userId;
    }

    private SyncEntity requireEditable(String id, String userId) {
        SyncEntity current = store.get(id).orElseThrow(() -> new EntityNotFoundException(id));
        if (!current.canEdit(userId)) {
            throw new AccessDeniedException("User " + userId + " may not modify " + id);
        }
        return current;
    }

    private Duration roundTrip(PendingOperation op) {
        return Duration.between(op.getIssuedAt(), scheduler.now());
    }

    private static String displayName(SyncEntity entity) {
        return entity.getName() != null ? entity.getName() : entity.getId();
    }
}
