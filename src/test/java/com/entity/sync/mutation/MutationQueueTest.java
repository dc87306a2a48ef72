package com.entity.sync.mutation;

import com.entity.sync.api.SyncOptions;
import com.entity.sync.conflict.ConflictResolver;
import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.core.model.SyncStatus;
import com.entity.sync.lock.LocalEntityLock;
import com.entity.sync.metrics.NoOpSyncMetrics;
import com.entity.sync.notify.SyncNotification;
import com.entity.sync.pending.CreateRollbackPolicy;
import com.entity.sync.pending.OperationRollback;
import com.entity.sync.pending.PendingOperationRegistry;
import com.entity.sync.protocol.SaveResponse;
import com.entity.sync.protocol.UpdateResponse;
import com.entity.sync.state.SyncStateMachine;
import com.entity.sync.store.InMemoryEntityStore;
import com.entity.sync.store.TombstoneCache;
import com.entity.sync.testing.FakeProtocolClient;
import com.entity.sync.testing.ManualScheduler;
import com.entity.sync.testing.RecordingNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MutationQueueTest {

    private FakeProtocolClient client;
    private InMemoryEntityStore store;
    private TombstoneCache tombstones;
    private ManualScheduler scheduler;
    private RecordingNotifier notifier;
    private PendingOperationRegistry registry;
    private MutationQueue queue;

    @BeforeEach
    void setUp() {
        client = new FakeProtocolClient();
        store = new InMemoryEntityStore();
        tombstones = new TombstoneCache(100, Duration.ofMinutes(5));
        scheduler = new ManualScheduler();
        notifier = new RecordingNotifier();
        LocalEntityLock lock = new LocalEntityLock();
        SyncStateMachine stateMachine = new SyncStateMachine();
        NoOpSyncMetrics metrics = new NoOpSyncMetrics();
        OperationRollback rollback = new OperationRollback(store, tombstones, stateMachine, notifier, metrics,
                CreateRollbackPolicy.MARK_ERROR);
        registry = new PendingOperationRegistry(scheduler, lock, rollback);
        ConflictResolver resolver = new ConflictResolver(client, store, registry, lock, scheduler, stateMachine,
                notifier, metrics, Duration.ofSeconds(5));
        queue = new MutationQueue(store, registry, rollback, resolver, client, stateMachine, tombstones, lock,
                scheduler, notifier, metrics, new PayloadValidator(), SyncOptions.defaults(), () -> "u-1");
    }

    private void seedSynced(String id, String name) {
        store.upsert(SyncEntity.builder()
                .id(id)
                .version(2)
                .payload(Map.of("name", name, "hp", 10))
                .ownerId("u-1")
                .syncStatus(SyncStatus.SYNCED)
                .build());
    }

    @Nested
    @DisplayName("Retry")
    class RetryTests {

        @Test
        @DisplayName("Should re-send the failed update based on the current version")
        void testRetryUpdate() {
            seedSynced("c-1", "Aria");
            queue.update("c-1", Map.of("hp", 3));
            client.lastUpdate().future().complete(UpdateResponse.failed("busy"));
            assertEquals(SyncStatus.ERROR, store.get("c-1").orElseThrow().getSyncStatus());

            assertTrue(queue.retry("c-1"));

            assertEquals(2, client.updates.size());
            assertEquals(Map.of("hp", 3), client.lastUpdate().partial());
            assertEquals(2, client.lastUpdate().expectedVersion());
            assertEquals(3, store.get("c-1").orElseThrow().getPayload().get("hp"));
            assertEquals(SyncStatus.SYNCING, store.get("c-1").orElseThrow().getSyncStatus());
        }

        @Test
        @DisplayName("Should refuse to retry while disconnected")
        void testRetryOffline() {
            seedSynced("c-1", "Aria");
            queue.update("c-1", Map.of("hp", 3));
            client.lastUpdate().future().complete(UpdateResponse.failed("busy"));
            client.setConnected(false);

            assertFalse(queue.retry("c-1"));

            assertEquals(SyncNotification.Level.WARNING, notifier.last().level());
            assertEquals("Cannot retry 'Aria' while disconnected", notifier.last().message());
        }

        @Test
        @DisplayName("Should have nothing to retry for a synced entity")
        void testRetrySynced() {
            seedSynced("c-1", "Aria");

            assertFalse(queue.retry("c-1"));
            assertThrows(EntityNotFoundException.class, () -> queue.retry("c-404"));
        }
    }

    @Nested
    @DisplayName("Discard")
    class DiscardTests {

        @Test
        @DisplayName("Should remove a never-synced entity")
        void testDiscardLocal() {
            client.setConnected(false);
            SyncEntity local = queue.create(Map.of("name", "Aria"));

            assertTrue(queue.discard(local.getId()));

            assertFalse(store.contains(local.getId()));
            assertTrue(tombstones.contains(local.getId()));
            assertEquals("Discarded 'Aria'", notifier.last().message());
        }

        @Test
        @DisplayName("Should only discard failed server entities")
        void testDiscardServerEntity() {
            seedSynced("c-1", "Aria");

            assertFalse(queue.discard("c-1"));
            assertFalse(queue.discard("c-404"));
        }
    }

    @Nested
    @DisplayName("Local entities")
    class LocalTests {

        @Test
        @DisplayName("Should send every local entity once connected")
        void testFlushLocal() {
            client.setConnected(false);
            queue.create(Map.of("name", "A"));
            queue.create(Map.of("name", "B"));
            assertEquals(0, queue.flushLocal());

            client.setConnected(true);
            assertEquals(2, queue.flushLocal());
            assertEquals(2, client.saves.size());
            assertEquals(2, registry.size());
        }

        @Test
        @DisplayName("Should edit a local entity without sending anything")
        void testEditLocal() {
            client.setConnected(false);
            SyncEntity local = queue.create(Map.of("name", "Aria"));

            SyncEntity edited = queue.update(local.getId(), Map.of("hp", 4));

            assertEquals(SyncStatus.LOCAL, edited.getSyncStatus());
            assertEquals(4, edited.getPayload().get("hp"));
            assertTrue(client.updates.isEmpty());
        }

        @Test
        @DisplayName("Should recognize temporary ids")
        void testIsTemporary() {
            SyncEntity created = queue.create(Map.of("name", "Aria"));

            assertTrue(queue.isTemporary(created.getId()));
            client.lastSave().future().complete(SaveResponse.ok("c-9", 1L));
            assertFalse(queue.isTemporary("c-9"));
        }
    }

    @Test
    @DisplayName("Should fail missing entities")
    void testUnknownEntity() {
        assertThrows(EntityNotFoundException.class, () -> queue.update("c-404", Map.of("hp", 1)));
        assertThrows(EntityNotFoundException.class, () -> queue.delete("c-404"));
        assertThrows(EntityNotFoundException.class, () -> queue.cloneEntity("c-404"));
    }
}
