package com.entity.sync.conflict;

import com.entity.sync.core.model.Mutation;
import com.entity.sync.core.model.OperationKind;
import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.core.model.SyncStatus;
import com.entity.sync.core.model.VersionConflict;
import com.entity.sync.lock.LocalEntityLock;
import com.entity.sync.metrics.MicrometerSyncMetrics;
import com.entity.sync.pending.PendingOperation;
import com.entity.sync.pending.PendingOperationRegistry;
import com.entity.sync.protocol.LoadResponse;
import com.entity.sync.state.SyncStateMachine;
import com.entity.sync.store.InMemoryEntityStore;
import com.entity.sync.testing.FakeProtocolClient;
import com.entity.sync.testing.ManualScheduler;
import com.entity.sync.testing.RecordingNotifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    private FakeProtocolClient client;
    private InMemoryEntityStore store;
    private ManualScheduler scheduler;
    private PendingOperationRegistry registry;
    private List<PendingOperation> expired;
    private SimpleMeterRegistry meterRegistry;
    private RecordingNotifier notifier;
    private ConflictResolver resolver;

    @BeforeEach
    void setUp() {
        client = new FakeProtocolClient();
        store = new InMemoryEntityStore();
        scheduler = new ManualScheduler();
        expired = new ArrayList<>();
        LocalEntityLock lock = new LocalEntityLock();
        registry = new PendingOperationRegistry(scheduler, lock, expired::add);
        meterRegistry = new SimpleMeterRegistry();
        notifier = new RecordingNotifier();
        resolver = new ConflictResolver(client, store, registry, lock, scheduler, new SyncStateMachine(),
                notifier, new MicrometerSyncMetrics(meterRegistry), Duration.ofSeconds(5));

        store.upsert(entity(3, 7, SyncStatus.SYNCING));
    }

    private static SyncEntity entity(long version, int hp, SyncStatus status) {
        return SyncEntity.builder()
                .id("c-42")
                .version(version)
                .payload(Map.of("name", "Aria", "hp", hp))
                .syncStatus(status)
                .build();
    }

    private PendingOperation pendingUpdate() {
        return registry.register("c-42", OperationKind.UPDATE, entity(3, 12, SyncStatus.SYNCED),
                Mutation.update("c-42", Map.of("hp", 7), 3), Duration.ofSeconds(5));
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    @DisplayName("Should adopt the authoritative copy and clear the pending update")
    void testReconcile() {
        PendingOperation op = pendingUpdate();

        resolver.onConflict(op, new VersionConflict("c-42", 3, 5));
        assertTrue(resolver.isReconciling("c-42"));

        client.lastLoad().future().complete(LoadResponse.of(entity(5, 20, SyncStatus.SYNCED)));

        SyncEntity adopted = store.get("c-42").orElseThrow();
        assertEquals(5, adopted.getVersion());
        assertEquals(20, adopted.getPayload().get("hp"));
        assertEquals(SyncStatus.SYNCED, adopted.getSyncStatus());
        assertFalse(registry.isPending("c-42"));
        assertFalse(resolver.isReconciling("c-42"));
        assertEquals(1.0, counter("sync.conflict.detected"));
        assertEquals(1.0, counter("sync.conflict.reconciled"));
        assertEquals("'Aria' synchronized with the latest version", notifier.last().message());
    }

    @Test
    @DisplayName("Should abandon when the load fails")
    void testLoadFailure() {
        PendingOperation op = pendingUpdate();
        resolver.onConflict(op, new VersionConflict("c-42", 3, 5));

        client.lastLoad().future().complete(LoadResponse.failed("not found"));

        assertFalse(resolver.isReconciling("c-42"));
        assertTrue(registry.isPending("c-42"));
        assertEquals(1.0, counter("sync.conflict.abandoned"));
        assertEquals(7, store.get("c-42").orElseThrow().getPayload().get("hp"));
    }

    @Test
    @DisplayName("Should abandon when the load cannot be sent")
    void testLoadNotSent() {
        PendingOperation op = pendingUpdate();
        client.setFailOnSend(true);

        resolver.onConflict(op, new VersionConflict("c-42", 3, 5));

        assertFalse(resolver.isReconciling("c-42"));
        assertEquals(1.0, counter("sync.conflict.abandoned"));
    }

    @Test
    @DisplayName("Should not adopt a copy once a newer mutation superseded the conflicting one")
    void testSuperseded() {
        PendingOperation op = pendingUpdate();
        resolver.onConflict(op, new VersionConflict("c-42", 3, 5));
        pendingUpdate();

        client.lastLoad().future().complete(LoadResponse.of(entity(5, 20, SyncStatus.SYNCED)));

        assertEquals(7, store.get("c-42").orElseThrow().getPayload().get("hp"));
        assertTrue(registry.isPending("c-42"));
        assertEquals(1.0, counter("sync.conflict.abandoned"));
    }

    @Test
    @DisplayName("Should drop the attempt when the window closes")
    void testWindowExpires() {
        PendingOperation op = pendingUpdate();
        scheduler.advance(Duration.ofSeconds(1));
        resolver.onConflict(op, new VersionConflict("c-42", 3, 5));

        scheduler.advance(Duration.ofSeconds(5));

        assertFalse(resolver.isReconciling("c-42"));
        assertEquals(1.0, counter("sync.conflict.abandoned"));
        assertEquals(List.of(op), expired);
    }

    @Test
    @DisplayName("Should accept a copy obtained outside its own load")
    void testAuthoritativeCopyFromElsewhere() {
        assertFalse(resolver.onAuthoritativeCopy(entity(5, 20, SyncStatus.SYNCED)));

        PendingOperation op = pendingUpdate();
        resolver.onConflict(op, new VersionConflict("c-42", 3, 5));

        assertTrue(resolver.onAuthoritativeCopy(entity(5, 20, SyncStatus.SYNCED)));
        assertEquals(20, store.get("c-42").orElseThrow().getPayload().get("hp"));

        client.lastLoad().future().complete(LoadResponse.of(entity(6, 99, SyncStatus.SYNCED)));
        assertEquals(20, store.get("c-42").orElseThrow().getPayload().get("hp"));
    }

    @Test
    @DisplayName("Should replace an earlier attempt for the same entity")
    void testReplaceAttempt() {
        PendingOperation op = pendingUpdate();
        resolver.onConflict(op, new VersionConflict("c-42", 3, 5));
        resolver.onConflict(op, new VersionConflict("c-42", 3, 6));

        assertEquals(2, client.loads.size());
        assertEquals(1.0, counter("sync.conflict.abandoned"));

        client.loads.get(0).future().complete(LoadResponse.of(entity(5, 20, SyncStatus.SYNCED)));
        assertEquals(7, store.get("c-42").orElseThrow().getPayload().get("hp"));

        client.loads.get(1).future().complete(LoadResponse.of(entity(6, 30, SyncStatus.SYNCED)));
        assertEquals(30, store.get("c-42").orElseThrow().getPayload().get("hp"));
    }
}
