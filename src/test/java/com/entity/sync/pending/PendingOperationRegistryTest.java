package com.entity.sync.pending;

import com.entity.sync.core.model.Mutation;
import com.entity.sync.core.model.OperationKind;
import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.lock.EntityLock;
import com.entity.sync.lock.LocalEntityLock;
import com.entity.sync.lock.LockAcquisitionException;
import com.entity.sync.testing.ManualScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PendingOperationRegistryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ManualScheduler scheduler;
    private List<PendingOperation> expired;
    private PendingOperationRegistry registry;

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
        expired = new CopyOnWriteArrayList<>();
        registry = new PendingOperationRegistry(scheduler, new LocalEntityLock(), expired::add);
    }

    private static EntityLock busyFor(int refusals) {
        AtomicInteger remaining = new AtomicInteger(refusals);
        LocalEntityLock delegate = new LocalEntityLock();
        return new EntityLock() {
            @Override
            public boolean tryLock(String key) {
                if (remaining.getAndDecrement() > 0) {
                    throw new LockAcquisitionException("Lock for entity '" + key + "' is busy");
                }
                return delegate.tryLock(key);
            }

            @Override
            public void unlock(String key) {
                delegate.unlock(key);
            }
        };
    }

    private PendingOperation registerUpdate(String id) {
        SyncEntity original = SyncEntity.builder().id(id).payload(Map.of("name", "Aria")).build();
        return registry.register(id, OperationKind.UPDATE, original,
                Mutation.update(id, Map.of("hp", 7), 1), TIMEOUT);
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Should track the operation with a deadline")
        void testRegister() {
            PendingOperation op = registerUpdate("c-1");

            assertTrue(registry.isPending("c-1"));
            assertEquals(1, registry.size());
            assertEquals(op.getIssuedAt().plus(TIMEOUT), op.getDeadline());
            assertTrue(registry.isCurrent(op));
            assertSame(op, registry.get("c-1").orElseThrow());
        }

        @Test
        @DisplayName("Should supersede the previous operation for the same entity")
        void testSupersede() {
            PendingOperation first = registerUpdate("c-1");
            PendingOperation second = registerUpdate("c-1");

            assertTrue(second.getSequence() > first.getSequence());
            assertTrue(first.isResolved());
            assertFalse(registry.isCurrent(first));
            assertTrue(registry.isCurrent(second));
            assertEquals(1, registry.size());
            assertFalse(registry.confirm(first));

            scheduler.advance(TIMEOUT);
            assertEquals(List.of(second), expired);
        }

        @Test
        @DisplayName("Should keep entities independent")
        void testIndependentEntities() {
            registerUpdate("c-1");
            registerUpdate("c-2");

            assertTrue(registry.confirm("c-1"));
            assertTrue(registry.isPending("c-2"));
        }
    }

    @Nested
    @DisplayName("Resolution")
    class ResolutionTests {

        @Test
        @DisplayName("Should confirm only once")
        void testConfirmTwice() {
            registerUpdate("c-1");

            assertTrue(registry.confirm("c-1"));
            assertFalse(registry.confirm("c-1"));
            assertFalse(registry.isPending("c-1"));
        }

        @Test
        @DisplayName("Should not expire a confirmed operation")
        void testConfirmCancelsTimer() {
            registerUpdate("c-1");
            registry.confirm("c-1");

            scheduler.advance(Duration.ofSeconds(10));

            assertTrue(expired.isEmpty());
        }

        @Test
        @DisplayName("Should expire an unanswered operation exactly once")
        void testExpiry() {
            PendingOperation op = registerUpdate("c-1");

            scheduler.advance(TIMEOUT);
            scheduler.advance(TIMEOUT);

            assertEquals(List.of(op), expired);
            assertFalse(registry.isPending("c-1"));
            assertFalse(registry.fail(op));
            assertFalse(registry.confirm(op));
        }

        @Test
        @DisplayName("Should let exactly one caller own a failure")
        void testFail() {
            PendingOperation op = registerUpdate("c-1");

            assertTrue(registry.fail(op));
            assertFalse(registry.fail(op));
            scheduler.advance(TIMEOUT);
            assertTrue(expired.isEmpty());
        }

        @Test
        @DisplayName("Should cancel without expiry")
        void testCancel() {
            PendingOperation op = registerUpdate("c-1");

            assertEquals(op, registry.cancel("c-1").orElseThrow());
            assertTrue(registry.cancel("c-1").isEmpty());
            scheduler.advance(TIMEOUT);
            assertTrue(expired.isEmpty());
        }

        @Test
        @DisplayName("Should resolve everything on clear")
        void testClear() {
            registerUpdate("c-1");
            registerUpdate("c-2");

            registry.clear();
            scheduler.advance(TIMEOUT);

            assertEquals(0, registry.size());
            assertTrue(expired.isEmpty());
            assertEquals(0, scheduler.activeTasks());
        }
    
        @Test
        @DisplayName("Should retry the expiry while the entity lock is busy")
        void testExpiryRetriedWhenLockBusy() {
            registry = new PendingOperationRegistry(scheduler, busyFor(2), expired::add);
            PendingOperation op = registerUpdate("c-1");

            scheduler.advance(TIMEOUT);

            assertTrue(expired.isEmpty());
            assertTrue(registry.isPending("c-1"));
            assertEquals(1, scheduler.activeTasks());

            scheduler.advance(PendingOperationRegistry.EXPIRY_RETRY_DELAY.multipliedBy(2));

            assertEquals(List.of(op), expired);
            assertFalse(registry.isPending("c-1"));
        }

        @Test
        @DisplayName("Should drop a retried expiry once the operation is confirmed")
        void testRetriedExpiryCancelledByConfirm() {
            registry = new PendingOperationRegistry(scheduler, busyFor(1), expired::add);
            registerUpdate("c-1");
            scheduler.advance(TIMEOUT);

            assertTrue(registry.confirm("c-1"));
            scheduler.advance(TIMEOUT);

            assertTrue(expired.isEmpty());
            assertEquals(0, scheduler.activeTasks());
        }
    }
}
