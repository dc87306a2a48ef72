package com.entity.sync.api;

import com.entity.sync.pending.CreateRollbackPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SyncOptionsTest {

    @Test
    @DisplayName("Should use five second deadlines by default")
    void testDefaults() {
        SyncOptions options = SyncOptions.defaults();

        assertEquals(Duration.ofSeconds(5), options.getPendingTimeout());
        assertEquals(Duration.ofSeconds(5), options.getReconcileWindow());
        assertEquals(CreateRollbackPolicy.MARK_ERROR, options.getCreateRollbackPolicy());
        assertEquals("temp-", options.getTempIdPrefix());
        assertEquals(Duration.ofMinutes(5), options.getTombstoneTtl());
        assertEquals(10_000, options.getTombstoneMaxSize());
        assertEquals(5000, options.getLockConfig().timeoutMs());
    }

    @Test
    @DisplayName("Should apply custom values")
    void testCustom() {
        SyncOptions options = SyncOptions.builder()
                .pendingTimeout(Duration.ofSeconds(10))
                .reconcileWindow(Duration.ofSeconds(2))
                .createRollbackPolicy(CreateRollbackPolicy.REMOVE)
                .tempIdPrefix("local-")
                .build();

        assertEquals(Duration.ofSeconds(10), options.getPendingTimeout());
        assertEquals(Duration.ofSeconds(2), options.getReconcileWindow());
        assertEquals(CreateRollbackPolicy.REMOVE, options.getCreateRollbackPolicy());
        assertEquals("local-", options.getTempIdPrefix());
    }

    @Test
    @DisplayName("Should reject invalid values")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.builder().pendingTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> SyncOptions.builder().reconcileWindow(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.builder().tempIdPrefix(" "));
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.builder().tombstoneMaxSize(0));
        assertThrows(NullPointerException.class, () -> SyncOptions.builder().createRollbackPolicy(null));
    }
}
