package com.entity.sync.schedule;

import java.time.Duration;
import java.time.Instant;

/**
 * Source of time and of cancellable one-shot timers for pending operation deadlines
 * and reconciliation windows.
 */
public interface SyncScheduler extends AutoCloseable {

    /**
     * Runs {@code task} once after {@code delay}.
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Current time as seen by this scheduler.
     */
    Instant now();

    @Override
    void close();
}
