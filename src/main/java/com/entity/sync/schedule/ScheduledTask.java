package com.entity.sync.schedule;

/**
 * Handle to a task scheduled on a {@link SyncScheduler}.
 */
public interface ScheduledTask {

    /**
     * Cancels the task if it has not run yet. Cancelling twice is harmless.
     */
    void cancel();

    boolean isCancelled();
}
