package com.entity.sync.notify;

/**
 * Discards all notifications.
 */
public class NoOpSyncNotifier implements SyncNotifier {

    @Override
    public void notify(SyncNotification notification) {
    }
}
