package com.entity.sync.notify;

/**
 * Receives sync notifications, typically to show a toast in the presentation layer.
 * Called from response and timer threads; implementations must not block.
 */
@FunctionalInterface
public interface SyncNotifier {

    void notify(SyncNotification notification);
}
