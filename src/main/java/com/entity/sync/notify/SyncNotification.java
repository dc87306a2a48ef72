package com.entity.sync.notify;

import java.util.Objects;

/**
 * User-facing message about the outcome of a sync operation.
 *
 * @param level    severity
 * @param entityId the entity concerned, may be null for global messages
 * @param message  human-readable text
 */
public record SyncNotification(Level level, String entityId, String message) {

    public enum Level { INFO, SUCCESS, WARNING, ERROR }

    public SyncNotification {
        Objects.requireNonNull(level, "level is required");
        Objects.requireNonNull(message, "message is required");
    }

    public static SyncNotification info(String entityId, String message) {
        return new SyncNotification(Level.INFO, entityId, message);
    }

    public static SyncNotification success(String entityId, String message) {
        return new SyncNotification(Level.SUCCESS, entityId, message);
    }

    public static SyncNotification warning(String entityId, String message) {
        return new SyncNotification(Level.WARNING, entityId, message);
    }

    public static SyncNotification error(String entityId, String message) {
        return new SyncNotification(Level.ERROR, entityId, message);
    }
}
