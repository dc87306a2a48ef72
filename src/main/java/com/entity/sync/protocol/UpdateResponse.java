package com.entity.sync.protocol;

/**
 * Server answer to an update.
 *
 * @param success        whether the update was applied
 * @param newVersion     the version after the update, may be null
 * @param currentVersion the server's version when the update was rejected as a conflict
 * @param error          the server's error text on failure
 */
public record UpdateResponse(boolean success, Long newVersion, Long currentVersion, String error) {

    public static final String VERSION_CONFLICT = "Version conflict";

    public static UpdateResponse ok(Long newVersion) {
        return new UpdateResponse(true, newVersion, null, null);
    }

    public static UpdateResponse conflict(long currentVersion) {
        return new UpdateResponse(false, null, currentVersion, VERSION_CONFLICT);
    }

    public static UpdateResponse failed(String error) {
        return new UpdateResponse(false, null, null, error);
    }

    /**
     * A failed update that the server attributed to a stale version.
     */
    public boolean isConflict() {
        return !success && (currentVersion != null || VERSION_CONFLICT.equals(error));
    }
}
