package com.entity.sync.core.model;

import java.util.Objects;

/**
 * Server rejection of an update that was based on a stale version.
 *
 * @param entityId       the entity the update targeted
 * @param claimedVersion the version the client believed it was updating
 * @param currentVersion the server's authoritative version at the time of the request
 */
public record VersionConflict(String entityId, long claimedVersion, long currentVersion) {

    public VersionConflict {
        Objects.requireNonNull(entityId, "entityId is required");
    }
}
