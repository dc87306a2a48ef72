package com.entity.sync.protocol;

import com.entity.sync.core.model.SyncEntity;

import java.util.Optional;

/**
 * Server answer to a load request.
 *
 * @param entity the authoritative copy, null when not found or on error
 * @param error  the server's error text, may be null
 */
public record LoadResponse(SyncEntity entity, String error) {

    public static LoadResponse of(SyncEntity entity) {
        return new LoadResponse(entity, null);
    }

    public static LoadResponse failed(String error) {
        return new LoadResponse(null, error);
    }

    public Optional<SyncEntity> entityOptional() {
        return Optional.ofNullable(entity);
    }
}
