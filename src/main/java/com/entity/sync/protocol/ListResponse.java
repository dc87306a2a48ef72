package com.entity.sync.protocol;

import com.entity.sync.core.model.SyncEntity;

import java.util.List;

/**
 * Server answer to a list request: the entities visible to the current user.
 */
public record ListResponse(List<SyncEntity> entities) {

    public ListResponse {
        entities = entities != null ? List.copyOf(entities) : List.of();
    }
}
