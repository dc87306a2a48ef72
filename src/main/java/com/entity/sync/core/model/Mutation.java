package com.entity.sync.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A locally issued change, retained so that a failed mutation can be re-sent.
 *
 * @param kind            the mutation kind
 * @param entityId        the target entity (the temporary id for creates)
 * @param payload         full payload for creates, partial payload for updates, empty for deletes
 * @param expectedVersion version the update was based on, null for creates and deletes
 * @param tempId          temporary id correlating a create with its server-assigned id
 */
public record Mutation(
        OperationKind kind,
        String entityId,
        Map<String, Object> payload,
        Long expectedVersion,
        String tempId
) {
    public Mutation {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(entityId, "entityId is required");
        payload = payload != null ? Payloads.deepCopy(payload) : Map.of();
    }

    public static Mutation create(String tempId, Map<String, Object> payload) {
        return new Mutation(OperationKind.CREATE, tempId, payload, null, tempId);
    }

    public static Mutation update(String entityId, Map<String, Object> partial, long expectedVersion) {
        return new Mutation(OperationKind.UPDATE, entityId, partial, expectedVersion, null);
    }

    public static Mutation delete(String entityId) {
        return new Mutation(OperationKind.DELETE, entityId, null, null, null);
    }
}
