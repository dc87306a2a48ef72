package com.entity.sync.protocol;

/**
 * Server answer to a create.
 *
 * @param success    whether the entity was persisted
 * @param assignedId the server-assigned id, present on success
 * @param version    the initial server version, may be null
 * @param error      the server's error text on failure
 */
public record SaveResponse(boolean success, String assignedId, Long version, String error) {

    public static SaveResponse ok(String assignedId, Long version) {
        return new SaveResponse(true, assignedId, version, null);
    }

    public static SaveResponse failed(String error) {
        return new SaveResponse(false, null, null, error);
    }
}
