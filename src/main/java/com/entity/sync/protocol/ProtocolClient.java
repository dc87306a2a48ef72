package com.entity.sync.protocol;

import com.entity.sync.core.model.SyncEntity;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous request/response access to the authoritative server.
 *
 * <p>Each method either returns a future or throws {@link TransportException} synchronously
 * when the request cannot be sent. A future completed exceptionally is also a transport failure.
 * Response ordering between different requests is not guaranteed.</p>
 */
public interface ProtocolClient {

    /**
     * Persists a new entity. The entity carries the temporary id.
     */
    CompletableFuture<SaveResponse> requestSave(SyncEntity entity);

    /**
     * Applies a partial update to an existing entity.
     *
     * @param expectedVersion the version the update is based on
     */
    CompletableFuture<UpdateResponse> requestUpdate(String id, Map<String, Object> partial, long expectedVersion);

    CompletableFuture<DeleteResponse> requestDelete(String id);

    CompletableFuture<ListResponse> requestList();

    CompletableFuture<LoadResponse> requestLoad(String id);

    /**
     * Whether requests can currently be delivered.
     */
    boolean isConnected();
}
