package com.entity.sync.protocol.channel;

import com.entity.sync.core.model.RemoteChange;
import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.protocol.DeleteResponse;
import com.entity.sync.protocol.ListResponse;
import com.entity.sync.protocol.LoadResponse;
import com.entity.sync.protocol.ProtocolClient;
import com.entity.sync.protocol.SaveResponse;
import com.entity.sync.protocol.TransportException;
import com.entity.sync.protocol.UpdateResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * {@link ProtocolClient} over a {@link MessageChannel}.
 *
 * <p>Each request carries a fresh {@code request_id} plus the user id and session code, and
 * is correlated with its response through {@link PendingRequests}. Inbound
 * {@link MessageType#CHARACTER_UPDATE} broadcasts are turned into {@link RemoteChange}s.</p>
 */
public class ChannelProtocolClient implements ProtocolClient {
    private static final Logger log = LoggerFactory.getLogger(ChannelProtocolClient.class);

    static final String USER_ID = "user_id";
    static final String SESSION_CODE = "session_code";

    private final MessageChannel channel;
    private final ProtocolMessageCodec codec;
    private final EntityWireMapper mapper;
    private final PendingRequests pendingRequests;
    private final Supplier<String> userId;
    private final String sessionCode;
    private final List<RemoteChangeListener> listeners = new CopyOnWriteArrayList<>();

    public ChannelProtocolClient(MessageChannel channel, Supplier<String> userId, String sessionCode) {
        this(channel, new ProtocolMessageCodec(), new EntityWireMapper(), new PendingRequests(), userId, sessionCode);
    }

    public ChannelProtocolClient(MessageChannel channel, ProtocolMessageCodec codec, EntityWireMapper mapper,
                                 PendingRequests pendingRequests, Supplier<String> userId, String sessionCode) {
        this.channel = channel;
        this.codec = codec;
        this.mapper = mapper;
        this.pendingRequests = pendingRequests;
        this.userId = userId;
        this.sessionCode = sessionCode;
        channel.setFrameHandler(this::onFrame);
    }

    @Override
    public CompletableFuture<SaveResponse> requestSave(SyncEntity entity) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(EntityWireMapper.CHARACTER_DATA, mapper.toWire(entity));
        return send(MessageType.CHARACTER_SAVE_REQUEST, data, MessageType.CHARACTER_SAVE_RESPONSE, null)
                .thenApply(mapper::toSaveResponse);
    }

    @Override
    public CompletableFuture<UpdateResponse> requestUpdate(String id, Map<String, Object> partial, long expectedVersion) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(EntityWireMapper.CHARACTER_ID, id);
        data.put(EntityWireMapper.UPDATES, partial);
        data.put(EntityWireMapper.VERSION, expectedVersion);
        return send(MessageType.CHARACTER_UPDATE, data, MessageType.CHARACTER_UPDATE_RESPONSE, id)
                .thenApply(mapper::toUpdateResponse);
    }

    @Override
    public CompletableFuture<DeleteResponse> requestDelete(String id) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(EntityWireMapper.CHARACTER_ID, id);
        return send(MessageType.CHARACTER_DELETE_REQUEST, data, MessageType.CHARACTER_DELETE_RESPONSE, id)
                .thenApply(mapper::toDeleteResponse);
    }

    @Override
    public CompletableFuture<ListResponse> requestList() {
        return send(MessageType.CHARACTER_LIST_REQUEST, new LinkedHashMap<>(), MessageType.CHARACTER_LIST_RESPONSE, null)
                .thenApply(mapper::toListResponse);
    }

    @Override
    public CompletableFuture<LoadResponse> requestLoad(String id) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(EntityWireMapper.CHARACTER_ID, id);
        return send(MessageType.CHARACTER_LOAD_REQUEST, data, MessageType.CHARACTER_LOAD_RESPONSE, id)
                .thenApply(mapper::toLoadResponse);
    }

    @Override
    public boolean isConnected() {
        return channel.isOpen();
    }

    public void addRemoteChangeListener(RemoteChangeListener listener) {
        listeners.add(listener);
    }

    public void removeRemoteChangeListener(RemoteChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Fails all outstanding requests, for example after the channel was closed.
     */
    public void failPending(String reason) {
        pendingRequests.failAll(new TransportException(reason));
    }

    private CompletableFuture<ProtocolMessage> send(MessageType type, Map<String, Object> data,
                                                    MessageType responseType, String entityId) {
        if (!channel.isOpen()) {
            throw new TransportException("Channel is not open; cannot send " + type.wireName());
        }
        String requestId = UUID.randomUUID().toString();
        data.put(ProtocolMessage.REQUEST_ID, requestId);
        data.put(USER_ID, userId.get());
        data.put(SESSION_CODE, sessionCode);
        String frame = codec.encode(new ProtocolMessage(type, data));
        CompletableFuture<ProtocolMessage> future = pendingRequests.register(requestId, responseType, entityId);
        try {
            channel.send(frame);
        } catch (RuntimeException e) {
            pendingRequests.cancel(requestId);
            throw e instanceof TransportException te ? te : new TransportException("Failed to send " + type.wireName(), e);
        }
        log.debug("Sent {} ({})", type.wireName(), requestId);
        return future;
    }

    private void onFrame(String frame) {
        ProtocolMessage message;
        try {
            message = codec.decode(frame);
        } catch (ProtocolException e) {
            log.warn("Dropping inbound frame: {}", e.getMessage());
            return;
        }
        switch (message.type()) {
            case CHARACTER_UPDATE -> dispatchRemoteChange(message);
            case CHARACTER_SAVE_RESPONSE, CHARACTER_UPDATE_RESPONSE, CHARACTER_DELETE_RESPONSE,
                    CHARACTER_LIST_RESPONSE, CHARACTER_LOAD_RESPONSE -> {
                String entityId = message.type() == MessageType.CHARACTER_SAVE_RESPONSE
                        ? null : message.string(EntityWireMapper.CHARACTER_ID).orElse(null);
                if (!pendingRequests.complete(message, entityId)) {
                    log.debug("No pending request for {} {}", message.type().wireName(), message.requestId().orElse(""));
                }
            }
            default -> log.debug("Ignoring inbound {}", message.type().wireName());
        }
    }

    private void dispatchRemoteChange(ProtocolMessage message) {
        Optional<RemoteChange> change = mapper.toRemoteChange(message);
        if (change.isEmpty()) {
            log.debug("Ignoring character update without usable content");
            return;
        }
        for (RemoteChangeListener listener : listeners) {
            try {
                listener.onRemoteChange(change.get());
            } catch (RuntimeException e) {
                log.error("Remote change listener failed for {}", change.get().entityId(), e);
            }
        }
    }
}
