package com.entity.sync.protocol.channel;

import com.entity.sync.core.model.RemoteChange;
import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.protocol.ListResponse;
import com.entity.sync.protocol.LoadResponse;
import com.entity.sync.protocol.SaveResponse;
import com.entity.sync.protocol.TransportException;
import com.entity.sync.protocol.UpdateResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class ChannelProtocolClientTest {

    private FakeChannel channel;
    private ProtocolMessageCodec codec;
    private PendingRequests pendingRequests;
    private ChannelProtocolClient client;

    @BeforeEach
    void setUp() {
        channel = new FakeChannel();
        codec = new ProtocolMessageCodec();
        pendingRequests = new PendingRequests();
        client = new ChannelProtocolClient(channel, codec, new EntityWireMapper(), pendingRequests,
                () -> "u-1", "SESSION1");
    }

    private ProtocolMessage lastSent() {
        return codec.decode(channel.sent.get(channel.sent.size() - 1));
    }

    private void receive(MessageType type, Map<String, Object> data) {
        channel.handler.accept(codec.encode(new ProtocolMessage(type, data)));
    }

    private Map<String, Object> reply(Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(ProtocolMessage.REQUEST_ID, lastSent().requestId().orElseThrow());
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return data;
    }

    @Nested
    @DisplayName("Requests")
    class RequestTests {

        @Test
        @DisplayName("Should send a save request and correlate its response")
        void testSave() {
            SyncEntity entity = SyncEntity.builder().id("temp-1").payload(Map.of("name", "Aria", "hp", 12))
                    .ownerId("u-1").build();

            CompletableFuture<SaveResponse> future = client.requestSave(entity);

            ProtocolMessage sent = lastSent();
            assertEquals(MessageType.CHARACTER_SAVE_REQUEST, sent.type());
            assertEquals("u-1", sent.string("user_id").orElseThrow());
            assertEquals("SESSION1", sent.string("session_code").orElseThrow());
            @SuppressWarnings("unchecked")
            Map<String, Object> character = (Map<String, Object>) sent.data().get("character_data");
            assertEquals("temp-1", character.get("character_id"));
            assertEquals("Aria", character.get("name"));
            assertFalse(future.isDone());

            receive(MessageType.CHARACTER_SAVE_RESPONSE, reply("success", true, "character_id", "c-42", "version", 1));

            SaveResponse response = future.join();
            assertTrue(response.success());
            assertEquals("c-42", response.assignedId());
            assertEquals(1L, response.version());
        }

        @Test
        @DisplayName("Should send the expected version with an update and read conflicts")
        void testUpdateConflict() {
            CompletableFuture<UpdateResponse> future = client.requestUpdate("c-42", Map.of("hp", 7), 3);

            ProtocolMessage sent = lastSent();
            assertEquals(MessageType.CHARACTER_UPDATE, sent.type());
            assertEquals(3L, sent.number("version").orElseThrow());
            assertEquals(Map.of("hp", 7), sent.data().get("updates"));

            receive(MessageType.CHARACTER_UPDATE_RESPONSE, reply("character_id", "c-42", "success", false,
                    "error", "Version conflict", "current_version", 5));

            UpdateResponse response = future.join();
            assertTrue(response.isConflict());
            assertEquals(5L, response.currentVersion());
        }

        @Test
        @DisplayName("Should match a response without request id by type and entity")
        void testFallbackMatching() {
            CompletableFuture<LoadResponse> first = client.requestLoad("c-1");
            CompletableFuture<LoadResponse> second = client.requestLoad("c-2");

            receive(MessageType.CHARACTER_LOAD_RESPONSE, Map.of(
                    "character_id", "c-2", "name", "Borin", "data", Map.of("hp", 3), "version", 4));

            assertFalse(first.isDone());
            SyncEntity loaded = second.join().entity();
            assertEquals("c-2", loaded.getId());
            assertEquals(4, loaded.getVersion());
            assertEquals(3, loaded.getPayload().get("hp"));
        }

        @Test
        @DisplayName("Should read the character list")
        void testList() {
            CompletableFuture<ListResponse> future = client.requestList();

            receive(MessageType.CHARACTER_LIST_RESPONSE, reply("characters", List.of(
                    Map.of("character_id", "c-1", "name", "Aria"),
                    Map.of("name", "no id"))));

            assertEquals(1, future.join().entities().size());
        }

        @Test
        @DisplayName("Should refuse to send on a closed channel")
        void testClosedChannel() {
            channel.open = false;

            assertFalse(client.isConnected());
            assertThrows(TransportException.class, () -> client.requestList());
            assertTrue(channel.sent.isEmpty());
        }

        @Test
        @DisplayName("Should drop the pending request when sending fails")
        void testSendFailure() {
            channel.failSend = true;

            assertThrows(TransportException.class, () -> client.requestDelete("c-1"));
            assertEquals(0, pendingRequests.size());
        }

        @Test
        @DisplayName("Should fail outstanding requests on demand")
        void testFailPending() {
            CompletableFuture<ListResponse> future = client.requestList();

            client.failPending("channel closed");

            CompletionException e = assertThrows(CompletionException.class, future::join);
            assertInstanceOf(TransportException.class, e.getCause());
        }
    }

    @Nested
    @DisplayName("Broadcasts")
    class BroadcastTests {

        private final List<RemoteChange> changes = new ArrayList<>();

        @BeforeEach
        void register() {
            client.addRemoteChangeListener(changes::add);
        }

        @Test
        @DisplayName("Should deliver deltas from other clients")
        void testDelta() {
            receive(MessageType.CHARACTER_UPDATE, Map.of("character_id", "c-42", "updates", Map.of("hp", 1),
                    "version", 6));

            assertEquals(1, changes.size());
            RemoteChange change = changes.get(0);
            assertEquals(RemoteChange.Type.DELTA, change.type());
            assertEquals(6L, change.version());
            assertEquals(Map.of("hp", 1), change.updates());
        }

        @Test
        @DisplayName("Should deliver deletes from other clients")
        void testDelete() {
            receive(MessageType.CHARACTER_UPDATE, Map.of("character_id", "c-42", "operation", "delete"));

            assertEquals(RemoteChange.Type.DELETE, changes.get(0).type());
        }

        @Test
        @DisplayName("Should drop malformed frames")
        void testMalformedFrame() {
            assertDoesNotThrow(() -> channel.handler.accept("not json"));
            assertDoesNotThrow(() -> channel.handler.accept("{\"type\":\"unknown\",\"data\":{}}"));
            assertTrue(changes.isEmpty());
        }

        @Test
        @DisplayName("Should keep delivering after a listener fails")
        void testFailingListener() {
            client.addRemoteChangeListener(change -> {
                throw new IllegalStateException("boom");
            });
            List<RemoteChange> later = new ArrayList<>();
            client.addRemoteChangeListener(later::add);

            receive(MessageType.CHARACTER_UPDATE, Map.of("character_id", "c-42", "operation", "delete"));

            assertEquals(1, changes.size());
            assertEquals(1, later.size());
        }
    }

    private static final class FakeChannel implements MessageChannel {
        private final List<String> sent = new ArrayList<>();
        private boolean open = true;
        private boolean failSend;
        private Consumer<String> handler;

        @Override
        public void send(String frame) {
            if (failSend) {
                throw new IllegalStateException("broken pipe");
            }
            sent.add(frame);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void setFrameHandler(Consumer<String> handler) {
            this.handler = handler;
        }
    }
}
