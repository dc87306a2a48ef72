package com.entity.sync.protocol.channel;

import com.entity.sync.testing.FakeTicker;
import com.github.benmanes.caffeine.cache.Scheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class PendingRequestsTest {

    private FakeTicker ticker;
    private PendingRequests requests;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        requests = new PendingRequests(Duration.ofSeconds(10), ticker, Scheduler.disabledScheduler());
    }

    private static ProtocolMessage response(MessageType type, Map<String, Object> data) {
        return new ProtocolMessage(type, data);
    }

    @Test
    @DisplayName("Should complete the request named by the response")
    void testCompleteById() {
        CompletableFuture<ProtocolMessage> future = requests.register("r-1", MessageType.CHARACTER_LIST_RESPONSE, null);

        assertTrue(requests.complete(response(MessageType.CHARACTER_LIST_RESPONSE,
                Map.of(ProtocolMessage.REQUEST_ID, "r-1")), null));

        assertTrue(future.isDone());
        assertEquals(0, requests.size());
        assertFalse(requests.complete(response(MessageType.CHARACTER_LIST_RESPONSE,
                Map.of(ProtocolMessage.REQUEST_ID, "r-1")), null));
    }

    @Test
    @DisplayName("Should fall back to the oldest request of the same type and entity")
    void testFallback() {
        CompletableFuture<ProtocolMessage> first = requests.register("r-1", MessageType.CHARACTER_DELETE_RESPONSE, "c-1");
        CompletableFuture<ProtocolMessage> second = requests.register("r-2", MessageType.CHARACTER_DELETE_RESPONSE, "c-2");
        CompletableFuture<ProtocolMessage> third = requests.register("r-3", MessageType.CHARACTER_DELETE_RESPONSE, "c-2");

        assertTrue(requests.complete(response(MessageType.CHARACTER_DELETE_RESPONSE, Map.of()), "c-2"));

        assertFalse(first.isDone());
        assertTrue(second.isDone());
        assertFalse(third.isDone());
    }

    @Test
    @DisplayName("Should time out unanswered requests")
    void testTimeout() {
        CompletableFuture<ProtocolMessage> future = requests.register("r-1", MessageType.CHARACTER_LOAD_RESPONSE, "c-1");

        ticker.advance(Duration.ofSeconds(11));
        requests.cleanUp();

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(TimeoutException.class, e.getCause());
        assertEquals(0, requests.size());
    }

    @Test
    @DisplayName("Should fail every pending request")
    void testFailAll() {
        CompletableFuture<ProtocolMessage> a = requests.register("r-1", MessageType.CHARACTER_LOAD_RESPONSE, "c-1");
        CompletableFuture<ProtocolMessage> b = requests.register("r-2", MessageType.CHARACTER_LIST_RESPONSE, null);

        requests.failAll(new IllegalStateException("closed"));

        assertTrue(a.isCompletedExceptionally());
        assertTrue(b.isCompletedExceptionally());
        assertEquals(0, requests.size());
    }

    @Test
    @DisplayName("Should forget a cancelled request")
    void testCancel() {
        CompletableFuture<ProtocolMessage> future = requests.register("r-1", MessageType.CHARACTER_LOAD_RESPONSE, "c-1");

        requests.cancel("r-1");

        assertEquals(0, requests.size());
        assertFalse(future.isDone());
    }
}
