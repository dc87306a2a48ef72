package com.entity.sync.protocol.channel;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Correlation map from request id to the future awaiting its response.
 * Entries expire after the request timeout; an expired request's future fails with
 * {@link TimeoutException}.
 */
public class PendingRequests {
    private static final Logger log = LoggerFactory.getLogger(PendingRequests.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final Cache<String, Entry> requests;
    private final AtomicLong sequence = new AtomicLong();

    public PendingRequests() {
        this(DEFAULT_TIMEOUT, Ticker.systemTicker(), Scheduler.systemScheduler());
    }

    public PendingRequests(Duration timeout, Ticker ticker, Scheduler scheduler) {
        this.requests = Caffeine.newBuilder()
                .expireAfterWrite(timeout)
                .ticker(ticker)
                .scheduler(scheduler)
                .executor(Runnable::run)
                .removalListener((String requestId, Entry entry, RemovalCause cause) -> {
                    if (entry != null && cause == RemovalCause.EXPIRED) {
                        log.debug("Request {} ({}) timed out", requestId, entry.responseType());
                        entry.future().completeExceptionally(new TimeoutException(
                                "No " + entry.responseType().wireName() + " within " + timeout));
                    }
                })
                .build();
        log.debug("PendingRequests initialized: timeout={}", timeout);
    }

    /**
     * Registers a request awaiting a response of the given type.
     *
     * @param entityId the entity the request is about, null for list requests
     */
    public CompletableFuture<ProtocolMessage> register(String requestId, MessageType responseType, String entityId) {
        Entry entry = new Entry(requestId, responseType, entityId, sequence.incrementAndGet(), new CompletableFuture<>());
        requests.put(requestId, entry);
        return entry.future();
    }

    /**
     * Completes the request a response belongs to. Responses that do not echo a request id
     * are matched to the oldest pending request of the same type, and of the same entity when
     * both carry one.
     *
     * @return false if no pending request matched
     */
    public boolean complete(ProtocolMessage response, String responseEntityId) {
        Optional<Entry> match = response.requestId()
                .map(id -> requests.asMap().remove(id))
                .or(() -> removeOldest(response.type(), responseEntityId));
        match.ifPresent(entry -> entry.future().complete(response));
        return match.isPresent();
    }

    /**
     * Removes a request without completing it, for example because sending it failed.
     */
    public void cancel(String requestId) {
        requests.asMap().remove(requestId);
    }

    /**
     * Fails every pending request, typically when the channel closes.
     */
    public void failAll(Throwable cause) {
        for (String requestId : requests.asMap().keySet()) {
            Entry entry = requests.asMap().remove(requestId);
            if (entry != null) {
                entry.future().completeExceptionally(cause);
            }
        }
    }

    public long size() {
        requests.cleanUp();
        return requests.estimatedSize();
    }

    /**
     * Runs pending expirations now.
     */
    public void cleanUp() {
        requests.cleanUp();
    }

    private Optional<Entry> removeOldest(MessageType type, String entityId) {
        return requests.asMap().values().stream()
                .filter(e -> e.responseType() == type)
                .filter(e -> entityId == null || e.entityId() == null || entityId.equals(e.entityId()))
                .min(Comparator.comparingLong(Entry::sequence))
                .filter(e -> requests.asMap().remove(e.requestId(), e));
    }

    private record Entry(String requestId, MessageType responseType, String entityId, long sequence,
                         CompletableFuture<ProtocolMessage> future) {
    }
}
