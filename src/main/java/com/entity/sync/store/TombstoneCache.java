package com.entity.sync.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Caffeine-backed memory of recently deleted entity ids.
 * Late responses, list refreshes and broadcasts must not resurrect an id found here.
 */
public class TombstoneCache {
    private static final Logger log = LoggerFactory.getLogger(TombstoneCache.class);

    private final Cache<String, Instant> tombstones;

    public TombstoneCache(long maxSize, Duration ttl) {
        this(maxSize, ttl, Ticker.systemTicker());
    }

    public TombstoneCache(long maxSize, Duration ttl, Ticker ticker) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        this.tombstones = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
        log.debug("TombstoneCache initialized: maxSize={}, ttl={}", maxSize, ttl);
    }

    public void add(String entityId) {
        tombstones.put(entityId, Instant.now());
    }

    public boolean contains(String entityId) {
        return tombstones.getIfPresent(entityId) != null;
    }

    public void forget(String entityId) {
        tombstones.invalidate(entityId);
    }

    public long size() {
        tombstones.cleanUp();
        return tombstones.estimatedSize();
    }
}
