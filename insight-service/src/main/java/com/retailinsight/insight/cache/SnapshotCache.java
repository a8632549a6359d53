package com.retailinsight.insight.cache;

import com.retailinsight.common.model.ProductSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory snapshot cache, one entry per source identity.
 *
 * <p><strong>Fetch Once → Serve Many:</strong> a snapshot is served while
 * {@code now - fetchedAt < ttl}; after that the caller refetches and {@link #put} replaces
 * the entry in one step. Snapshots are immutable, so concurrent readers share them freely.
 */
@Component
public class SnapshotCache {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCache.class);

    private final ConcurrentHashMap<String, CachedSnapshot> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public SnapshotCache(@Value("${insight.cache.ttl:PT10M}") Duration ttl, Clock clock) {
        this.ttl   = ttl;
        this.clock = clock;
    }

    /**
     * Returns the entry for {@code key}, or {@code null} if absent or expired.
     * An expired entry is evicted on the way.
     */
    public CachedSnapshot get(String key) {
        CachedSnapshot entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            store.remove(key, entry);
            return null;
        }
        return entry;
    }

    public CachedSnapshot put(String key, ProductSnapshot snapshot) {
        CachedSnapshot entry = new CachedSnapshot(snapshot, clock.instant());
        store.put(key, entry);
        log.info("CACHE_REFRESH key={} products={} ttlSeconds={}",
                 key, snapshot.products().size(), ttl.toSeconds());
        return entry;
    }

    public void evict(String key) {
        if (store.remove(key) != null) {
            log.info("CACHE_EVICT key={}", key);
        }
    }

    public boolean isExpired(CachedSnapshot entry) {
        Instant expiresAt = entry.fetchedAt().plus(ttl);
        return !clock.instant().isBefore(expiresAt);
    }
}
