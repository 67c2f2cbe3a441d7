package dev.oppscanner.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link DedupCache} backed by an access-ordered map.
 * Entries expire after the TTL; once {@code maxEntries} is reached the least recently used entry is evicted.
 * All operations are synchronized, so {@link #claim} is atomic across concurrent sources.
 */
@Slf4j
public class InMemoryDedupCache implements DedupCache {

    private final Clock clock;
    private final Duration ttl;
    private final Map<String, Instant> entries;

    public InMemoryDedupCache(Clock clock, Duration ttl, int maxEntries) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1: " + maxEntries);
        }
        this.clock = clock;
        this.ttl = ttl;
        this.entries = new LinkedHashMap<>(256, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Instant> eldest) {
                return size() > maxEntries;
            }
        };
    }

    @Override
    public synchronized boolean seen(String source, String nativeId) {
        Instant lastSeen = entries.get(DedupCache.key(source, nativeId));
        return lastSeen != null && !isExpired(lastSeen, clock.instant());
    }

    @Override
    public synchronized void mark(String source, String nativeId) {
        entries.put(DedupCache.key(source, nativeId), clock.instant());
    }

    @Override
    public synchronized boolean claim(String source, String nativeId) {
        if (seen(source, nativeId)) {
            return false;
        }
        mark(source, nativeId);
        return true;
    }

    @Override
    public synchronized int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Map.Entry<String, Instant>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (isExpired(it.next().getValue(), now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} expired dedup entries, {} remaining", removed, entries.size());
        }
        return removed;
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    private boolean isExpired(Instant lastSeen, Instant now) {
        return Duration.between(lastSeen, now).compareTo(ttl) >= 0;
    }
}
