package com.transitlog.backend.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link SharedCache}, used when no Redis instance is configured.
 * Expired entries are removed when they are read, and every write sweeps out the
 * entries that expired since, so keys that are never read again do not pile up.
 */
@Slf4j
public class InMemorySharedCache implements SharedCache {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySharedCache() {
        this(Clock.systemUTC());
    }

    public InMemorySharedCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.expiresAt.isAfter(clock.instant())) {
            entries.remove(key, entry);
            log.trace("Expired cache entry: key={}", key);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        sweep(now);
        entries.put(key, new Entry(value, now.plus(ttl)));
        log.trace("Saved to memory cache: key={}, ttl={}s", key, ttl.getSeconds());
    }

    @Override
    public void evict(String key) {
        entries.remove(key);
    }

    int size() {
        return entries.size();
    }

    private void sweep(Instant now) {
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.expiresAt.isAfter(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Swept {} expired cache entries", removed);
        }
    }

    private static final class Entry {
        private final String value;
        private final Instant expiresAt;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
