package com.transitlog.backend.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * String key/value store shared between invocations, with a time-to-live per entry.
 * Reads never block on writes; concurrent writes to one key resolve as last write wins.
 */
public interface SharedCache {

    /**
     * Get a live entry.
     */
    Optional<String> get(String key);

    /**
     * Store an entry that expires after the given ttl.
     */
    void put(String key, String value, Duration ttl);

    /**
     * Remove an entry, if present.
     */
    void evict(String key);
}
