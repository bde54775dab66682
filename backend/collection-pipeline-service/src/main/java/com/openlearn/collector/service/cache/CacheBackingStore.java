package com.openlearn.collector.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared (second-tier) cache store. Implementations may throw unchecked
 * exceptions when the store is unreachable; callers treat that as a miss.
 */
public interface CacheBackingStore {

    /**
     * @return the stored value with the time it has left, empty when absent or expired
     */
    Optional<StoredValue> get(String key);

    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    /**
     * Deletes every key matching a Redis-style glob and returns how many were removed.
     */
    long deleteByPattern(String glob);

    String name();

    /**
     * @param remainingTtl time left before the store expires the key, null when the key has no expiry
     */
    record StoredValue(String value, Duration remainingTtl) {
    }
}
