package com.openlearn.collector.service.cache;

import com.github.benmanes.caffeine.cache.Expiry;

/**
 * Caffeine expiry driven by each entry's own TTL. Reads do not extend it.
 */
public class CacheEntryExpiry implements Expiry<String, CacheEntry> {

    @Override
    public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
        return value.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
        return value.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
        return currentDuration;
    }
}
