package com.openlearn.collector.service.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Local-tier entry. The value is kept as the same JSON text the backing store holds.
 */
public record CacheEntry(String key, String value, Duration ttl, Instant createdAt) {

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }

    public Duration remaining(Instant now) {
        Duration left = Duration.between(now, expiresAt());
        return left.isNegative() ? Duration.ZERO : left;
    }
}
