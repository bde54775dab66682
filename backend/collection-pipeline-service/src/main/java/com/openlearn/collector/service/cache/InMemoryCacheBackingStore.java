package com.openlearn.collector.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Process-local backing store for single-node deployments and tests.
 * Entries are evicted by Caffeine once their TTL has passed, whether or not they are read again.
 */
public class InMemoryCacheBackingStore implements CacheBackingStore {

    private final Cache<String, CacheEntry> entries;
    private final Clock clock;

    public InMemoryCacheBackingStore(Clock clock) {
        this(clock, Ticker.systemTicker());
    }

    InMemoryCacheBackingStore(Clock clock, Ticker ticker) {
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .expireAfter(new CacheEntryExpiry())
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<StoredValue> get(String key) {
        CacheEntry entry = entries.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (entry.isExpired(now)) {
            entries.asMap().remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(new StoredValue(entry.value(), entry.remaining(now)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new CacheEntry(key, value, ttl, clock.instant()));
    }

    @Override
    public boolean delete(String key) {
        return entries.asMap().remove(key) != null;
    }

    @Override
    public long deleteByPattern(String glob) {
        Pattern pattern = GlobMatcher.compile(glob);
        Instant now = clock.instant();
        long removed = 0;
        List<Map.Entry<String, CacheEntry>> matching = entries.asMap().entrySet().stream()
                .filter(e -> pattern.matcher(e.getKey()).matches())
                .toList();
        for (Map.Entry<String, CacheEntry> e : matching) {
            if (entries.asMap().remove(e.getKey(), e.getValue()) && !e.getValue().isExpired(now)) {
                removed++;
            }
        }
        return removed;
    }

    long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    @Override
    public String name() {
        return "memory";
    }
}
