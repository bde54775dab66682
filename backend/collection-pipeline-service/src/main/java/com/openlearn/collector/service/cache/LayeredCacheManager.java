package com.openlearn.collector.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * 2단 캐시 (로컬 Caffeine + 공유 backing store).
 *
 * - 값은 JSON으로 저장되고 호출자의 타입으로 역직렬화됩니다.
 * - TTL은 키 namespace의 {@link CacheCategory} 허용 staleness로 제한됩니다.
 * - backing store 오류는 miss로 처리합니다.
 * - 동시 miss는 중복 계산될 수 있습니다 (single-flight 아님).
 */
@Slf4j
public class LayeredCacheManager {

    private final Cache<String, CacheEntry> local;
    private final CacheBackingStore backingStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicLong localHits = new AtomicLong();
    private final AtomicLong backingHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();
    private final AtomicLong backingErrors = new AtomicLong();

    private final Counter localHitCounter;
    private final Counter backingHitCounter;
    private final Counter missCounter;
    private final Counter errorCounter;

    public LayeredCacheManager(Cache<String, CacheEntry> local,
                               CacheBackingStore backingStore,
                               ObjectMapper objectMapper,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.local = local;
        this.backingStore = backingStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.localHitCounter = meterRegistry.counter("collector.cache", "result", "local_hit");
        this.backingHitCounter = meterRegistry.counter("collector.cache", "result", "backing_hit");
        this.missCounter = meterRegistry.counter("collector.cache", "result", "miss");
        this.errorCounter = meterRegistry.counter("collector.cache", "result", "backing_error");
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, objectMapper.constructType(type));
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return get(key, objectMapper.getTypeFactory().constructType(type));
    }

    /**
     * Returns the cached value or computes, stores and returns it.
     * A null computation result is returned but not cached.
     */
    public <T> T getOrSet(String key, Duration ttl, Class<T> type, Supplier<T> compute) {
        return getOrSet(key, ttl, objectMapper.constructType(type), compute);
    }

    public <T> T getOrSet(String key, Duration ttl, TypeReference<T> type, Supplier<T> compute) {
        return getOrSet(key, ttl, objectMapper.getTypeFactory().constructType(type), compute);
    }

    public void set(String key, Object value, Duration ttl) {
        if (value == null) {
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for cache key '" + key + "' is not serializable", e);
        }
        Duration effective = CacheCategory.forKey(key).effectiveTtl(ttl);
        local.put(key, new CacheEntry(key, json, effective, clock.instant()));
        writes.incrementAndGet();
        try {
            backingStore.set(key, json, effective);
        } catch (RuntimeException e) {
            backingFailed("set", key, e);
        }
    }

    public boolean delete(String key) {
        boolean removedLocal = local.asMap().remove(key) != null;
        try {
            return backingStore.delete(key) || removedLocal;
        } catch (RuntimeException e) {
            backingFailed("delete", key, e);
            return removedLocal;
        }
    }

    /**
     * Removes every entry whose key matches the glob from both tiers.
     *
     * @return entries removed from the backing store, or from the local tier when the
     *         backing store could not be reached
     */
    public long invalidatePattern(String glob) {
        Pattern pattern = GlobMatcher.compile(glob);
        List<String> localKeys = local.asMap().keySet().stream()
                .filter(k -> pattern.matcher(k).matches())
                .toList();
        local.invalidateAll(localKeys);
        invalidations.incrementAndGet();
        try {
            long removed = backingStore.deleteByPattern(glob);
            log.debug("Invalidated '{}': local={}, {}={}", glob, localKeys.size(), backingStore.name(), removed);
            return removed;
        } catch (RuntimeException e) {
            backingFailed("deleteByPattern", glob, e);
            return localKeys.size();
        }
    }

    public CacheStats stats() {
        return new CacheStats(
                backingStore.name(),
                local.estimatedSize(),
                localHits.get(),
                backingHits.get(),
                misses.get(),
                writes.get(),
                invalidations.get(),
                backingErrors.get()
        );
    }

    private <T> T getOrSet(String key, Duration ttl, JavaType type, Supplier<T> compute) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T value = compute.get();
        if (value != null) {
            set(key, value, ttl);
        }
        return value;
    }

    private <T> Optional<T> get(String key, JavaType type) {
        Instant now = clock.instant();
        CacheEntry entry = local.getIfPresent(key);
        if (entry != null) {
            if (!entry.isExpired(now)) {
                Optional<T> value = decode(key, entry.value(), type);
                if (value.isPresent()) {
                    localHits.incrementAndGet();
                    localHitCounter.increment();
                    return value;
                }
            }
            local.asMap().remove(key, entry);
        }

        Optional<CacheBackingStore.StoredValue> remote;
        try {
            remote = backingStore.get(key);
        } catch (RuntimeException e) {
            backingFailed("get", key, e);
            remote = Optional.empty();
        }
        if (remote.isPresent()) {
            Optional<T> value = decode(key, remote.get().value(), type);
            if (value.isPresent()) {
                backingHits.incrementAndGet();
                backingHitCounter.increment();
                Duration ttl = localTtl(key, remote.get().remainingTtl());
                if (!ttl.isZero()) {
                    local.put(key, new CacheEntry(key, remote.get().value(), ttl, now));
                }
                return value;
            }
        }

        misses.incrementAndGet();
        missCounter.increment();
        return Optional.empty();
    }

    /**
     * L1 must not outlive the backing copy: the smaller of its remaining TTL and the category default.
     */
    private static Duration localTtl(String key, Duration remaining) {
        Duration categoryTtl = CacheCategory.forKey(key).getDefaultTtl();
        if (remaining == null) {
            return categoryTtl;
        }
        return remaining.compareTo(categoryTtl) < 0 ? remaining : categoryTtl;
    }

    private <T> Optional<T> decode(String key, String json, JavaType type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding undecodable cache entry '{}': {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void backingFailed(String operation, String key, RuntimeException e) {
        backingErrors.incrementAndGet();
        errorCounter.increment();
        log.warn("Cache backing store {} failed for '{}': {}", operation, key, e.getMessage());
    }

    public record CacheStats(
            String backing,
            long localSize,
            long localHits,
            long backingHits,
            long misses,
            long writes,
            long invalidations,
            long backingErrors
    ) {
        public double hitRatio() {
            long lookups = localHits + backingHits + misses;
            return lookups == 0 ? 0.0 : (double) (localHits + backingHits) / lookups;
        }
    }
}
