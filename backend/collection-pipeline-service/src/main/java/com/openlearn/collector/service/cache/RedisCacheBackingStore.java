package com.openlearn.collector.service.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis backing store. Pattern deletes walk the keyspace with SCAN rather than KEYS.
 */
@Slf4j
public class RedisCacheBackingStore implements CacheBackingStore {

    private static final int SCAN_COUNT = 100;

    private final StringRedisTemplate redisTemplate;

    public RedisCacheBackingStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<StoredValue> get(String key) {
        String value = redisTemplate.opsForValue().get(key);
        if (value == null) {
            return Optional.empty();
        }
        // PTTL: -2 gone, -1 no expiry
        Long millis = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
        if (millis == null || millis == -1) {
            return Optional.of(new StoredValue(value, null));
        }
        if (millis <= 0) {
            return Optional.empty();
        }
        return Optional.of(new StoredValue(value, Duration.ofMillis(millis)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    @Override
    public long deleteByPattern(String glob) {
        Long deleted = redisTemplate.execute((RedisCallback<Long>) connection -> scanAndDelete(connection, glob));
        long count = deleted != null ? deleted : 0L;
        log.debug("Deleted {} redis keys matching '{}'", count, glob);
        return count;
    }

    private long scanAndDelete(RedisConnection connection, String glob) {
        ScanOptions options = ScanOptions.scanOptions().match(glob).count(SCAN_COUNT).build();
        long deleted = 0;
        List<byte[]> chunk = new ArrayList<>(SCAN_COUNT);
        try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
            while (cursor.hasNext()) {
                chunk.add(cursor.next());
                if (chunk.size() >= SCAN_COUNT) {
                    deleted += deleteChunk(connection, chunk);
                }
            }
        }
        if (!chunk.isEmpty()) {
            deleted += deleteChunk(connection, chunk);
        }
        return deleted;
    }

    private long deleteChunk(RedisConnection connection, List<byte[]> chunk) {
        Long removed = connection.keyCommands().del(chunk.toArray(new byte[0][]));
        chunk.clear();
        return removed != null ? removed : 0L;
    }

    @Override
    public String name() {
        return "redis";
    }
}
