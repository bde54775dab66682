package com.openlearn.collector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.openlearn.collector.service.cache.CacheBackingStore;
import com.openlearn.collector.service.cache.CacheEntry;
import com.openlearn.collector.service.cache.CacheEntryExpiry;
import com.openlearn.collector.service.cache.InMemoryCacheBackingStore;
import com.openlearn.collector.service.cache.LayeredCacheManager;
import com.openlearn.collector.service.cache.RedisCacheBackingStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * 캐시 설정
 *
 * - 로컬 캐시 (Caffeine, 엔트리별 TTL)
 * - 공유 캐시: collector.cache.backing=redis 이면 Redis, memory 이면 프로세스 내부 저장소
 */
@Configuration
@Slf4j
public class RedisCacheConfig {

    /**
     * 로컬 캐시. 만료 시각은 엔트리 TTL을 따릅니다.
     */
    @Bean
    public Cache<String, CacheEntry> localCollectorCache(CollectorProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.getCache().getLocalMaxSize())
                .expireAfter(new CacheEntryExpiry())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "collector.cache", name = "backing", havingValue = "redis", matchIfMissing = true)
    public CacheBackingStore redisCacheBackingStore(StringRedisTemplate stringRedisTemplate) {
        log.info("Cache backing store: redis");
        return new RedisCacheBackingStore(stringRedisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "collector.cache", name = "backing", havingValue = "memory")
    public CacheBackingStore inMemoryCacheBackingStore(Clock clock) {
        log.info("Cache backing store: in-memory");
        return new InMemoryCacheBackingStore(clock);
    }

    @Bean
    public LayeredCacheManager layeredCacheManager(Cache<String, CacheEntry> localCollectorCache,
                                                   CacheBackingStore cacheBackingStore,
                                                   ObjectMapper objectMapper,
                                                   Clock clock,
                                                   MeterRegistry meterRegistry) {
        return new LayeredCacheManager(localCollectorCache, cacheBackingStore, objectMapper, clock, meterRegistry);
    }
}
