package com.openlearn.collector.service;

import com.openlearn.collector.dto.CacheInvalidationResponse;
import com.openlearn.collector.dto.ConnectionTestResponse;
import com.openlearn.collector.entity.CollectionJob;
import com.openlearn.collector.entity.JobStatus;
import com.openlearn.collector.scheduler.TieredCollectionScheduler;
import com.openlearn.collector.service.adapter.SourceAdapterRegistry;
import com.openlearn.collector.service.cache.LayeredCacheManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * 운영자용 조작: 연결 테스트, 작업 이력 조회, 캐시 무효화.
 * 스케줄 조작(trigger/pause/resume)은 {@link TieredCollectionScheduler} 에 위임합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollectionAdminService {

    private final SourceRegistry sourceRegistry;
    private final SourceAdapterRegistry adapterRegistry;
    private final JobLifecycleService lifecycle;
    private final LayeredCacheManager cacheManager;

    public ConnectionTestResponse testConnection(String sourceKey) {
        SourceDefinition source = sourceRegistry.get(sourceKey);
        long started = System.nanoTime();
        boolean reachable = adapterRegistry.adapterFor(source).testConnection();
        long elapsed = (System.nanoTime() - started) / 1_000_000;
        log.info("Connection test for {}: reachable={}, {}ms", sourceKey, reachable, elapsed);
        return new ConnectionTestResponse(sourceKey, reachable, elapsed);
    }

    public Page<CollectionJob> searchJobs(String sourceKey, JobStatus status, LocalDateTime since, Pageable pageable) {
        if (sourceKey != null) {
            sourceRegistry.get(sourceKey);
        }
        return lifecycle.search(sourceKey, status, since, pageable);
    }

    public CacheInvalidationResponse invalidateCache(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must not be blank");
        }
        long removed = cacheManager.invalidatePattern(pattern);
        log.info("Cache invalidated by operator: pattern='{}', removed={}", pattern, removed);
        return new CacheInvalidationResponse(pattern, removed);
    }

    public LayeredCacheManager.CacheStats cacheStats() {
        return cacheManager.stats();
    }
}
