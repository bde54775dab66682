package com.openlearn.collector.service;

import com.openlearn.collector.entity.Alert;
import com.openlearn.collector.repository.AlertRepository;
import com.openlearn.collector.service.cache.CacheCategory;
import com.openlearn.collector.service.cache.LayeredCacheManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Alert 조회 및 스케줄러 발생 Alert (dead_letter) 기록
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertService {

    private final AlertRepository alertRepository;
    private final AlertEventPublisher alertEventPublisher;
    private final LayeredCacheManager cacheManager;
    private final Clock clock;

    /**
     * 재시도 한도를 넘긴 (또는 재시도 불가) 작업에 대한 dead_letter Alert.
     * threshold 는 재시도 한도, observedValue 는 마지막 시도 번호입니다.
     */
    public Alert raiseDeadLetter(String sourceKey, Long jobId, int attempt, int maxRetries, String error) {
        Alert alert = alertRepository.save(Alert.builder()
                .sourceKey(sourceKey)
                .kind(Alert.KIND_DEAD_LETTER)
                .threshold((double) maxRetries)
                .observedValue((double) attempt)
                .severity("high")
                .message(String.format("Job %d for %s dead-lettered at attempt %d of %d: %s",
                        jobId, sourceKey, attempt, maxRetries, error))
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.warn("Dead-letter alert {} raised for source {} (job {})", alert.getId(), sourceKey, jobId);
        cacheManager.invalidatePattern(CacheCategory.ALERTS.pattern());
        alertEventPublisher.publish(alert);
        return alert;
    }

    @Transactional(readOnly = true)
    public Page<Alert> search(String sourceKey, String kind, LocalDateTime since, Pageable pageable) {
        return alertRepository.search(sourceKey, kind, since, pageable);
    }
}
