package com.openlearn.collector.dto;

import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.entity.SourcePriority;

import java.time.LocalDateTime;

/**
 * 소스별 스케줄 상태
 *
 * @param nextRun  다음 실행 예정 시각 (대기 중인 재시도가 있으면 그 시각)
 * @param inFlight 현재 실행 중 여부
 */
public record SourceStatusDTO(
        String sourceKey,
        String name,
        SourceKind kind,
        SourcePriority priority,
        boolean enabled,
        long intervalSeconds,
        int maxRetries,
        LocalDateTime nextRun,
        LocalDateTime lastRun,
        int consecutiveFailures,
        String lastError,
        boolean paused,
        boolean inFlight,
        Long pendingJobId
) {}
