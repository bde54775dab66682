package com.openlearn.collector.dto;

import com.openlearn.collector.entity.JobStatus;
import com.openlearn.collector.entity.TriggerType;

import java.time.LocalDateTime;

public record CollectionJobDTO(
        Long id,
        String sourceKey,
        JobStatus status,
        TriggerType triggerType,
        Integer attemptCount,
        LocalDateTime triggerTime,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        LocalDateTime nextRetryAt,
        Long replayOfJobId,
        Integer itemsFetched,
        Integer itemsStored,
        Integer itemsDuplicate,
        Integer itemErrors,
        String lastError
) {}
