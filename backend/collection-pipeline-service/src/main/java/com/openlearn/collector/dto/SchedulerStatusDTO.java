package com.openlearn.collector.dto;

import java.time.LocalDateTime;

public record SchedulerStatusDTO(
        boolean running,
        boolean halted,
        String haltReason,
        LocalDateTime haltedAt,
        LocalDateTime startedAt,
        long uptimeSeconds,
        int sources,
        int inFlight,
        int pendingJobs,
        int paused,
        long executed,
        long succeeded,
        long failed,
        long retried,
        long requeued,
        long deadLettered
) {}
