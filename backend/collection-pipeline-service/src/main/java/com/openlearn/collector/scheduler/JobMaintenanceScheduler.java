package com.openlearn.collector.scheduler;

import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.entity.JobStatus;
import com.openlearn.collector.service.JobLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 작업 원장 정리 및 상태 로깅
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobMaintenanceScheduler {

    private final JobLifecycleService lifecycle;
    private final CollectorProperties properties;
    private final Clock clock;

    /**
     * 보존 기간이 지난 종료 작업 삭제 (매일 새벽 3시)
     */
    @Scheduled(cron = "${collector.scheduler.cleanup-cron:0 0 3 * * *}")
    public void cleanupFinishedJobs() {
        try {
            int retentionDays = properties.getScheduler().getRetentionDays();
            LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(retentionDays);
            int deleted = lifecycle.deleteFinishedBefore(cutoff);
            log.info("[Maintenance] Removed {} finished jobs completed before {}", deleted, cutoff);
        } catch (Exception e) {
            log.error("[Maintenance] Error cleaning up finished jobs: {}", e.getMessage(), e);
        }
    }

    /**
     * 작업 상태 분포 로깅 (10분마다)
     */
    @Scheduled(fixedDelayString = "${collector.scheduler.stats-interval-ms:600000}")
    public void logJobStats() {
        try {
            log.info("[Maintenance] Jobs: scheduled={}, running={}, failed={}, deadLettered={}",
                    lifecycle.countByStatus(JobStatus.SCHEDULED),
                    lifecycle.countByStatus(JobStatus.RUNNING),
                    lifecycle.countByStatus(JobStatus.FAILED),
                    lifecycle.countByStatus(JobStatus.DEAD_LETTERED));
        } catch (Exception e) {
            log.error("[Maintenance] Error logging job stats: {}", e.getMessage(), e);
        }
    }
}
