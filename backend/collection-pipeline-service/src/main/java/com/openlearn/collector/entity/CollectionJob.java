package com.openlearn.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 수집 작업 원장.
 * 트리거 시점에 SCHEDULED 상태로 먼저 기록되므로 재시작 후 중단된 작업을 찾아낼 수 있습니다.
 */
@Entity
@Table(name = "collection_jobs", indexes = {
    @Index(name = "idx_jobs_source_key", columnList = "source_key"),
    @Index(name = "idx_jobs_status", columnList = "status"),
    @Index(name = "idx_jobs_trigger_time", columnList = "trigger_time")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_key", nullable = false, length = 100)
    private String sourceKey;

    @Column(name = "trigger_time", nullable = false)
    private LocalDateTime triggerTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 20)
    @Builder.Default
    private TriggerType triggerType = TriggerType.PERIODIC;

    @Column(name = "attempt_count", nullable = false)
    @Builder.Default
    private Integer attemptCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.SCHEDULED;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "next_retry_at")
    private LocalDateTime nextRetryAt;

    @Column(name = "heartbeat_at")
    private LocalDateTime heartbeatAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    /**
     * 재시작 복구로 다시 실행되는 경우 원래 작업 ID
     */
    @Column(name = "replay_of_job_id")
    private Long replayOfJobId;

    @Column(name = "items_fetched")
    private Integer itemsFetched;

    @Column(name = "items_stored")
    private Integer itemsStored;

    @Column(name = "items_duplicate")
    private Integer itemsDuplicate;

    @Column(name = "item_errors")
    private Integer itemErrors;

    @Version
    @Column(name = "version")
    private Long version;

    /**
     * 상태 전이. 역행하는 전이는 허용하지 않습니다.
     *
     * @throws IllegalStateException 허용되지 않는 전이
     */
    public void transitionTo(JobStatus next) {
        if (status == null || !status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal job status transition " + status + " -> " + next + " for job " + id);
        }
        this.status = next;
    }

    public void markRunning(LocalDateTime now) {
        transitionTo(JobStatus.RUNNING);
        this.startedAt = now;
        this.heartbeatAt = now;
    }

    public void markSucceeded(LocalDateTime now, int fetched, int stored, int duplicate, int errors) {
        transitionTo(JobStatus.SUCCEEDED);
        this.completedAt = now;
        this.heartbeatAt = now;
        this.itemsFetched = fetched;
        this.itemsStored = stored;
        this.itemsDuplicate = duplicate;
        this.itemErrors = errors;
        this.lastError = null;
    }

    public void markFailed(LocalDateTime now, String error) {
        transitionTo(JobStatus.FAILED);
        this.completedAt = now;
        this.lastError = error;
    }

    public void markDeadLettered(String error) {
        transitionTo(JobStatus.DEAD_LETTERED);
        if (error != null) {
            this.lastError = error;
        }
    }
}
