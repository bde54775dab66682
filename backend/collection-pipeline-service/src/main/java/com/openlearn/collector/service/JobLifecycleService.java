package com.openlearn.collector.service;

import com.openlearn.collector.entity.CollectionJob;
import com.openlearn.collector.entity.JobStatus;
import com.openlearn.collector.entity.TriggerType;
import com.openlearn.collector.repository.CollectionJobRepository;
import com.openlearn.collector.service.collection.CollectionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 수집 작업 원장(collection_jobs) 쓰기. 모든 상태 변경은 {@link CollectionJob} 의 전이 규칙을 따릅니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobLifecycleService {

    private final CollectionJobRepository jobRepository;
    private final Clock clock;

    @Transactional
    public CollectionJob createJob(String sourceKey, TriggerType triggerType, int attemptCount,
                                   LocalDateTime nextRetryAt, Long replayOfJobId) {
        CollectionJob job = CollectionJob.builder()
                .sourceKey(sourceKey)
                .triggerTime(now())
                .triggerType(triggerType)
                .attemptCount(attemptCount)
                .status(JobStatus.SCHEDULED)
                .nextRetryAt(nextRetryAt)
                .replayOfJobId(replayOfJobId)
                .build();
        CollectionJob saved = jobRepository.save(job);
        log.debug("Job {} created for {} ({}, attempt {})", saved.getId(), sourceKey, triggerType, attemptCount);
        return saved;
    }

    /**
     * SCHEDULED → RUNNING. 이미 실행되었거나 다른 스레드가 먼저 가져간 작업이면 예외가 발생합니다.
     *
     * @throws IllegalStateException SCHEDULED 상태가 아님
     * @throws org.springframework.orm.ObjectOptimisticLockingFailureException 동시 전이
     */
    @Transactional
    public CollectionJob markRunning(Long jobId) {
        CollectionJob job = load(jobId);
        job.markRunning(now());
        return jobRepository.saveAndFlush(job);
    }

    @Transactional
    public CollectionJob markSucceeded(Long jobId, CollectionResult result) {
        CollectionJob job = load(jobId);
        job.markSucceeded(now(), result.itemsFetched(), result.itemsStored(), result.itemsDuplicate(),
                result.errors());
        return jobRepository.save(job);
    }

    @Transactional
    public CollectionJob markFailed(Long jobId, String error) {
        CollectionJob job = load(jobId);
        job.markFailed(now(), truncate(error));
        return jobRepository.save(job);
    }

    @Transactional
    public CollectionJob markFailedAndDeadLettered(Long jobId, String error) {
        CollectionJob job = load(jobId);
        if (job.getStatus() != JobStatus.FAILED) {
            job.markFailed(now(), truncate(error));
        }
        job.markDeadLettered(truncate(error));
        return jobRepository.save(job);
    }

    /**
     * 아직 실행되지 않은 작업의 실행 시각을 미룹니다 (용량 부족 재큐잉).
     */
    @Transactional
    public CollectionJob defer(Long jobId, LocalDateTime nextRetryAt) {
        CollectionJob job = load(jobId);
        if (job.getStatus() != JobStatus.SCHEDULED) {
            throw new IllegalStateException("Only scheduled jobs can be deferred, job " + jobId + " is " + job.getStatus());
        }
        job.setNextRetryAt(nextRetryAt);
        return jobRepository.save(job);
    }

    @Transactional
    public int touchHeartbeats(Collection<Long> jobIds) {
        if (jobIds.isEmpty()) {
            return 0;
        }
        return jobRepository.touchHeartbeats(jobIds, now());
    }

    @Transactional
    public int deleteFinishedBefore(LocalDateTime cutoff) {
        return jobRepository.deleteFinishedBefore(
                List.of(JobStatus.SUCCEEDED, JobStatus.FAILED, JobStatus.DEAD_LETTERED), cutoff);
    }

    @Transactional(readOnly = true)
    public Optional<CollectionJob> lastCompleted(String sourceKey) {
        return jobRepository.findFirstBySourceKeyAndCompletedAtIsNotNullOrderByCompletedAtDesc(sourceKey);
    }

    /**
     * 소스의 최근 작업 (triggerTime 내림차순, 최대 50건)
     */
    @Transactional(readOnly = true)
    public List<CollectionJob> recentJobs(String sourceKey) {
        return jobRepository.findTop50BySourceKeyOrderByTriggerTimeDesc(sourceKey);
    }

    @Transactional(readOnly = true)
    public Page<CollectionJob> search(String sourceKey, JobStatus status, LocalDateTime since, Pageable pageable) {
        return jobRepository.search(sourceKey, status, since, pageable);
    }

    @Transactional(readOnly = true)
    public long countByStatus(JobStatus status) {
        return jobRepository.countByStatus(status);
    }

    /**
     * 저장소 연결 확인 (스케줄러 health check)
     */
    @Transactional(readOnly = true)
    public void ping() {
        jobRepository.count();
    }

    private CollectionJob load(Long jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("Collection job not found: " + jobId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= 2000) {
            return error;
        }
        return error.substring(0, 2000);
    }
}
