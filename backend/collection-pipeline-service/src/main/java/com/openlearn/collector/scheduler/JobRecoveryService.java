package com.openlearn.collector.scheduler;

import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.entity.CollectionJob;
import com.openlearn.collector.entity.JobStatus;
import com.openlearn.collector.entity.TriggerType;
import com.openlearn.collector.repository.CollectionJobRepository;
import com.openlearn.collector.service.SourceDefinition;
import com.openlearn.collector.service.SourceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 복구 스캔. 기동 시 트리거 등록 전에 1회, 저장소 장애가 풀린 뒤 다시 실행됩니다.
 *
 * - 이 프로세스가 실행 중이지 않은 RUNNING 작업은 FAILED("interrupted by restart") 처리 후 RECOVERY 작업 1건으로 재실행
 * - SCHEDULED 작업은 그대로 다시 예약 (nextRetryAt 이 미래면 그 시각에)
 * - 소스당 최대 1건만 예약하고 나머지는 superseded 로 실패 처리
 *
 * 단일 프로세스 전제이므로 기동 시점의 RUNNING 행은 모두 이전 프로세스의 것입니다.
 * 재실행된 원래 작업은 FAILED 가 되므로 스캔을 여러 번 실행해도 재실행은 한 번뿐입니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobRecoveryService {

    static final String INTERRUPTED = "interrupted by restart";
    static final String SUPERSEDED = "superseded by job ";
    static final String UNCONFIGURED = "source no longer configured";

    private final CollectionJobRepository jobRepository;
    private final SourceRegistry sourceRegistry;
    private final CollectorProperties properties;
    private final Clock clock;

    @Transactional
    public List<RecoveredJob> recover() {
        return recover(Set.of());
    }

    /**
     * @param ownedJobIds 이 프로세스가 실행 중이거나 예약해 둔 작업 ID. 해당 소스의 다른 미완료 작업은 superseded 처리됩니다.
     */
    @Transactional
    public List<RecoveredJob> recover(Set<Long> ownedJobIds) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime freshCutoff = now.minus(properties.getScheduler().getStaleAfter());

        List<CollectionJob> leftovers = jobRepository.findByStatusInOrderByTriggerTimeAsc(
                List.of(JobStatus.SCHEDULED, JobStatus.RUNNING));
        if (leftovers.isEmpty()) {
            log.info("[Recovery] No unfinished jobs found");
            return List.of();
        }

        Map<String, List<CollectionJob>> bySource = new LinkedHashMap<>();
        for (CollectionJob job : leftovers) {
            bySource.computeIfAbsent(job.getSourceKey(), k -> new ArrayList<>()).add(job);
        }

        List<RecoveredJob> recovered = new ArrayList<>();
        bySource.forEach((sourceKey, jobs) ->
                recoverSource(sourceKey, jobs, ownedJobIds, now, freshCutoff).ifPresent(recovered::add));

        log.info("[Recovery] Scanned {} unfinished jobs across {} sources, {} to dispatch",
                leftovers.size(), bySource.size(), recovered.size());
        return recovered;
    }

    private Optional<RecoveredJob> recoverSource(String sourceKey, List<CollectionJob> jobs, Set<Long> ownedJobIds,
                                                 LocalDateTime now, LocalDateTime freshCutoff) {
        Optional<SourceDefinition> source = sourceRegistry.find(sourceKey).filter(SourceDefinition::enabled);
        if (source.isEmpty()) {
            jobs.forEach(job -> fail(job, now, UNCONFIGURED));
            log.warn("[Recovery] Failed {} jobs of unknown or disabled source {}", jobs.size(), sourceKey);
            return Optional.empty();
        }

        Optional<CollectionJob> owned = jobs.stream().filter(job -> ownedJobIds.contains(job.getId())).findFirst();
        if (owned.isPresent()) {
            Long ownedId = owned.get().getId();
            jobs.stream()
                    .filter(job -> !ownedJobIds.contains(job.getId()))
                    .forEach(job -> fail(job, now, job.getStatus() == JobStatus.RUNNING
                            ? INTERRUPTED : SUPERSEDED + ownedId));
            return Optional.empty();
        }

        List<CollectionJob> candidates = new ArrayList<>();
        for (CollectionJob job : jobs) {
            if (job.getStatus() == JobStatus.RUNNING) {
                if (job.getHeartbeatAt() != null && job.getHeartbeatAt().isAfter(freshCutoff)) {
                    log.warn("[Recovery] Job {} for {} has a heartbeat from {}, treating it as interrupted",
                            job.getId(), sourceKey, job.getHeartbeatAt());
                }
                fail(job, now, INTERRUPTED);
                CollectionJob replay = jobRepository.save(CollectionJob.builder()
                        .sourceKey(sourceKey)
                        .triggerTime(now)
                        .triggerType(TriggerType.RECOVERY)
                        .attemptCount(job.getAttemptCount())
                        .status(JobStatus.SCHEDULED)
                        .replayOfJobId(job.getId())
                        .build());
                log.warn("[Recovery] Job {} for {} was interrupted, replaying as job {}",
                        job.getId(), sourceKey, replay.getId());
                candidates.add(replay);
            } else {
                candidates.add(job);
            }
        }

        CollectionJob chosen = candidates.stream()
                .max(Comparator.comparing(CollectionJob::getTriggerTime)
                        .thenComparing(CollectionJob::getId, Comparator.nullsFirst(Comparator.naturalOrder())))
                .orElseThrow();
        for (CollectionJob other : candidates) {
            if (other != chosen) {
                fail(other, now, SUPERSEDED + chosen.getId());
            }
        }

        LocalDateTime dueAt = chosen.getNextRetryAt() != null && chosen.getNextRetryAt().isAfter(now)
                ? chosen.getNextRetryAt() : now;
        return Optional.of(new RecoveredJob(chosen.getId(), sourceKey, dueAt));
    }

    private void fail(CollectionJob job, LocalDateTime now, String reason) {
        job.markFailed(now, reason);
        jobRepository.save(job);
    }

    /**
     * 복구 후 예약할 작업
     */
    public record RecoveredJob(Long jobId, String sourceKey, LocalDateTime dueAt) {
    }
}
