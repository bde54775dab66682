package com.openlearn.collector.scheduler;

import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.entity.CollectionJob;
import com.openlearn.collector.entity.TriggerType;
import com.openlearn.collector.exception.CollectionFailedException;
import com.openlearn.collector.exception.FailureKind;
import com.openlearn.collector.service.AlertService;
import com.openlearn.collector.service.JobLifecycleService;
import com.openlearn.collector.service.SourceDefinition;
import com.openlearn.collector.service.collection.CollectionOrchestrator;
import com.openlearn.collector.service.collection.CollectionResult;
import com.openlearn.collector.service.collection.FailureClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 작업 한 건의 상태 머신.
 *
 * SCHEDULED → RUNNING → SUCCEEDED | FAILED (→ DEAD_LETTERED).
 * 실패한 행은 되돌릴 수 없으므로 재시도/재큐잉은 새 작업 행으로 만듭니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CollectionJobRunner {

    private final JobLifecycleService lifecycle;
    private final CollectionOrchestrator orchestrator;
    private final FailureClassifier failureClassifier;
    private final RetryPolicy retryPolicy;
    private final AlertService alertService;
    private final CollectorProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public RunOutcome run(Long jobId, SourceDefinition source) {
        CollectionJob job;
        try {
            job = lifecycle.markRunning(jobId);
        } catch (IllegalStateException | ObjectOptimisticLockingFailureException e) {
            log.info("[Scheduler] Job {} for {} not runnable, skipping: {}", jobId, source.key(), e.getMessage());
            return RunOutcome.skipped(e.getMessage());
        } catch (RuntimeException e) {
            return storeFailure(source, e);
        }

        log.info("[Scheduler] Running job {} for {} (attempt {}, {})",
                jobId, source.key(), job.getAttemptCount(), job.getTriggerType());
        try {
            CollectionResult result = orchestrator.collect(source);
            lifecycle.markSucceeded(jobId, result);
            count("succeeded");
            return RunOutcome.succeeded(result);
        } catch (CollectionFailedException e) {
            return handleFailure(job, source, e);
        } catch (RuntimeException e) {
            if (failureClassifier.isStoreUnavailable(e)) {
                return storeFailure(source, e);
            }
            return handleFailure(job, source, failureClassifier.toFailure(source.key(), e));
        }
    }

    private RunOutcome handleFailure(CollectionJob job, SourceDefinition source, CollectionFailedException failure) {
        String error = failure.getKind() + ": " + failure.getMessage();
        int attempt = job.getAttemptCount();
        try {
            return switch (failure.getKind()) {
                case TRANSIENT -> retryOrDeadLetter(job, source, error, attempt);
                case VALIDATION -> deadLetter(job, source, FailureKind.VALIDATION, error, attempt);
                case CAPACITY -> requeue(job, source, error, failure.getRetryAfter());
                case FATAL -> storeFailure(source, failure);
            };
        } catch (RuntimeException e) {
            if (failureClassifier.isStoreUnavailable(e)) {
                return storeFailure(source, e);
            }
            throw e;
        }
    }

    private RunOutcome retryOrDeadLetter(CollectionJob job, SourceDefinition source, String error, int attempt) {
        lifecycle.markFailed(job.getId(), error);
        if (!retryPolicy.canRetry(attempt, source.maxRetries())) {
            return deadLetter(job, source, FailureKind.TRANSIENT, error, attempt);
        }
        Duration delay = retryPolicy.delayFor(attempt);
        LocalDateTime at = LocalDateTime.now(clock).plus(delay);
        CollectionJob retry = lifecycle.createJob(source.key(), TriggerType.RETRY, attempt + 1, at, null);
        count("retried");
        log.warn("[Scheduler] Job {} for {} failed (attempt {}/{}), retry job {} in {}s: {}",
                job.getId(), source.key(), attempt, source.maxRetries(), retry.getId(), delay.toSeconds(), error);
        return RunOutcome.retry(error, retry.getId(), at);
    }

    private RunOutcome deadLetter(CollectionJob job, SourceDefinition source, FailureKind kind,
                                  String error, int attempt) {
        lifecycle.markFailedAndDeadLettered(job.getId(), error);
        alertService.raiseDeadLetter(source.key(), job.getId(), attempt, source.maxRetries(), error);
        count("dead_lettered");
        log.error("[Scheduler] Job {} for {} dead-lettered at attempt {}: {}", job.getId(), source.key(), attempt, error);
        return RunOutcome.deadLettered(kind, error);
    }

    private RunOutcome requeue(CollectionJob job, SourceDefinition source, String error, Duration retryAfter) {
        lifecycle.markFailed(job.getId(), error);
        Duration delay = retryAfter != null ? retryAfter : properties.getRetry().getCapacityDelay();
        LocalDateTime at = LocalDateTime.now(clock).plus(delay);
        CollectionJob requeued = lifecycle.createJob(source.key(), TriggerType.REQUEUE, job.getAttemptCount(), at, null);
        count("requeued");
        log.info("[Scheduler] Job {} for {} hit capacity limit, requeued as job {} in {}s",
                job.getId(), source.key(), requeued.getId(), delay.toSeconds());
        return RunOutcome.requeued(error, requeued.getId(), at);
    }

    private RunOutcome storeFailure(SourceDefinition source, Throwable e) {
        count("halted");
        log.error("[Scheduler] Job store unavailable while running {}: {}", source.key(), e.getMessage(), e);
        return RunOutcome.halted("job store unavailable: " + e.getMessage());
    }

    private void count(String outcome) {
        meterRegistry.counter("collector.jobs", "outcome", outcome).increment();
    }
}
