package com.openlearn.collector.scheduler;

import com.openlearn.collector.exception.FailureKind;
import com.openlearn.collector.service.collection.CollectionResult;

import java.time.LocalDateTime;

/**
 * Result of running one job, telling the scheduler what to arm next.
 *
 * @param nextJobId follow-up job (retry or requeue) to arm at {@code nextRunAt}, or null
 */
public record RunOutcome(
        Status status,
        CollectionResult result,
        FailureKind failureKind,
        String error,
        Long nextJobId,
        LocalDateTime nextRunAt
) {

    public enum Status {
        SUCCEEDED,
        RETRY_SCHEDULED,
        REQUEUED,
        DEAD_LETTERED,
        HALTED,
        SKIPPED
    }

    public static RunOutcome succeeded(CollectionResult result) {
        return new RunOutcome(Status.SUCCEEDED, result, null, null, null, null);
    }

    public static RunOutcome retry(String error, Long nextJobId, LocalDateTime at) {
        return new RunOutcome(Status.RETRY_SCHEDULED, null, FailureKind.TRANSIENT, error, nextJobId, at);
    }

    public static RunOutcome requeued(String error, Long nextJobId, LocalDateTime at) {
        return new RunOutcome(Status.REQUEUED, null, FailureKind.CAPACITY, error, nextJobId, at);
    }

    public static RunOutcome deadLettered(FailureKind kind, String error) {
        return new RunOutcome(Status.DEAD_LETTERED, null, kind, error, null, null);
    }

    public static RunOutcome halted(String error) {
        return new RunOutcome(Status.HALTED, null, FailureKind.FATAL, error, null, null);
    }

    public static RunOutcome skipped(String reason) {
        return new RunOutcome(Status.SKIPPED, null, null, reason, null, null);
    }

    public boolean isFailure() {
        return status == Status.RETRY_SCHEDULED || status == Status.DEAD_LETTERED || status == Status.HALTED;
    }
}
