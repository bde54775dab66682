package com.openlearn.collector.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * 수집 작업 상태.
 * 상태는 SCHEDULED → RUNNING → {SUCCEEDED | FAILED} → (DEAD_LETTERED) 방향으로만 진행합니다.
 */
public enum JobStatus {
    SCHEDULED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    DEAD_LETTERED;

    public Set<JobStatus> allowedNext() {
        return switch (this) {
            // SCHEDULED → FAILED: 복구 스캔에서 대체된 예약 작업 정리용
            case SCHEDULED -> EnumSet.of(RUNNING, FAILED);
            case RUNNING -> EnumSet.of(SUCCEEDED, FAILED);
            case FAILED -> EnumSet.of(DEAD_LETTERED);
            case SUCCEEDED, DEAD_LETTERED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }

    public boolean isActive() {
        return this == SCHEDULED || this == RUNNING;
    }
}
