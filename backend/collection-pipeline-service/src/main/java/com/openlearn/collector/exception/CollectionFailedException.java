package com.openlearn.collector.exception;

import java.time.Duration;

/**
 * 오케스트레이터가 분류를 마친 수집 실패. 스케줄러는 이 예외만 관찰합니다.
 */
public class CollectionFailedException extends CollectionException {

    private final FailureKind kind;
    private final Duration retryAfter;

    public CollectionFailedException(FailureKind kind, String message, String sourceKey, Throwable cause) {
        this(kind, message, sourceKey, null, cause);
    }

    public CollectionFailedException(FailureKind kind, String message, String sourceKey,
                                     Duration retryAfter, Throwable cause) {
        super("COLLECTION_FAILED_" + kind.name(), message, sourceKey, cause);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public FailureKind getKind() {
        return kind;
    }

    /**
     * CAPACITY 실패에서만 의미가 있습니다. 없으면 null.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
