package com.openlearn.collector.exception;

import java.time.Duration;

/**
 * Rate limit or backpressure. The job is requeued after {@link #getRetryAfter()}
 * without consuming a retry attempt.
 */
public class CapacityExceededException extends CollectionException {

    private final Duration retryAfter;

    public CapacityExceededException(String message, String sourceKey, Duration retryAfter) {
        super("CAPACITY_EXCEEDED", message, sourceKey);
        this.retryAfter = retryAfter;
    }

    public CapacityExceededException(String message, String sourceKey, Duration retryAfter, Throwable cause) {
        super("CAPACITY_EXCEEDED", message, sourceKey, cause);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public static CapacityExceededException rateLimited(String sourceKey, Duration retryAfter) {
        return new CapacityExceededException("Rate limit reached for source " + sourceKey, sourceKey, retryAfter);
    }
}
