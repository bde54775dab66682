package com.openlearn.collector.service.ratelimit;

import java.time.Duration;

/**
 * Rate limiter for requests against one upstream source.
 */
public interface SourceRateLimiter {

    /**
     * Acquire permission to make a request.
     * Blocks until a permit is available.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    void acquire() throws InterruptedException;

    /**
     * Acquire permission with timeout.
     *
     * @param timeout maximum time to wait
     * @return true if permission was acquired, false if timeout
     */
    boolean tryAcquire(Duration timeout) throws InterruptedException;

    /**
     * Time until the next permit frees up, zero when one is available now.
     */
    Duration timeUntilNextPermit();

    int getRequestsPerWindow();

    Duration getWindow();
}
