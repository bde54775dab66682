package com.openlearn.collector.scheduler;

import com.openlearn.collector.config.CollectorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 지수 백오프: {@code min(maxDelay, baseDelay * 2^attempt) + jitter},
 * jitter 는 {@code [0, delay * jitterRatio)} 구간의 균등 분포입니다.
 */
@Component
public class RetryPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterRatio;
    private final DoubleSupplier random;

    @Autowired
    public RetryPolicy(CollectorProperties properties) {
        this(properties.getRetry().getBaseDelay(),
                properties.getRetry().getMaxDelay(),
                properties.getRetry().getJitterRatio(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy(Duration baseDelay, Duration maxDelay, double jitterRatio, DoubleSupplier random) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterRatio = jitterRatio;
        this.random = random;
    }

    /**
     * @param attempt 실패한 시도의 attemptCount (0부터)
     */
    public Duration delayFor(int attempt) {
        Duration delay = backoff(attempt);
        long jitterMillis = (long) (delay.toMillis() * jitterRatio * random.getAsDouble());
        return delay.plusMillis(jitterMillis);
    }

    /**
     * 지터를 제외한 지연
     */
    public Duration backoff(int attempt) {
        int exponent = Math.min(Math.max(attempt, 0), 30);
        long millis = baseDelay.toMillis() * (1L << exponent);
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }

    /**
     * attempt 번째 시도가 실패했을 때 재시도할 수 있는지
     */
    public boolean canRetry(int attempt, int maxRetries) {
        return attempt < maxRetries;
    }
}
