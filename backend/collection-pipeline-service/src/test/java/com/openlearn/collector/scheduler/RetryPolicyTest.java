package com.openlearn.collector.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    @Test
    @DisplayName("지연은 base * 2^attempt 로 증가하고 maxDelay 에서 멈춘다")
    void exponentialBackoffCapped() {
        RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(5), Duration.ofSeconds(30), 0.1, () -> 0.0);

        assertThat(policy.delayFor(0)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(20));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.delayFor(62)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("지터는 [0, delay * ratio) 범위")
    void jitterWithinRatio() {
        RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(10), Duration.ofHours(1), 0.1, () -> 0.999);

        Duration delay = policy.delayFor(0);

        assertThat(delay).isGreaterThanOrEqualTo(Duration.ofSeconds(10));
        assertThat(delay).isLessThan(Duration.ofSeconds(11));
    }

    @Test
    @DisplayName("attempt 가 maxRetries 미만일 때만 재시도")
    void canRetry() {
        RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 0, () -> 0.0);

        assertThat(policy.canRetry(2, 3)).isTrue();
        assertThat(policy.canRetry(3, 3)).isFalse();
        assertThat(policy.canRetry(0, 0)).isFalse();
    }
}
