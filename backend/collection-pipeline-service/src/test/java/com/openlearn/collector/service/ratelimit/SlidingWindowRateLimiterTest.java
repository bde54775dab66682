package com.openlearn.collector.service.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SlidingWindowRateLimiter 단위 테스트 (가짜 시계 사용)
 */
class SlidingWindowRateLimiterTest {

    private final AtomicLong nanos = new AtomicLong(1_000_000_000L);

    @Test
    @DisplayName("윈도우 안에서 한도만큼만 허용")
    void limitsWithinWindow() throws InterruptedException {
        // given
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(3, Duration.ofMinutes(1), nanos::get);

        // when
        boolean first = limiter.tryAcquire(Duration.ZERO);
        boolean second = limiter.tryAcquire(Duration.ZERO);
        boolean third = limiter.tryAcquire(Duration.ZERO);
        boolean fourth = limiter.tryAcquire(Duration.ZERO);

        // then
        assertThat(first && second && third).isTrue();
        assertThat(fourth).isFalse();
        assertThat(limiter.timeUntilNextPermit()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("가장 오래된 허가가 윈도우를 벗어나면 다시 허용")
    void slidesWithTime() throws InterruptedException {
        // given
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(2, Duration.ofSeconds(10), nanos::get);
        limiter.tryAcquire(Duration.ZERO);
        nanos.addAndGet(Duration.ofSeconds(4).toNanos());
        limiter.tryAcquire(Duration.ZERO);

        // when
        nanos.addAndGet(Duration.ofSeconds(6).toNanos());

        // then
        assertThat(limiter.tryAcquire(Duration.ZERO)).isTrue();
        assertThat(limiter.tryAcquire(Duration.ZERO)).isFalse();
        assertThat(limiter.timeUntilNextPermit()).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("대기 시간이 timeout 보다 길면 기다리지 않고 실패")
    void tryAcquireGivesUpWhenWaitExceedsTimeout() throws InterruptedException {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1, Duration.ofMinutes(1), nanos::get);
        limiter.acquire();

        long started = System.nanoTime();
        boolean acquired = limiter.tryAcquire(Duration.ofSeconds(5));

        assertThat(acquired).isFalse();
        assertThat(System.nanoTime() - started).isLessThan(Duration.ofSeconds(1).toNanos());
    }

    @Test
    @DisplayName("실제 시계로 짧은 윈도우 후 허가 획득")
    void acquireWaitsForWindow() throws InterruptedException {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1, Duration.ofMillis(100));
        limiter.acquire();

        long started = System.nanoTime();
        limiter.acquire();

        assertThat(System.nanoTime() - started).isGreaterThanOrEqualTo(Duration.ofMillis(50).toNanos());
    }

    @Test
    @DisplayName("한도와 윈도우는 양수여야 한다")
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new SlidingWindowRateLimiter(0, Duration.ofMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SlidingWindowRateLimiter(1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(SlidingWindowRateLimiter.perMinute(30).getRequestsPerWindow()).isEqualTo(30);
    }
}
