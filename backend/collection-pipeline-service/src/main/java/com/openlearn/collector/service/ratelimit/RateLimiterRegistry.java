package com.openlearn.collector.service.ratelimit;

import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.service.SourceDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 소스별 rate limiter. 한 소스의 모든 요청(목록/기사 페이지 포함)이 같은 limiter를 공유합니다.
 */
@Component
@Slf4j
public class RateLimiterRegistry {

    private final Map<String, SourceRateLimiter> limiters = new ConcurrentHashMap<>();
    private final Duration window;

    public RateLimiterRegistry(CollectorProperties properties) {
        this.window = properties.getRateLimit().getWindow();
    }

    public SourceRateLimiter forSource(SourceDefinition source) {
        return limiters.computeIfAbsent(source.key(), key -> {
            log.debug("Creating rate limiter for {}: {} requests per {}", key, source.rateLimitPerMinute(), window);
            return new SlidingWindowRateLimiter(source.rateLimitPerMinute(), window);
        });
    }
}
