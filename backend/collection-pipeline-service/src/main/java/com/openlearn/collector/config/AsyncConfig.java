package com.openlearn.collector.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the collection pipeline.
 *
 * Tier pools reject when saturated; the scheduler turns a rejection into a
 * capacity requeue instead of queueing without bound.
 */
@Configuration
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class AsyncConfig {

    private final CollectorProperties properties;

    /**
     * HIGH 티어 수집 실행자
     */
    @Bean(name = "highTierExecutor")
    public ThreadPoolTaskExecutor highTierExecutor() {
        return tierExecutor("tier-high-", properties.getScheduler().getHigh());
    }

    /**
     * MEDIUM 티어 수집 실행자
     */
    @Bean(name = "mediumTierExecutor")
    public ThreadPoolTaskExecutor mediumTierExecutor() {
        return tierExecutor("tier-medium-", properties.getScheduler().getMedium());
    }

    /**
     * LOW 티어 수집 실행자
     */
    @Bean(name = "lowTierExecutor")
    public ThreadPoolTaskExecutor lowTierExecutor() {
        return tierExecutor("tier-low-", properties.getScheduler().getLow());
    }

    /**
     * 주기 트리거, 재시도, heartbeat 예약 전용 스케줄러
     */
    @Bean(name = "collectionTaskScheduler")
    public ThreadPoolTaskScheduler collectionTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduler().getTriggerPoolSize());
        scheduler.setThreadNamePrefix("collection-trigger-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> log.error("Unhandled error in collection trigger: {}", t.getMessage(), t));
        scheduler.initialize();
        return scheduler;
    }

    /**
     * 어댑터 fetch 실행자. 하드 타임아웃을 걸기 위해 수집 스레드와 분리합니다.
     */
    @Bean(name = "fetchExecutor")
    public ThreadPoolTaskExecutor fetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getFetch().getPoolSize());
        executor.setMaxPoolSize(properties.getFetch().getPoolSize());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("source-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Enrichment 모델 호출 실행자
     */
    @Bean(name = "enrichmentExecutor")
    public ThreadPoolTaskExecutor enrichmentExecutor() {
        int workers = properties.getEnrichment().getWorkerCount();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("enrichment-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private ThreadPoolTaskExecutor tierExecutor(String prefix, CollectorProperties.Tier tier) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(tier.getPoolSize());
        executor.setMaxPoolSize(tier.getPoolSize());
        executor.setQueueCapacity(tier.getQueueCapacity());
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }
}
