package com.openlearn.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * OpenLearn Collection Pipeline Service
 *
 * 정부 통계 API와 뉴스 사이트에서 콘텐츠를 주기적으로 수집하는 서비스
 * - 우선순위 티어별 스케줄링, 재시작 후 작업 복구
 * - 검증/중복 제거/난이도 점수/지표 알림
 * - 배치 enrichment 와 2단 캐시
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollectorApplication.class, args);
    }
}
