package com.openlearn.collector.config;

import com.openlearn.collector.service.cache.LayeredCacheManager;
import com.openlearn.collector.service.enrichment.BatchEnrichmentProcessor;
import com.openlearn.collector.service.enrichment.EnrichmentModel;
import com.openlearn.collector.service.enrichment.KeywordEnrichmentModel;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Enrichment 설정. 다른 {@link EnrichmentModel} 빈이 있으면 사전 기반 모델 대신 사용합니다.
 */
@Configuration
public class EnrichmentConfig {

    @Bean
    @ConditionalOnMissingBean(EnrichmentModel.class)
    public EnrichmentModel keywordEnrichmentModel() {
        return new KeywordEnrichmentModel();
    }

    @Bean
    public BatchEnrichmentProcessor batchEnrichmentProcessor(EnrichmentModel enrichmentModel,
                                                             LayeredCacheManager layeredCacheManager,
                                                             @Qualifier("enrichmentExecutor") ThreadPoolTaskExecutor enrichmentExecutor,
                                                             CollectorProperties properties,
                                                             MeterRegistry meterRegistry) {
        CollectorProperties.Enrichment enrichment = properties.getEnrichment();
        return new BatchEnrichmentProcessor(
                enrichmentModel,
                layeredCacheManager,
                enrichmentExecutor,
                enrichment.getBatchSize(),
                enrichment.getBatchTimeout(),
                enrichment.getCacheTtl(),
                meterRegistry
        );
    }
}
