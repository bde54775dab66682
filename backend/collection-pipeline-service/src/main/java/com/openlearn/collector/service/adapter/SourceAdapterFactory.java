package com.openlearn.collector.service.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.service.SourceDefinition;
import com.openlearn.collector.service.ratelimit.RateLimiterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * 전용 어댑터 빈이 없는 소스에 범용 어댑터를 만들어 줍니다.
 */
@Component
@RequiredArgsConstructor
public class SourceAdapterFactory {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final CollectorProperties properties;
    private final Clock clock;

    public SourceAdapter create(SourceDefinition source) {
        if (source.url() == null || source.url().isBlank()) {
            throw new IllegalStateException("Source '" + source.key() + "' has no adapter bean and no url");
        }
        return switch (source.kind()) {
            case API -> new JsonApiSourceAdapter(source, webClient, objectMapper, clock);
            case SCRAPER -> new HtmlScraperSourceAdapter(source, webClient,
                    rateLimiterRegistry.forSource(source),
                    properties.getRateLimit().getAcquireTimeout(), clock);
        };
    }
}
