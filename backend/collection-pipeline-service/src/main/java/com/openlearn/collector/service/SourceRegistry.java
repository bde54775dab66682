package com.openlearn.collector.service;

import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.entity.SourcePriority;
import com.openlearn.collector.exception.SourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 소스 정의 테이블. 기동 시 한 번 로드되며 이후 변경되지 않습니다.
 */
@Component
@Slf4j
public class SourceRegistry {

    private final Map<String, SourceDefinition> sources;

    @Autowired
    public SourceRegistry(CollectorProperties properties) {
        this(load(properties.getSources(), properties.getRateLimit().getDefaultPerMinute()));
    }

    public SourceRegistry(List<SourceDefinition> definitions) {
        Map<String, SourceDefinition> byKey = new LinkedHashMap<>();
        for (SourceDefinition definition : definitions) {
            if (byKey.putIfAbsent(definition.key(), definition) != null) {
                throw new IllegalStateException("Duplicate source key: " + definition.key());
            }
        }
        this.sources = Collections.unmodifiableMap(byKey);
        log.info("Loaded {} collection sources ({} enabled)", sources.size(),
                sources.values().stream().filter(SourceDefinition::enabled).count());
    }

    public Collection<SourceDefinition> all() {
        return sources.values();
    }

    public List<SourceDefinition> enabled() {
        return sources.values().stream().filter(SourceDefinition::enabled).toList();
    }

    public Optional<SourceDefinition> find(String key) {
        return Optional.ofNullable(sources.get(key));
    }

    /**
     * @throws SourceNotFoundException 등록되지 않은 키
     */
    public SourceDefinition get(String key) {
        SourceDefinition definition = sources.get(key);
        if (definition == null) {
            throw new SourceNotFoundException(key);
        }
        return definition;
    }

    static List<SourceDefinition> load(List<CollectorProperties.SourceEntry> entries, int defaultRateLimit) {
        return entries.stream().map(entry -> toDefinition(entry, defaultRateLimit)).toList();
    }

    static SourceDefinition toDefinition(CollectorProperties.SourceEntry entry, int defaultRateLimit) {
        if (entry.getKey() == null || entry.getKey().isBlank()) {
            throw new IllegalStateException("Source entry without key: " + entry);
        }
        SourceKind kind;
        SourcePriority priority;
        try {
            kind = SourceKind.fromValue(entry.getKind());
            priority = SourcePriority.fromValue(entry.getPriority());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid source '" + entry.getKey() + "': " + e.getMessage(), e);
        }

        Duration interval = entry.getInterval() != null ? entry.getInterval() : priority.getDefaultInterval();
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalStateException("Source '" + entry.getKey() + "' must have a positive interval");
        }
        int rateLimit = entry.getRateLimitPerMinute() != null ? entry.getRateLimitPerMinute() : defaultRateLimit;
        if (rateLimit <= 0) {
            throw new IllegalStateException("Source '" + entry.getKey() + "' must have a positive rate limit");
        }
        int maxRetries = entry.getMaxRetries() != null ? entry.getMaxRetries() : priority.getDefaultMaxRetries();
        if (maxRetries < 0) {
            throw new IllegalStateException("Source '" + entry.getKey() + "' must not have negative max retries");
        }

        return new SourceDefinition(
                entry.getKey(),
                entry.getName() != null ? entry.getName() : entry.getKey(),
                kind,
                priority,
                interval,
                rateLimit,
                maxRetries,
                entry.isEnabled(),
                entry.getCategory(),
                entry.getUrl(),
                entry.getSelectors(),
                entry.getMetadata()
        );
    }
}
