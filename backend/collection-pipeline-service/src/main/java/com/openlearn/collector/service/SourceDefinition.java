package com.openlearn.collector.service;

import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.entity.SourcePriority;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable description of a collection source.
 */
public record SourceDefinition(
        String key,
        String name,
        SourceKind kind,
        SourcePriority priority,
        Duration interval,
        int rateLimitPerMinute,
        int maxRetries,
        boolean enabled,
        String category,
        String url,
        Map<String, String> selectors,
        Map<String, String> metadata
) {

    public SourceDefinition {
        selectors = selectors == null ? Map.of() : Map.copyOf(selectors);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String selector(String name, String defaultValue) {
        String value = selectors.get(name);
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
