package com.openlearn.collector.entity;

import com.openlearn.collector.service.enrichment.EnrichmentPriority;

import java.time.Duration;

/**
 * Collection tier of a source.
 * Each tier owns an interval band, a default retry budget and its own worker pool.
 */
public enum SourcePriority {
    HIGH(Duration.ofMinutes(15), 5),
    MEDIUM(Duration.ofMinutes(30), 3),
    LOW(Duration.ofMinutes(60), 2);

    private final Duration defaultInterval;
    private final int defaultMaxRetries;

    SourcePriority(Duration defaultInterval, int defaultMaxRetries) {
        this.defaultInterval = defaultInterval;
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public Duration getDefaultInterval() {
        return defaultInterval;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    /**
     * Enrichment requests inherit the urgency of the tier that produced the text.
     */
    public EnrichmentPriority toEnrichmentPriority() {
        return switch (this) {
            case HIGH -> EnrichmentPriority.HIGH;
            case MEDIUM -> EnrichmentPriority.NORMAL;
            case LOW -> EnrichmentPriority.LOW;
        };
    }

    public static SourcePriority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return LOW;
        }
        return SourcePriority.valueOf(value.trim().toUpperCase());
    }
}
