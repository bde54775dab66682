package com.openlearn.collector.dto;

import com.openlearn.collector.entity.Alert;

import java.time.LocalDateTime;

/**
 * Kafka 알림 이벤트 (collector.alerts.topic)
 */
public record AlertEvent(
        Long alertId,
        String sourceKey,
        String kind,
        Double threshold,
        Double observedValue,
        String severity,
        String message,
        LocalDateTime createdAt
) {
    public static AlertEvent from(Alert alert) {
        return new AlertEvent(
                alert.getId(),
                alert.getSourceKey(),
                alert.getKind(),
                alert.getThreshold(),
                alert.getObservedValue(),
                alert.getSeverity(),
                alert.getMessage(),
                alert.getCreatedAt()
        );
    }
}
