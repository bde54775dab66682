package com.openlearn.collector.dto;

import java.time.LocalDateTime;

public record AlertDTO(
        Long id,
        String sourceKey,
        String kind,
        Double threshold,
        Double observedValue,
        String severity,
        String message,
        LocalDateTime createdAt
) {}
