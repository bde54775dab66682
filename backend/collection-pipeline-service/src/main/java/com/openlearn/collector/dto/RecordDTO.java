package com.openlearn.collector.dto;

import com.openlearn.collector.entity.SourceKind;

import java.time.LocalDateTime;
import java.util.Map;

public record RecordDTO(
        Long id,
        String sourceKey,
        SourceKind kind,
        String contentHash,
        String title,
        String url,
        Map<String, Object> derivedFields,
        Map<String, Object> payload,
        LocalDateTime createdAt
) {}
