package com.openlearn.collector.dto;

public record TriggerResponse(
        String sourceKey,
        Long jobId,
        String message
) {}
