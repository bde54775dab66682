package com.openlearn.collector.dto;

public record ConnectionTestResponse(
        String sourceKey,
        boolean reachable,
        long elapsedMillis
) {}
