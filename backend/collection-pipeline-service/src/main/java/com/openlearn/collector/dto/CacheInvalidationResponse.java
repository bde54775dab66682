package com.openlearn.collector.dto;

public record CacheInvalidationResponse(
        String pattern,
        long removed
) {}
