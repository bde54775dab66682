package com.openlearn.collector.service.adapter;

import com.openlearn.collector.entity.SourceKind;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One fetched item before validation.
 *
 * API items carry {@code source}, {@code data} and {@code extracted_at};
 * documents carry {@code title}, {@code content} and {@code url}.
 * {@code contentHash} is null when the adapter leaves hashing to the orchestrator.
 */
public record RawItem(
        String sourceKey,
        SourceKind kind,
        LocalDateTime fetchedAt,
        Map<String, Object> payload,
        String contentHash
) {

    public RawItem(String sourceKey, SourceKind kind, LocalDateTime fetchedAt, Map<String, Object> payload) {
        this(sourceKey, kind, fetchedAt, payload, null);
    }

    public RawItem withContentHash(String hash) {
        return new RawItem(sourceKey, kind, fetchedAt, payload, hash);
    }

    public String stringField(String name) {
        Object value = payload == null ? null : payload.get(name);
        return value == null ? null : value.toString();
    }
}
