package com.openlearn.collector.service.adapter;

import com.openlearn.collector.entity.SourceKind;

import java.util.List;

/**
 * Capability interface for one upstream source.
 *
 * {@link #fetch()} reports failures with
 * {@link com.openlearn.collector.exception.TransientSourceException} (network, 5xx, timeout),
 * {@link com.openlearn.collector.exception.ItemValidationException} (malformed response) or
 * {@link com.openlearn.collector.exception.CapacityExceededException} (HTTP 429).
 * Any other exception is treated as transient.
 */
public interface SourceAdapter {

    String sourceKey();

    SourceKind kind();

    List<RawItem> fetch();

    /**
     * Lightweight reachability check used by the admin surface.
     */
    boolean testConnection();
}
