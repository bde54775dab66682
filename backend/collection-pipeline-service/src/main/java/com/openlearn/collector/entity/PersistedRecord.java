package com.openlearn.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only collected record. {@code (source_key, content_hash)} is unique at the store level.
 */
@Entity
@Table(name = "persisted_records",
    uniqueConstraints = @UniqueConstraint(name = "uk_records_source_hash", columnNames = {"source_key", "content_hash"}),
    indexes = {
        @Index(name = "idx_records_source_key", columnList = "source_key"),
        @Index(name = "idx_records_created_at", columnList = "created_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersistedRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_key", nullable = false, length = 100)
    private String sourceKey;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private SourceKind kind;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "url", columnDefinition = "TEXT")
    private String url;

    @Column(name = "derived_fields_json", columnDefinition = "TEXT")
    private String derivedFieldsJson;

    @Column(name = "payload_json", columnDefinition = "TEXT")
    private String payloadJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
