package com.openlearn.collector.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 임계값 규칙 또는 스케줄러 dead-letter로 생성된 알림.
 * 생성 이후에는 변경하지 않으므로 setter를 두지 않습니다.
 */
@Entity
@Table(name = "alerts", indexes = {
    @Index(name = "idx_alerts_source_key", columnList = "source_key"),
    @Index(name = "idx_alerts_kind", columnList = "kind"),
    @Index(name = "idx_alerts_created_at", columnList = "created_at")
})
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Alert {

    public static final String KIND_DEAD_LETTER = "dead_letter";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_key", nullable = false, length = 100, updatable = false)
    private String sourceKey;

    @Column(name = "kind", nullable = false, length = 50, updatable = false)
    private String kind;

    @Column(name = "threshold", updatable = false)
    private Double threshold;

    @Column(name = "observed_value", updatable = false)
    private Double observedValue;

    @Column(name = "severity", length = 20, updatable = false)
    private String severity;

    @Column(name = "message", columnDefinition = "TEXT", updatable = false)
    private String message;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
