package com.openlearn.collector.service;

import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.dto.AlertEvent;
import com.openlearn.collector.entity.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 커밋된 Alert를 Kafka로 발행합니다. 발행 실패는 로그로만 남기고 수집 결과에 영향을 주지 않습니다.
 */
@Component
@Slf4j
public class AlertEventPublisher {

    private final KafkaTemplate<String, AlertEvent> alertEventKafkaTemplate;
    private final boolean enabled;
    private final String topic;

    public AlertEventPublisher(KafkaTemplate<String, AlertEvent> alertEventKafkaTemplate,
                               CollectorProperties properties) {
        this.alertEventKafkaTemplate = alertEventKafkaTemplate;
        this.enabled = properties.getAlerts().getPublish().isEnabled();
        this.topic = properties.getAlerts().getPublish().getTopic();
    }

    public void publishAll(List<Alert> alerts) {
        alerts.forEach(this::publish);
    }

    public void publish(Alert alert) {
        if (!enabled) {
            log.debug("Alert publishing disabled, skipping alert {} ({})", alert.getId(), alert.getKind());
            return;
        }
        AlertEvent event = AlertEvent.from(alert);
        try {
            alertEventKafkaTemplate.send(topic, alert.getSourceKey(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish alert {} to {}: {}", alert.getId(), topic, ex.getMessage(), ex);
                        } else {
                            log.debug("Alert {} published to {}", alert.getId(), topic);
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Failed to publish alert {} to {}: {}", alert.getId(), topic, e.getMessage(), e);
        }
    }
}
