package com.openlearn.collector.service.collection;

import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.entity.Alert;
import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.service.adapter.RawItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 구조화 데이터(API 항목의 {@code data})에 대한 임계값 규칙 평가.
 * 규칙은 서로 독립적으로 평가되며 일치할 때마다 Alert 하나를 만듭니다.
 */
@Component
@Slf4j
public class AlertRuleEvaluator {

    private final List<CollectorProperties.AlertRule> rules;

    @Autowired
    public AlertRuleEvaluator(CollectorProperties properties) {
        this(properties.getAlerts().getRules());
    }

    AlertRuleEvaluator(List<CollectorProperties.AlertRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<Alert> evaluate(RawItem item, LocalDateTime now) {
        if (item.kind() != SourceKind.API || !(item.payload().get("data") instanceof Map<?, ?> data)) {
            return List.of();
        }
        List<Alert> alerts = new ArrayList<>();
        for (CollectorProperties.AlertRule rule : rules) {
            if (!rule.getSources().isEmpty() && !rule.getSources().contains(item.sourceKey())) {
                continue;
            }
            Double observed = numeric(data.get(rule.getField()));
            if (observed == null || !matches(rule, observed)) {
                continue;
            }
            alerts.add(Alert.builder()
                    .sourceKey(item.sourceKey())
                    .kind(rule.getKind())
                    .threshold(rule.getThreshold())
                    .observedValue(observed)
                    .severity(rule.getSeverity())
                    .message(String.format(Locale.ROOT, "%s: %s=%s (threshold %s %s)",
                            rule.getKind(), rule.getField(), observed, rule.getOperator(), rule.getThreshold()))
                    .createdAt(now)
                    .build());
        }
        return alerts;
    }

    static boolean matches(CollectorProperties.AlertRule rule, double observed) {
        double threshold = rule.getThreshold();
        return switch (rule.getOperator().toUpperCase(Locale.ROOT)) {
            case "GT" -> observed > threshold;
            case "GTE" -> observed >= threshold;
            case "LT" -> observed < threshold;
            case "LTE" -> observed <= threshold;
            default -> throw new IllegalStateException("Unknown alert operator: " + rule.getOperator());
        };
    }

    private static Double numeric(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim().replace(',', '.'));
            } catch (NumberFormatException e) {
                log.trace("Non-numeric indicator value '{}'", text);
                return null;
            }
        }
        return null;
    }
}
