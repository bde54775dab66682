package com.openlearn.collector.service.collection;

import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.entity.Alert;
import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.service.adapter.RawItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AlertRuleEvaluator 단위 테스트
 */
class AlertRuleEvaluatorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 9, 0);

    private final AlertRuleEvaluator evaluator = new AlertRuleEvaluator(new CollectorProperties());

    @Test
    @DisplayName("월간 물가상승률 1.5 는 inflation 알림 1건")
    void inflationAboveThreshold() {
        // given
        RawItem item = apiItem("dane_ipc", Map.of("variacion_mensual", 1.5));

        // when
        List<Alert> alerts = evaluator.evaluate(item, NOW);

        // then
        assertThat(alerts).hasSize(1);
        Alert alert = alerts.get(0);
        assertThat(alert.getKind()).isEqualTo("inflation");
        assertThat(alert.getSourceKey()).isEqualTo("dane_ipc");
        assertThat(alert.getThreshold()).isEqualTo(1.0);
        assertThat(alert.getObservedValue()).isEqualTo(1.5);
        assertThat(alert.getSeverity()).isEqualTo("high");
        assertThat(alert.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("임계값과 같으면 GT 규칙은 일치하지 않는다")
    void boundaryIsExclusive() {
        RawItem item = apiItem("dane_ipc", Map.of("variacion_mensual", 1.0));

        assertThat(evaluator.evaluate(item, NOW)).isEmpty();
    }

    @Test
    @DisplayName("여러 규칙이 독립적으로 평가된다")
    void rulesAreIndependent() {
        // given
        RawItem item = apiItem("dane_geih", Map.of(
                "variacion_mensual", "1,2",
                "tasa_desempleo", 16.3,
                "variacion_trimestral", -2.5));

        // when
        List<Alert> alerts = evaluator.evaluate(item, NOW);

        // then
        assertThat(alerts).extracting(Alert::getKind)
                .containsExactly("inflation", "unemployment", "gdp_contraction");
    }

    @Test
    @DisplayName("숫자가 아니거나 없는 필드는 무시")
    void nonNumericIgnored() {
        RawItem item = apiItem("dane_ipc", Map.of("variacion_mensual", "n/d"));

        assertThat(evaluator.evaluate(item, NOW)).isEmpty();
    }

    @Test
    @DisplayName("스크래퍼 항목은 평가하지 않는다")
    void scraperItemsSkipped() {
        RawItem item = new RawItem("el_tiempo", SourceKind.SCRAPER, NOW,
                Map.of("data", Map.of("variacion_mensual", 9.9)));

        assertThat(evaluator.evaluate(item, NOW)).isEmpty();
    }

    @Test
    @DisplayName("sources 가 지정된 규칙은 해당 소스에만 적용")
    void ruleScopedToSources() {
        // given
        CollectorProperties.AlertRule rule = new CollectorProperties.AlertRule("tasa", "GTE", 10.0, "rate", "low");
        rule.setSources(List.of("banrep_tasas"));
        AlertRuleEvaluator scoped = new AlertRuleEvaluator(List.of(rule));

        // when / then
        assertThat(scoped.evaluate(apiItem("banrep_tasas", Map.of("tasa", 10.0)), NOW)).hasSize(1);
        assertThat(scoped.evaluate(apiItem("dane_ipc", Map.of("tasa", 10.0)), NOW)).isEmpty();
    }

    @Test
    @DisplayName("알 수 없는 연산자는 예외")
    void unknownOperator() {
        CollectorProperties.AlertRule rule = new CollectorProperties.AlertRule("x", "EQ", 1.0, "k", "low");

        assertThatThrownBy(() -> AlertRuleEvaluator.matches(rule, 1.0))
                .isInstanceOf(IllegalStateException.class);
    }

    private static RawItem apiItem(String sourceKey, Map<String, Object> data) {
        return new RawItem(sourceKey, SourceKind.API, NOW, Map.of("source", sourceKey, "data", data));
    }
}
