package com.openlearn.collector.service;

import com.openlearn.collector.TestSources;
import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.entity.SourcePriority;
import com.openlearn.collector.exception.SourceNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SourceRegistry 단위 테스트
 */
class SourceRegistryTest {

    @Test
    @DisplayName("설정 항목의 누락 값은 티어 기본값으로 채운다")
    void appliesTierDefaults() {
        // given
        CollectorProperties.SourceEntry entry = new CollectorProperties.SourceEntry();
        entry.setKey("dane_ipc");
        entry.setKind("api");
        entry.setPriority("high");

        // when
        SourceDefinition definition = SourceRegistry.toDefinition(entry, 60);

        // then
        assertThat(definition.name()).isEqualTo("dane_ipc");
        assertThat(definition.kind()).isEqualTo(SourceKind.API);
        assertThat(definition.priority()).isEqualTo(SourcePriority.HIGH);
        assertThat(definition.interval()).isEqualTo(SourcePriority.HIGH.getDefaultInterval());
        assertThat(definition.maxRetries()).isEqualTo(SourcePriority.HIGH.getDefaultMaxRetries());
        assertThat(definition.rateLimitPerMinute()).isEqualTo(60);
    }

    @Test
    @DisplayName("명시한 간격/재시도/한도는 그대로 사용")
    void explicitValuesWin() {
        CollectorProperties.SourceEntry entry = new CollectorProperties.SourceEntry();
        entry.setKey("el_tiempo");
        entry.setKind("scraper");
        entry.setInterval(Duration.ofMinutes(5));
        entry.setMaxRetries(1);
        entry.setRateLimitPerMinute(10);

        SourceDefinition definition = SourceRegistry.toDefinition(entry, 60);

        assertThat(definition.kind()).isEqualTo(SourceKind.SCRAPER);
        assertThat(definition.priority()).isEqualTo(SourcePriority.LOW);
        assertThat(definition.interval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(definition.maxRetries()).isEqualTo(1);
        assertThat(definition.rateLimitPerMinute()).isEqualTo(10);
    }

    @Test
    @DisplayName("잘못된 항목은 기동 시 실패")
    void rejectsInvalidEntries() {
        CollectorProperties.SourceEntry badKind = new CollectorProperties.SourceEntry();
        badKind.setKey("x");
        badKind.setKind("ftp");
        CollectorProperties.SourceEntry badInterval = new CollectorProperties.SourceEntry();
        badInterval.setKey("y");
        badInterval.setInterval(Duration.ZERO);

        assertThatThrownBy(() -> SourceRegistry.toDefinition(badKind, 60)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> SourceRegistry.toDefinition(badInterval, 60)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("중복 키는 허용하지 않는다")
    void rejectsDuplicateKeys() {
        assertThatThrownBy(() -> new SourceRegistry(List.of(
                TestSources.api("dane_ipc", SourcePriority.HIGH, 3),
                TestSources.api("dane_ipc", SourcePriority.LOW, 3))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("enabled 는 비활성 소스를 제외하고 get 은 미등록 키에 예외")
    void lookup() {
        SourceRegistry registry = new SourceRegistry(List.of(
                TestSources.api("dane_ipc", SourcePriority.HIGH, 3),
                TestSources.disabled("old_feed")));

        assertThat(registry.all()).hasSize(2);
        assertThat(registry.enabled()).extracting(SourceDefinition::key).containsExactly("dane_ipc");
        assertThat(registry.find("old_feed")).isPresent();
        assertThatThrownBy(() -> registry.get("missing")).isInstanceOf(SourceNotFoundException.class);
    }
}
