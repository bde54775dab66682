package com.openlearn.collector.service.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openlearn.collector.TestSources;
import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.entity.SourcePriority;
import com.openlearn.collector.exception.CapacityExceededException;
import com.openlearn.collector.exception.ItemValidationException;
import com.openlearn.collector.exception.TransientSourceException;
import com.openlearn.collector.service.SourceDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JsonApiSourceAdapter 단위 테스트
 */
class JsonApiSourceAdapterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneId.of("UTC"));

    private final SourceDefinition source = TestSources.api("dane_ipc", SourcePriority.HIGH, 5);
    private final StubExchange exchange = new StubExchange();

    private JsonApiSourceAdapter adapter() {
        return new JsonApiSourceAdapter(source, exchange.webClient(), new ObjectMapper(), CLOCK);
    }

    @Test
    @DisplayName("data 배열의 각 원소가 하나의 항목이 된다")
    void unwrapsEnvelope() {
        exchange.ok(source.url(), MediaType.APPLICATION_JSON,
                "{\"data\":[{\"indicador\":\"ipc\",\"valor\":1.5},{\"indicador\":\"ipc\",\"valor\":1.7}]}");

        List<RawItem> items = adapter().fetch();

        assertThat(items).hasSize(2);
        assertThat(items).allSatisfy(item -> {
            assertThat(item.sourceKey()).isEqualTo("dane_ipc");
            assertThat(item.kind()).isEqualTo(SourceKind.API);
            assertThat(item.payload()).containsEntry("source", "dane_ipc")
                    .containsEntry("extracted_at", "2026-03-01T12:00");
        });
        assertThat(items.get(0).payload().get("data")).isEqualTo(Map.of("indicador", "ipc", "valor", 1.5));
    }

    @Test
    @DisplayName("최상위 배열과 단일 객체도 받는다")
    void acceptsArrayAndSingleObject() {
        exchange.ok(source.url(), MediaType.APPLICATION_JSON, "[{\"a\":1},{\"a\":2},{\"a\":3}]");
        assertThat(adapter().fetch()).hasSize(3);

        exchange.ok(source.url(), MediaType.APPLICATION_JSON, "{\"tasa\":9.25}");
        assertThat(adapter().fetch()).singleElement()
                .satisfies(item -> assertThat(item.payload().get("data")).isEqualTo(Map.of("tasa", 9.25)));
    }

    @Test
    @DisplayName("JSON 이 아니면 검증 실패")
    void unparseableBody() {
        exchange.ok(source.url(), MediaType.APPLICATION_JSON, "<html>maintenance</html>");

        assertThatThrownBy(() -> adapter().fetch()).isInstanceOf(ItemValidationException.class);
    }

    @Test
    @DisplayName("429 는 Retry-After 를 담은 용량 초과")
    void rateLimited() {
        exchange.status(source.url(), HttpStatus.TOO_MANY_REQUESTS, "Retry-After", "42");

        assertThatThrownBy(() -> adapter().fetch())
                .isInstanceOfSatisfying(CapacityExceededException.class,
                        e -> assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(42)));
    }

    @Test
    @DisplayName("5xx 는 일시적 오류, 그 밖의 4xx 는 검증 실패")
    void statusClassification() {
        exchange.status(source.url(), HttpStatus.SERVICE_UNAVAILABLE);
        assertThatThrownBy(() -> adapter().fetch()).isInstanceOf(TransientSourceException.class);

        exchange.status(source.url(), HttpStatus.FORBIDDEN);
        assertThatThrownBy(() -> adapter().fetch()).isInstanceOf(ItemValidationException.class);
    }

    @Test
    @DisplayName("연결 테스트는 예외 대신 false 를 돌려준다")
    void testConnection() {
        exchange.status(source.url(), HttpStatus.BAD_GATEWAY);
        assertThat(adapter().testConnection()).isFalse();

        exchange.ok(source.url(), MediaType.APPLICATION_JSON, "[]");
        assertThat(adapter().testConnection()).isTrue();
    }
}
