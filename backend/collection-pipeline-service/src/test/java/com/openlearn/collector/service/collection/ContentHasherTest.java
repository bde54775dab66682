package com.openlearn.collector.service.collection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.service.adapter.RawItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHasherTest {

    private final ContentHasher hasher = new ContentHasher(new ObjectMapper());

    @Test
    @DisplayName("API 항목 해시는 키 순서와 수집 시각에 영향받지 않는다")
    void apiHashIgnoresKeyOrderAndFetchTime() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("periodo", "2026-02");
        first.put("variacion_mensual", 1.5);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("variacion_mensual", 1.5);
        second.put("periodo", "2026-02");

        RawItem a = new RawItem("dane_ipc", SourceKind.API, LocalDateTime.of(2026, 3, 1, 9, 0),
                Map.of("data", first, "extracted_at", "2026-03-01T09:00:00"));
        RawItem b = new RawItem("dane_ipc", SourceKind.API, LocalDateTime.of(2026, 3, 2, 9, 0),
                Map.of("data", second, "extracted_at", "2026-03-02T09:00:00"));

        assertThat(hasher.hash(a)).isEqualTo(hasher.hash(b)).hasSize(64);
    }

    @Test
    @DisplayName("문서 해시는 url/title/content 로 구분된다")
    void documentHashUsesUrlTitleContent() {
        RawItem a = doc("https://eltiempo.com/a", "Título", "Cuerpo");
        RawItem b = doc("https://eltiempo.com/b", "Título", "Cuerpo");

        assertThat(hasher.hash(a)).isNotEqualTo(hasher.hash(b));
        assertThat(hasher.hash(a)).isEqualTo(hasher.hash(doc("https://eltiempo.com/a", "Título", "Cuerpo")));
    }

    private static RawItem doc(String url, String title, String content) {
        return new RawItem("el_tiempo", SourceKind.SCRAPER, LocalDateTime.now(),
                Map.of("url", url, "title", title, "content", content));
    }
}
