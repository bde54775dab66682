package com.openlearn.collector.service.enrichment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordEnrichmentModelTest {

    private final KeywordEnrichmentModel model = new KeywordEnrichmentModel();

    @Test
    @DisplayName("기관, 도시, 지역어 추출")
    void extractsEntitiesAndRegionalTerms() {
        // when
        EnrichmentResult result = model.enrich("h1",
                "El Congreso aprobó en Bogotá la reforma. ¡Qué chévere, parce!");

        // then
        assertThat(result.textHash()).isEqualTo("h1");
        assertThat(result.entities()).containsEntry("institutions", List.of("congreso"));
        assertThat(result.entities()).containsEntry("cities", List.of("bogotá"));
        assertThat(result.entities()).doesNotContainKey("departments");
        assertThat(result.regionalTerms()).containsExactly("parce", "chévere");
    }

    @Test
    @DisplayName("감성 점수는 (긍정-부정)/(긍정+부정)")
    void sentimentScore() {
        // given: positive {crecimiento, avance, beneficio}, negative {crisis}
        String text = "Pese a la crisis, el crecimiento y el avance traen beneficio.";

        // when
        EnrichmentResult result = model.enrich("h2", text);

        // then
        assertThat(result.sentimentScore()).isEqualTo(0.5);
        assertThat(result.sentimentLabel()).isEqualTo("positive");
    }

    @Test
    @DisplayName("감성 단어가 없으면 중립")
    void neutralWithoutLexiconWords() {
        EnrichmentResult result = model.enrich("h3", "La sesión se realizó el martes.");

        assertThat(result.sentimentScore()).isZero();
        assertThat(result.sentimentLabel()).isEqualTo("neutral");
    }

    @Test
    @DisplayName("라벨 경계값 0.2 는 중립")
    void labelBoundaries() {
        assertThat(KeywordEnrichmentModel.label(0.2)).isEqualTo("neutral");
        assertThat(KeywordEnrichmentModel.label(0.21)).isEqualTo("positive");
        assertThat(KeywordEnrichmentModel.label(-0.2)).isEqualTo("neutral");
        assertThat(KeywordEnrichmentModel.label(-0.5)).isEqualTo("negative");
    }

    @Test
    @DisplayName("요약은 200자 + ...")
    void summaryTruncated() {
        String text = "a".repeat(250);

        EnrichmentResult result = model.enrich("h4", text);

        assertThat(result.summary()).hasSize(203).endsWith("...");
    }

    @Test
    @DisplayName("배치 결과는 요청 순서를 유지")
    void batchKeepsOrder() {
        List<EnrichmentResult> results = model.enrichBatch(List.of(
                new EnrichmentRequest("a", "crisis", EnrichmentPriority.NORMAL, 1),
                new EnrichmentRequest("b", "éxito", EnrichmentPriority.HIGH, 2)));

        assertThat(results).extracting(EnrichmentResult::textHash).containsExactly("a", "b");
        assertThat(results.get(0).sentimentLabel()).isEqualTo("negative");
        assertThat(results.get(1).sentimentLabel()).isEqualTo("positive");
    }
}
