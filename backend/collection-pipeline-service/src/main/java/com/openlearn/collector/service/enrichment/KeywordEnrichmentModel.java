package com.openlearn.collector.service.enrichment;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 사전 기반 기본 enrichment 모델 (콜롬비아 스페인어).
 *
 * - 기관/도시/주(departamento) 개체 사전 매칭
 * - 감성 점수 = (긍정 - 부정) / 매칭된 감성 단어 수, ±0.2 기준 라벨
 * - 지역 속어 탐지
 * - 앞 200자 요약
 */
public class KeywordEnrichmentModel implements EnrichmentModel {

    static final int SUMMARY_LENGTH = 200;
    static final double LABEL_THRESHOLD = 0.2;

    private static final Map<String, List<String>> ENTITY_LEXICON = new LinkedHashMap<>();

    static {
        ENTITY_LEXICON.put("institutions", List.of(
                "congreso", "senado", "cámara de representantes", "dane", "banco de la república",
                "corte constitucional", "fiscalía", "procuraduría", "contraloría"));
        ENTITY_LEXICON.put("cities", List.of(
                "bogotá", "medellín", "cali", "barranquilla", "cartagena", "cúcuta",
                "bucaramanga", "pereira", "manizales", "ibagué", "santa marta"));
        ENTITY_LEXICON.put("departments", List.of(
                "antioquia", "cundinamarca", "valle del cauca", "atlántico", "santander", "bolívar"));
    }

    private static final List<String> POSITIVE_WORDS = List.of(
            "éxito", "mejor", "ganancia", "crecimiento", "avance",
            "positivo", "beneficio", "progreso", "bueno", "excelente");

    private static final List<String> NEGATIVE_WORDS = List.of(
            "crisis", "problema", "caída", "pérdida", "preocupación",
            "negativo", "riesgo", "fracaso", "malo", "difícil");

    private static final List<String> REGIONAL_TERMS = List.of(
            "parce", "chimba", "bacano", "chévere", "teso",
            "vaina", "parcero", "pola", "guaro", "rumba");

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

    @Override
    public List<EnrichmentResult> enrichBatch(List<EnrichmentRequest> requests) {
        List<EnrichmentResult> results = new ArrayList<>(requests.size());
        for (EnrichmentRequest request : requests) {
            results.add(enrich(request.textHash(), request.text()));
        }
        return results;
    }

    @Override
    public String name() {
        return "keyword";
    }

    EnrichmentResult enrich(String textHash, String text) {
        String source = text == null ? "" : text;
        String lower = Normalizer.normalize(source, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        Set<String> words = words(lower);

        Map<String, List<String>> entities = new LinkedHashMap<>();
        ENTITY_LEXICON.forEach((type, terms) -> {
            List<String> found = terms.stream().filter(term -> containsTerm(lower, term)).toList();
            if (!found.isEmpty()) {
                entities.put(type, found);
            }
        });

        long positive = POSITIVE_WORDS.stream().filter(words::contains).count();
        long negative = NEGATIVE_WORDS.stream().filter(words::contains).count();
        long matched = positive + negative;
        double score = matched == 0 ? 0.0 : (double) (positive - negative) / matched;

        List<String> regional = REGIONAL_TERMS.stream().filter(words::contains).toList();

        String summary = source.length() > SUMMARY_LENGTH ? source.substring(0, SUMMARY_LENGTH) + "..." : source;

        return new EnrichmentResult(textHash, entities, score, label(score), regional, summary);
    }

    static String label(double score) {
        if (score > LABEL_THRESHOLD) {
            return "positive";
        }
        if (score < -LABEL_THRESHOLD) {
            return "negative";
        }
        return "neutral";
    }

    private static Set<String> words(String lower) {
        Set<String> words = new HashSet<>();
        Matcher m = WORD.matcher(lower);
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }

    private static boolean containsTerm(String lower, String term) {
        Pattern p = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(term) + "(?![\\p{L}\\p{N}])");
        return p.matcher(lower).find();
    }
}
