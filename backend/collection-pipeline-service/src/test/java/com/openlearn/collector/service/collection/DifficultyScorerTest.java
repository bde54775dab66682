package com.openlearn.collector.service.collection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DifficultyScorerTest {

    private final DifficultyScorer scorer = new DifficultyScorer();

    @Test
    @DisplayName("빈 텍스트는 기본 난이도 2.5")
    void emptyText() {
        assertThat(scorer.score(null)).isEqualTo(2.5);
        assertThat(scorer.score("   ")).isEqualTo(2.5);
        assertThat(scorer.wordCount("")).isZero();
    }

    @Test
    @DisplayName("짧은 단어와 짧은 문장은 최저 난이도")
    void simpleText() {
        // given
        String text = "El gato come. La casa es azul. Yo voy hoy.";

        // when
        double score = scorer.score(text);

        // then
        assertThat(score).isEqualTo(1.0);
        assertThat(scorer.wordCount(text)).isEqualTo(10);
    }

    @Test
    @DisplayName("긴 단어와 긴 문장이면 난이도가 올라가고 5.0을 넘지 않는다")
    void complexText() {
        // given: 35 words, one sentence, mean word length > 8
        String text = "administración ".repeat(35).trim() + ".";

        // when
        double score = scorer.score(text);

        // then
        assertThat(score).isEqualTo(4.0);
        assertThat(score).isLessThanOrEqualTo(5.0);
    }

    @Test
    @DisplayName("평균 단어 길이 6 초과면 +1.0")
    void longWordsOnly() {
        String text = "gobierno anuncia reformas. economía crece mucho.";

        assertThat(scorer.score(text)).isEqualTo(2.0);
    }
}
