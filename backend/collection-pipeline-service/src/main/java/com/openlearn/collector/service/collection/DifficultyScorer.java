package com.openlearn.collector.service.collection;

import org.springframework.stereotype.Component;

/**
 * Reading difficulty for language learners, in [1.0, 5.0].
 */
@Component
public class DifficultyScorer {

    static final double BASE = 1.0;
    static final double MAX = 5.0;
    static final double EMPTY_TEXT_SCORE = 2.5;

    public double score(String text) {
        if (text == null || text.isBlank()) {
            return EMPTY_TEXT_SCORE;
        }
        String[] words = text.trim().split("\\s+");
        double meanWordLength = (double) totalLength(words) / words.length;
        double meanSentenceLength = (double) words.length / Math.max(1, sentenceCount(text));

        double score = BASE;
        if (meanWordLength > 6) {
            score += 1.0;
            if (meanWordLength > 8) {
                score += 0.5;
            }
        }
        if (meanSentenceLength > 20) {
            score += 1.0;
            if (meanSentenceLength > 30) {
                score += 0.5;
            }
        }
        return Math.min(MAX, score);
    }

    public int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    private static int totalLength(String[] words) {
        int total = 0;
        for (String word : words) {
            total += word.length();
        }
        return total;
    }

    private static int sentenceCount(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '.' || c == '!' || c == '?') {
                count++;
            }
        }
        return count;
    }
}
