package com.goormthonuniv.derigo.author;

import com.goormthonuniv.derigo.domain.ContentSignals;
import com.goormthonuniv.derigo.util.TextUtils;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.goormthonuniv.derigo.pattern.PatternLibrary.*;

/**
 * 원문에서 작성자 행동 신호를 뽑는다. 부수효과 없는 순수 함수이며
 * 같은 입력이면 항상 같은 결과를 낸다.
 */
@Component
public class ContentSignalExtractor {

    private static final int MIN_REPEAT_SENTENCE_LENGTH = 10;

    public ContentSignals extract(String content) {
        String text = content == null ? "" : content;
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> words = TextUtils.words(lower);
        List<String> sentences = TextUtils.sentences(text);
        int sentenceCount = Math.max(sentences.size(), 1);

        double repetition = repetition(sentences);

        return new ContentSignals(
                repetition,
                templateLikelihood(text),
                0,          // 정교한 NLP 가 필요. 협력자가 채우지 않으면 0
                emotionalDensity(words),
                TextUtils.countMatches(PERSONAL_ATTACKS, text),
                TextUtils.countMatches(BAD_FAITH, text),
                engagementBait(text),
                (double) TextUtils.countMatches(PROMOTIONAL, lower) / sentenceCount,
                TextUtils.countMatches(AFFILIATE_MARKERS, text),
                0,          // 상품 DB 필요
                0,          // 문서 간 비교 필요(범위 밖)
                (double) TextUtils.countMatches(WHATABOUTISM, text) / sentenceCount,
                personalVoice(lower, sentences),
                nuance(lower),
                1 - repetition
        );
    }

    // ===================== 봇 =====================

    /**
     * 정규화 문장이 2회 이상 나온 문장의 비율. 문장이 3개 미만이면 0.
     */
    double repetition(List<String> sentences) {
        if (sentences.size() < 3) return 0;
        Map<String, Integer> buckets = new HashMap<>();
        for (String s : sentences) {
            String normalized = s.toLowerCase(Locale.ROOT).strip();
            if (normalized.length() > MIN_REPEAT_SENTENCE_LENGTH) {
                buckets.merge(normalized, 1, Integer::sum);
            }
        }
        int repeatedSentences = buckets.values().stream()
                .filter(c -> c > 1)
                .mapToInt(Integer::intValue)
                .sum();
        return Math.min(1.0, (double) repeatedSentences / sentences.size());
    }

    double templateLikelihood(String text) {
        return Math.min(1.0, TextUtils.countMatches(TEMPLATE_MARKERS, text) * 0.5);
    }

    // ===================== 트롤 =====================

    double emotionalDensity(List<String> lowerWords) {
        if (lowerWords.isEmpty()) return 0;
        long hits = lowerWords.stream()
                .map(TextUtils::bareWord)
                .filter(EMOTIONAL_WORDS::contains)
                .count();
        return (double) hits / lowerWords.size();
    }

    double engagementBait(String text) {
        return Math.min(1.0, TextUtils.countMatches(ENGAGEMENT_BAIT, text) * 0.3);
    }

    // ===================== 진정성(긍정) =====================

    double personalVoice(String lower, List<String> sentences) {
        double score = 0;
        if (REFLECTIVE_FIRST_PERSON.matcher(lower).find()) score += 0.2;
        if (OWN_PERSPECTIVE.matcher(lower).find()) score += 0.2;
        if (HEDGING.matcher(lower).find()) score += 0.15;
        if (UNCERTAINTY.matcher(lower).find()) score += 0.2;

        // 길고 다양한 문장 구조
        if (!sentences.isEmpty()) {
            double avgLength = sentences.stream().mapToInt(String::length).average().orElse(0);
            if (avgLength > 80 && avgLength < 200) score += 0.15;
        }

        if (FIRST_PERSON_STORY.matcher(lower).find()) score += 0.1;
        return Math.min(1.0, score);
    }

    double nuance(String lower) {
        double score = 0;
        if (OTHER_VIEWPOINTS.matcher(lower).find()) score += 0.2;
        if (CONDITIONALS.matcher(lower).find()) score += 0.15;
        if (COMPLEXITY.matcher(lower).find()) score += 0.15;
        if (REFERENCES.matcher(lower).find()) score += 0.2;

        // 수사적 반문이 아닌 질문
        int questions = TextUtils.countMatches(QUESTION, lower);
        if (questions > 0 && !RHETORICAL_QUESTION.matcher(lower).find()) {
            score += Math.min(0.2, questions * 0.05);
        }

        if (LIMITATIONS.matcher(lower).find()) score += 0.1;
        return Math.min(1.0, score);
    }
}
