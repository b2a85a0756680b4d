package com.goormthonuniv.derigo.classify;

import com.goormthonuniv.derigo.config.ScoringProperties.TruthTuning;
import com.goormthonuniv.derigo.domain.SourceEntry;
import com.goormthonuniv.derigo.pattern.PatternLibrary;
import com.goormthonuniv.derigo.util.TextUtils;

import java.util.List;
import java.util.Locale;

/**
 * 진실성 점수(0 ~ 100) 추정.
 * 기준점 = 출처의 사실성 평점(없으면 중립값) + 본문 품질 신호 가감.
 */
public class TruthEstimator {

    private final TruthTuning tuning;

    public TruthEstimator(TruthTuning tuning) {
        this.tuning = tuning;
    }

    public int estimate(String text, SourceEntry source) {
        int score = source != null ? source.factualRating() : tuning.getNeutralBaseline();
        if (text == null || text.isBlank()) return clamp(score);

        String lower = text.toLowerCase(Locale.ROOT);

        // ----- 감점 -----
        if (capsRatio(text) > tuning.getCapsRatio()) score -= tuning.getCapsPenalty();
        if (TextUtils.containsAny(lower, PatternLibrary.CLICKBAIT_PHRASES)) score -= tuning.getClickbaitPenalty();
        if (sensationalWordCount(lower) > tuning.getEmotionalWordThreshold()) score -= tuning.getEmotionalPenalty();

        // ----- 가점 -----
        if (TextUtils.containsAny(lower, PatternLibrary.CITATION_PHRASES)) score += tuning.getCitationBonus();
        if (PatternLibrary.STATISTIC.matcher(text).find()) score += tuning.getStatisticBonus();
        if (PatternLibrary.LONG_QUOTE.matcher(text).find()) score += tuning.getQuoteBonus();

        return clamp(score);
    }

    /** 3자 이상이면서 글자를 포함하고 전부 대문자인 단어의 비율 */
    static double capsRatio(String text) {
        List<String> words = TextUtils.words(text);
        if (words.isEmpty()) return 0;
        long caps = words.stream().filter(TruthEstimator::isShouted).count();
        return (double) caps / words.size();
    }

    private static boolean isShouted(String word) {
        if (word.length() <= 2) return false;
        boolean hasLetter = false;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isLetter(c)) {
                hasLetter = true;
                if (!Character.isUpperCase(c)) return false;
            }
        }
        return hasLetter;
    }

    /** 등장한 선정적 어휘의 종류 수 */
    static long sensationalWordCount(String lower) {
        return PatternLibrary.SENSATIONAL_WORDS.stream().filter(lower::contains).count();
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(100, v));
    }
}
