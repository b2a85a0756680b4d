package com.goormthonuniv.derigo.classify;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.derigo.config.ScoringProperties.AxisNormalization;
import com.goormthonuniv.derigo.config.ScoringProperties.AxisTuning;
import com.goormthonuniv.derigo.domain.Axis;
import com.goormthonuniv.derigo.domain.AxisScore;
import com.goormthonuniv.derigo.domain.KeywordEntry;
import com.goormthonuniv.derigo.reference.KeywordTable;
import com.goormthonuniv.derigo.util.TextUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 키워드 표로 편향 축 하나를 채점한다.
 *
 * - 문맥어가 지정된 키워드는 문맥어가 하나라도 있어야 채점
 * - 단어 경계 기준 정확 일치 횟수, 키워드당 occurrenceCap(기본 3)에서 포화
 * - sum += direction × weight × n, 분모는 정규화 모드에 따름
 * - 결과는 [-100, 100] 으로 클램프
 */
public class AxisScorer {

    private final AxisTuning tuning;

    /** 용어 → 컴파일된 단어 경계 패턴 */
    private final Cache<String, Pattern> patternCache = Caffeine.newBuilder()
            .maximumSize(5000)
            .build();

    public AxisScorer(AxisTuning tuning) {
        this.tuning = tuning;
    }

    public AxisScore score(String text, KeywordTable table, Axis axis) {
        String normalized = TextUtils.normalize(text);
        if (normalized.isEmpty() || table == null) return AxisScore.ZERO;

        double sum = 0;
        double weightTotal = 0;
        int occurrenceTotal = 0;
        int matches = 0;

        for (KeywordEntry k : table.forAxis(axis)) {
            if (k.requiresContext() && !hasContext(normalized, k)) continue;

            int n = Math.min(count(normalized, k.term()), tuning.getOccurrenceCap());
            if (n <= 0) continue;

            sum += k.direction() * k.weight() * n;
            weightTotal += k.weight() * n;
            occurrenceTotal += n;
            matches++;
        }
        if (matches == 0) return AxisScore.ZERO;

        double denominator = tuning.getNormalization() == AxisNormalization.WEIGHT
                ? Math.max(weightTotal, 1)
                : Math.max(occurrenceTotal, 1);
        long score = Math.round(sum / (denominator * tuning.getNormalizationScale()) * 100);
        return new AxisScore((int) Math.max(-100, Math.min(100, score)), matches);
    }

    private boolean hasContext(String normalized, KeywordEntry k) {
        for (String ctx : k.context()) {
            String c = TextUtils.normalize(ctx);
            if (!c.isEmpty() && normalized.contains(c)) return true;
        }
        return false;
    }

    private int count(String normalized, String term) {
        String t = TextUtils.normalize(term);
        if (t.isEmpty()) return 0;
        Pattern p = patternCache.get(t, AxisScorer::wordBoundary);
        Matcher m = p.matcher(normalized);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    private static Pattern wordBoundary(String term) {
        return Pattern.compile("(?<!\\w)" + Pattern.quote(term) + "(?!\\w)", Pattern.UNICODE_CHARACTER_CLASS);
    }
}
