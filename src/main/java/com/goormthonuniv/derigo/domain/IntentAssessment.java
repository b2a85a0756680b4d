package com.goormthonuniv.derigo.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 의도 확률 분포와 그 argmax.
 * breakdown 값은 음수가 아니며 합이 1(부동소수 허용오차 내)이다.
 */
public record IntentAssessment(
        AuthorIntent primary,
        double confidence,                    // primary 의 확률
        Map<AuthorIntent, Double> breakdown
) {
    public IntentAssessment {
        EnumMap<AuthorIntent, Double> copy = new EnumMap<>(AuthorIntent.class);
        if (breakdown != null) copy.putAll(breakdown);
        breakdown = Collections.unmodifiableMap(copy);
    }

    public double probability(AuthorIntent intent) {
        return breakdown.getOrDefault(intent, 0.0);
    }
}
