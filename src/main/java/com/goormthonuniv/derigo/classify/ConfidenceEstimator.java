package com.goormthonuniv.derigo.classify;

import com.goormthonuniv.derigo.config.ScoringProperties.ConfidenceTuning;

/**
 * 분석 신뢰도(0 ~ 1). 매칭 수, 출처 인지 여부, 본문 길이에 대해 단조 증가.
 */
public class ConfidenceEstimator {

    private final ConfidenceTuning tuning;

    public ConfidenceEstimator(ConfidenceTuning tuning) {
        this.tuning = tuning;
    }

    public double estimate(int totalAxisMatches, boolean sourceKnown, int textLength) {
        double matchPart = Math.min(tuning.getMatchCap(), Math.max(0, totalAxisMatches) * tuning.getPerMatch());
        double sourcePart = sourceKnown ? tuning.getKnownSourceBonus() : 0;
        double lengthPart = Math.min(1.0, Math.max(0, textLength) / (double) Math.max(1, tuning.getLengthSaturation()))
                * tuning.getLengthWeight();
        return Math.min(1.0, tuning.getBase() + matchPart + sourcePart + lengthPart);
    }
}
