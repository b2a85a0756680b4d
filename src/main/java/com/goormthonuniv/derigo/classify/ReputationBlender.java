package com.goormthonuniv.derigo.classify;

import com.goormthonuniv.derigo.config.ScoringProperties.BlendTuning;
import com.goormthonuniv.derigo.domain.Axis;
import com.goormthonuniv.derigo.domain.SourceEntry;

/**
 * 알려진 출처의 사전 편향과 키워드 점수를 섞는다. 출처가 없으면 키워드 점수 그대로.
 */
public class ReputationBlender {

    private final BlendTuning tuning;

    public ReputationBlender(BlendTuning tuning) {
        this.tuning = tuning;
    }

    public int blend(Axis axis, int keywordScore, SourceEntry source) {
        if (source == null || source.biasRating() == null) return keywordScore;
        double mixed = source.biasRating().of(axis) * tuning.getSourceWeight()
                + keywordScore * tuning.getKeywordWeight();
        long rounded = Math.round(mixed);
        return (int) Math.max(-100, Math.min(100, rounded));
    }
}
