package com.goormthonuniv.derigo.domain;

import java.util.stream.DoubleStream;

/**
 * 본문에서 파생된 작성자 행동 휴리스틱 묶음. 식별자 없이 값만 가진다.
 * 비율 지표는 0 ~ 1, 횟수 지표는 0 이상.
 */
public record ContentSignals(
        // 봇
        double repetitivePatterns,
        double templateLikelihood,
        double unnaturalPhrasing,
        // 트롤
        double emotionalLanguageDensity,
        double personalAttacks,
        double badFaithArguments,
        double engagementBaiting,
        // 상업
        double promotionalLanguage,
        double affiliateLinkCount,
        double productMentions,
        // 조직화
        double coordinatedNarratives,
        double whataboutismDensity,
        // 진정성(긍정)
        double personalVoice,
        double nuancedArguments,
        double originalContent
) {
    /** 0보다 큰 지표 개수. 데이터 품질 산정에 사용 */
    public long nonZeroCount() {
        return DoubleStream.of(
                        repetitivePatterns, templateLikelihood, unnaturalPhrasing,
                        emotionalLanguageDensity, personalAttacks, badFaithArguments, engagementBaiting,
                        promotionalLanguage, affiliateLinkCount, productMentions,
                        coordinatedNarratives, whataboutismDensity,
                        personalVoice, nuancedArguments, originalContent)
                .filter(v -> v > 0)
                .count();
    }
}
