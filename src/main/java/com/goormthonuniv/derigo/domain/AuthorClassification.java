package com.goormthonuniv.derigo.domain;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 작성자 진정성/조직화/의도 프로파일.
 */
public record AuthorClassification(
        int authenticity,               // 0 ~ 100 (높을수록 실제 사람)
        int coordination,               // 0 ~ 100 (높을수록 조직적)
        IntentAssessment intent,
        List<AuthorSignal> signals,
        DataQuality dataQuality,
        KnownActorEntry knownActor,     // 선택
        String authorId,
        String platform
) {
    public AuthorClassification {
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    public boolean hasSignal(String type) {
        return signals.stream().anyMatch(s -> s.type().equals(type));
    }

    /** 작성자를 찾지 못한 페이지용 기본 프로파일 */
    public static AuthorClassification unknown() {
        Map<AuthorIntent, Double> breakdown = new EnumMap<>(AuthorIntent.class);
        breakdown.put(AuthorIntent.ORGANIC, 0.5);
        breakdown.put(AuthorIntent.TROLL, 0.1);
        breakdown.put(AuthorIntent.BOT, 0.1);
        breakdown.put(AuthorIntent.STATE_SPONSORED, 0.1);
        breakdown.put(AuthorIntent.COMMERCIAL, 0.1);
        breakdown.put(AuthorIntent.ACTIVIST, 0.1);
        return new AuthorClassification(
                50, 20,
                new IntentAssessment(AuthorIntent.ORGANIC, 0.5, breakdown),
                List.of(), DataQuality.MINIMAL, null, null, null);
    }
}
