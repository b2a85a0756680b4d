package com.goormthonuniv.derigo.domain;

import lombok.Builder;

import java.util.List;
import java.util.Set;

/**
 * 전역 필터 설정. 축 범위가 null 이면 해당 축은 검사하지 않는다.
 * 숫자/목록 항목이 비어(null) 들어오면 기본값으로 채운다.
 */
@Builder(toBuilder = true)
public record UserPreferences(
        ScoreRange economicRange,
        ScoreRange socialRange,
        ScoreRange authorityRange,
        ScoreRange globalismRange,
        Integer minTruthScore,          // 이 값 미만이면 필터
        Integer minAuthenticity,        // 작성자 진정성 하한
        Integer maxCoordination,        // 작성자 조직화 상한
        Set<AuthorIntent> blockedIntents,
        DisplayMode displayMode,
        Boolean enabled,
        List<String> whitelistedDomains
) {
    public UserPreferences {
        if (minTruthScore == null) minTruthScore = 0;
        if (minAuthenticity == null) minAuthenticity = 0;
        if (maxCoordination == null) maxCoordination = 100;
        blockedIntents = blockedIntents == null ? Set.of() : Set.copyOf(blockedIntents);
        if (displayMode == null) displayMode = DisplayMode.BADGE;
        if (enabled == null) enabled = Boolean.TRUE;
        whitelistedDomains = whitelistedDomains == null ? List.of() : List.copyOf(whitelistedDomains);
    }

    public static UserPreferences defaults() {
        return UserPreferences.builder().build();
    }

    public ScoreRange range(Axis axis) {
        return switch (axis) {
            case ECONOMIC -> economicRange;
            case SOCIAL -> socialRange;
            case AUTHORITY -> authorityRange;
            case GLOBALISM -> globalismRange;
        };
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }
}
