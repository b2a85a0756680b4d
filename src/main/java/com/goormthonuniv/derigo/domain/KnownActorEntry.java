package com.goormthonuniv.derigo.domain;

import java.time.LocalDate;

/**
 * 의도가 알려진 계정 기록. platform 이 "all" 이면 모든 플랫폼에 대한 와일드카드.
 */
public record KnownActorEntry(
        String identifier,
        String platform,        // "twitter" | "reddit" | ... | "all"
        AuthorIntent category,
        double confidence,      // 0 ~ 1
        String source,          // 출처 표기(리스트/기관명)
        LocalDate addedDate,
        String attribution      // 선택
) {
    public static final String ALL_PLATFORMS = "all";
}
