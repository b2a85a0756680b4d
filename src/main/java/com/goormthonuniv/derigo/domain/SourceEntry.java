package com.goormthonuniv.derigo.domain;

/**
 * 알려진 출처(도메인)의 평판 데이터. 도메인 키는 소문자 host.
 */
public record SourceEntry(
        String domain,          // 예: "reuters.com"
        String name,
        int factualRating,      // 0 ~ 100
        BiasRating biasRating,
        String category,        // news | opinion | satire | ...
        String country          // 선택
) {}
