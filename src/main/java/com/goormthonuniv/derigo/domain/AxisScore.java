package com.goormthonuniv.derigo.domain;

/**
 * 단일 축 채점 결과.
 */
public record AxisScore(
        int score,     // -100 ~ +100
        int matches    // 기여한 키워드 수(키워드당 1회)
) {
    public static final AxisScore ZERO = new AxisScore(0, 0);
}
