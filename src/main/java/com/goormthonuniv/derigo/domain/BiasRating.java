package com.goormthonuniv.derigo.domain;

/**
 * 출처의 사전 편향 평가(축별 -100 ~ +100).
 */
public record BiasRating(int economic, int social, int authority, int globalism) {

    public static final BiasRating NEUTRAL = new BiasRating(0, 0, 0, 0);

    public int of(Axis axis) {
        return switch (axis) {
            case ECONOMIC -> economic;
            case SOCIAL -> social;
            case AUTHORITY -> authority;
            case GLOBALISM -> globalism;
        };
    }
}
