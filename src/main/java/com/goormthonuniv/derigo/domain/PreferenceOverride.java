package com.goormthonuniv.derigo.domain;

import java.util.Objects;

/**
 * 프로필 오버라이드 값 1개. "설정 안 함(unset)"과 "명시적 값"을 구분한다.
 * 명시적 값에는 0, 빈 목록도 포함된다. 축 범위는 null(검사 해제)도 명시 값이다.
 */
public final class PreferenceOverride<T> {

    private static final PreferenceOverride<?> UNSET = new PreferenceOverride<>(false, null);

    private final boolean present;
    private final T value;

    private PreferenceOverride(boolean present, T value) {
        this.present = present;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> PreferenceOverride<T> unset() {
        return (PreferenceOverride<T>) UNSET;
    }

    public static <T> PreferenceOverride<T> of(T value) {
        return new PreferenceOverride<>(true, value);
    }

    public boolean isPresent() {
        return present;
    }

    public T value() {
        if (!present) throw new IllegalStateException("override is unset");
        return value;
    }

    /** 명시 값이 있으면 그 값(null 포함), 아니면 fallback */
    public T orElse(T fallback) {
        return present ? value : fallback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PreferenceOverride<?> other)) return false;
        return present == other.present && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        return present ? "PreferenceOverride[" + value + "]" : "PreferenceOverride[unset]";
    }
}
