package com.goormthonuniv.derigo.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 허용 구간 [min, max] (양 끝 포함). JSON 으로는 [-50, 50] 같은 2원소 배열.
 */
public record ScoreRange(int min, int max) {

    public ScoreRange {
        if (min > max) {
            throw new IllegalArgumentException("range min " + min + " > max " + max);
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ScoreRange fromArray(int[] bounds) {
        if (bounds == null || bounds.length != 2) {
            throw new IllegalArgumentException("range must be [min, max]");
        }
        return new ScoreRange(bounds[0], bounds[1]);
    }

    @JsonValue
    public int[] toArray() {
        return new int[]{min, max};
    }

    public boolean contains(int value) {
        return value >= min && value <= max;
    }
}
