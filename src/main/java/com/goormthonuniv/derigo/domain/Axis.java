package com.goormthonuniv.derigo.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 편향 축 4종. 각 축은 -100 ~ +100 범위로 독립 채점된다.
 * 음수 방향 라벨(lowLabel)과 양수 방향 라벨(highLabel)을 함께 보관.
 */
public enum Axis {
    ECONOMIC("economic", "Left", "Right"),
    SOCIAL("social", "Progressive", "Conservative"),
    AUTHORITY("authority", "Libertarian", "Authoritarian"),
    GLOBALISM("globalism", "Nationalist", "Globalist");

    private final String key;
    private final String lowLabel;
    private final String highLabel;

    Axis(String key, String lowLabel, String highLabel) {
        this.key = key;
        this.lowLabel = lowLabel;
        this.highLabel = highLabel;
    }

    @JsonValue
    public String key() { return key; }

    public String lowLabel() { return lowLabel; }

    public String highLabel() { return highLabel; }

    /** "economic" 같은 키 문자열 → Axis. 모르는 키면 null */
    @JsonCreator
    public static Axis fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (Axis a : values()) {
            if (a.key.equals(k)) return a;
        }
        return null;
    }
}
