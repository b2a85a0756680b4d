package com.goormthonuniv.derigo.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 필터에 걸렸을 때의 표시 방식. OFF/DISABLED 는 아무것도 하지 않음
 * (DISABLED 는 사이트 프로필로 특정 도메인을 끌 때 사용).
 */
public enum DisplayMode {
    BLOCK("block"),
    OVERLAY("overlay"),
    BADGE("badge"),
    OFF("off"),
    DISABLED("disabled");

    private final String key;

    DisplayMode(String key) { this.key = key; }

    @JsonValue
    public String key() { return key; }

    public boolean isInactive() {
        return this == OFF || this == DISABLED;
    }

    public FilterActionType toAction() {
        return switch (this) {
            case BLOCK -> FilterActionType.BLOCK;
            case OVERLAY -> FilterActionType.OVERLAY;
            case BADGE -> FilterActionType.BADGE;
            case OFF, DISABLED -> FilterActionType.NONE;
        };
    }
}
