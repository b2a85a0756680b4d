package com.goormthonuniv.derigo.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/** 분류 결과의 출처 태그 */
public enum ResultSource {
    LOCAL("local"),
    ENHANCED("enhanced");

    private final String key;

    ResultSource(String key) { this.key = key; }

    @JsonValue
    public String key() { return key; }
}
