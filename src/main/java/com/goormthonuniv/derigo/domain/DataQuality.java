package com.goormthonuniv.derigo.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/** 작성자 판정에 쓰인 데이터의 풍부도 */
public enum DataQuality {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    MINIMAL("minimal");

    private final String key;

    DataQuality(String key) { this.key = key; }

    @JsonValue
    public String key() { return key; }
}
