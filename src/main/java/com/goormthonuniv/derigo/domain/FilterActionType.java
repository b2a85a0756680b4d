package com.goormthonuniv.derigo.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FilterActionType {
    NONE("none"),
    BADGE("badge"),
    OVERLAY("overlay"),
    BLOCK("block");

    private final String key;

    FilterActionType(String key) { this.key = key; }

    @JsonValue
    public String key() { return key; }
}
