package com.goormthonuniv.derigo.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalDirection {
    AUTHENTIC("authentic"),
    SUSPICIOUS("suspicious"),
    NEUTRAL("neutral");

    private final String key;

    SignalDirection(String key) { this.key = key; }

    @JsonValue
    public String key() { return key; }
}
