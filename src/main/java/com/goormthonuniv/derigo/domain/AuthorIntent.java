package com.goormthonuniv.derigo.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 작성자 의도 분류 6종.
 */
public enum AuthorIntent {
    ORGANIC("organic"),
    TROLL("troll"),
    BOT("bot"),
    STATE_SPONSORED("stateSponsored"),
    COMMERCIAL("commercial"),
    ACTIVIST("activist");

    private final String key;

    AuthorIntent(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() { return key; }

    @JsonCreator
    public static AuthorIntent fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        for (AuthorIntent i : values()) {
            if (i.key.toLowerCase(Locale.ROOT).equals(k)) return i;
        }
        throw new IllegalArgumentException("unknown author intent: " + key);
    }
}
