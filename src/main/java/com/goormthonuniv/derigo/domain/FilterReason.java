package com.goormthonuniv.derigo.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 필터가 걸린 검사 항목. 선언 순서가 곧 평가 순서다.
 */
public enum FilterReason {
    ECONOMIC("economic", "Economic bias outside your range"),
    SOCIAL("social", "Social bias outside your range"),
    AUTHORITY("authority", "Authority bias outside your range"),
    GLOBALISM("globalism", "Globalism bias outside your range"),
    TRUTHFULNESS("truthfulness", "Below truthfulness threshold"),
    AUTHENTICITY("authenticity", "Author authenticity below minimum"),
    COORDINATION("coordination", "Author coordination above maximum"),
    AUTHOR_INTENT("authorIntent", "Author intent type is blocked");

    private final String key;
    private final String description;

    FilterReason(String key, String description) {
        this.key = key;
        this.description = description;
    }

    @JsonValue
    public String key() { return key; }

    public String description() { return description; }

    public static FilterReason forAxis(Axis axis) {
        return switch (axis) {
            case ECONOMIC -> ECONOMIC;
            case SOCIAL -> SOCIAL;
            case AUTHORITY -> AUTHORITY;
            case GLOBALISM -> GLOBALISM;
        };
    }
}
