package com.goormthonuniv.derigo.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 최종 판정. 매 평가마다 새로 계산되며 변경되지 않는다.
 */
public record FilterAction(
        FilterActionType action,
        FilterReason reason,            // 통과 시 null
        ClassificationResult result
) {
    public static FilterAction none(ClassificationResult result) {
        return new FilterAction(FilterActionType.NONE, null, result);
    }

    @JsonIgnore
    public boolean isTriggered() {
        return reason != null;
    }
}
