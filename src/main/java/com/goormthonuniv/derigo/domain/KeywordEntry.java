package com.goormthonuniv.derigo.domain;

import java.util.List;

/**
 * 축별 가중 키워드. 로드 시 검증을 통과한 항목만 생성된다.
 */
public record KeywordEntry(
        String term,            // 소문자 정규화된 용어(다어절 가능)
        Axis axis,
        int direction,          // -1(좌/진보/자유/민족) | +1(우/보수/권위/세계)
        double weight,          // 1 ~ 10
        List<String> context    // 필수 문맥 단어(하나 이상 등장해야 채점). 비어 있으면 무조건
) {
    public KeywordEntry {
        context = context == null ? List.of() : List.copyOf(context);
    }

    public KeywordEntry(String term, Axis axis, int direction, double weight) {
        this(term, axis, direction, weight, List.of());
    }

    public boolean requiresContext() {
        return !context.isEmpty();
    }
}
