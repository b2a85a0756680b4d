package com.goormthonuniv.derigo.domain;

import java.time.Instant;

/**
 * 본문 1건의 분석 결과. 생성 후 변경하지 않는다(작성자 부착은 사본 생성).
 */
public record ClassificationResult(
        int economic,               // -100(좌) ~ +100(우)
        int social,                 // -100(진보) ~ +100(보수)
        int authority,              // -100(자유) ~ +100(권위)
        int globalism,              // -100(민족) ~ +100(세계)
        int truthScore,             // 0 ~ 100
        double confidence,          // 0 ~ 1
        ResultSource source,
        Instant timestamp,
        AuthorClassification author // 선택
) {
    public ClassificationResult withAuthor(AuthorClassification author) {
        return new ClassificationResult(economic, social, authority, globalism,
                truthScore, confidence, source, timestamp, author);
    }

    public int axis(Axis axis) {
        return switch (axis) {
            case ECONOMIC -> economic;
            case SOCIAL -> social;
            case AUTHORITY -> authority;
            case GLOBALISM -> globalism;
        };
    }

    public boolean hasAuthor() {
        return author != null;
    }
}
