package com.goormthonuniv.derigo.domain;

/**
 * 추출된 작성자 메타데이터. 값이 없으면 null (데이터 품질 계산 시 "제공 여부"가 의미를 가짐).
 */
public record AuthorMetadata(
        Integer accountAgeDays,
        Boolean verified,
        Long followers
) {
    public static final AuthorMetadata EMPTY = new AuthorMetadata(null, null, null);

    public boolean hasVerifiedBadge() {
        return Boolean.TRUE.equals(verified);
    }
}
