package com.goormthonuniv.derigo.domain;

import jakarta.validation.constraints.NotBlank;

/**
 * 페이지에서 추출된 작성자 식별 정보(추출 자체는 외부 협력자 담당).
 */
public record ExtractedAuthor(
        @NotBlank String identifier,    // 소문자 핸들/사용자명
        String displayName,
        @NotBlank String platform,      // "twitter" | "reddit" | "facebook" | "article" | "domain" ...
        String profileUrl,
        AuthorMetadata metadata
) {
    public ExtractedAuthor {
        if (metadata == null) metadata = AuthorMetadata.EMPTY;
    }

    public ExtractedAuthor(String identifier, String platform) {
        this(identifier, null, platform, null, AuthorMetadata.EMPTY);
    }

    /** 작성자 캐시/알려진 계정 조회 키: platform:identifier */
    public String key() {
        return platform + ":" + identifier;
    }
}
