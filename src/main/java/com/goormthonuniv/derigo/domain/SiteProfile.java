package com.goormthonuniv.derigo.domain;

import java.util.List;

/**
 * 도메인 범위의 이름 붙은 설정 오버라이드.
 */
public record SiteProfile(
        String id,
        String name,
        String description,             // 선택
        List<String> domains,           // "example.com" → example.com 및 하위 도메인
        PreferenceOverrides overrides
) {
    public SiteProfile {
        domains = domains == null ? List.of() : List.copyOf(domains);
        if (overrides == null) overrides = PreferenceOverrides.none();
    }
}
