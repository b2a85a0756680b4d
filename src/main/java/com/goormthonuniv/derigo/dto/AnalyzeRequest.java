package com.goormthonuniv.derigo.dto;

import com.goormthonuniv.derigo.domain.ExtractedAuthor;
import com.goormthonuniv.derigo.domain.SiteProfile;
import com.goormthonuniv.derigo.domain.UserPreferences;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record AnalyzeRequest(
        @NotBlank String url,               // 페이지 URL(출처 조회/캐시 키/프로필 매칭)
        @NotNull String text,               // 추출된 본문(빈 문자열 허용)
        @Valid ExtractedAuthor author,      // 선택
        UserPreferences preferences,        // 선택(없으면 기본 설정)
        List<SiteProfile> profiles          // 선택
) {}
