package com.goormthonuniv.derigo.dto;

import com.goormthonuniv.derigo.domain.ClassificationResult;
import com.goormthonuniv.derigo.domain.SiteProfile;
import com.goormthonuniv.derigo.domain.UserPreferences;
import jakarta.validation.constraints.NotNull;

public record FilterDecisionRequest(
        @NotNull ClassificationResult result,
        UserPreferences preferences,    // 선택(없으면 기본 설정)
        SiteProfile profile             // 선택
) {}
