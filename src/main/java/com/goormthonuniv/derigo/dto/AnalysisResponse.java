package com.goormthonuniv.derigo.dto;

import com.goormthonuniv.derigo.domain.ClassificationResult;
import com.goormthonuniv.derigo.domain.FilterActionType;
import com.goormthonuniv.derigo.domain.FilterReason;

import java.util.Map;

public record AnalysisResponse(
        ClassificationResult result,    // 화이트리스트/비활성으로 건너뛰면 null
        FilterActionType action,        // none | badge | overlay | block
        FilterReason reason,            // 필터가 걸린 항목(없으면 null)
        String reasonText,              // 사람이 읽는 사유
        String profileId,               // 적용된 사이트 프로필(없으면 null)
        boolean cached,                 // 본문 결과를 캐시에서 가져왔는지
        Map<String, String> labels      // 축/진실성/작성자 라벨
) {
    public static AnalysisResponse skipped() {
        return new AnalysisResponse(null, FilterActionType.NONE, null, null, null, false, Map.of());
    }
}
