package com.goormthonuniv.derigo.filter;

import com.goormthonuniv.derigo.domain.AuthorClassification;
import com.goormthonuniv.derigo.domain.Axis;
import com.goormthonuniv.derigo.domain.ClassificationResult;
import com.goormthonuniv.derigo.domain.FilterAction;
import com.goormthonuniv.derigo.domain.FilterActionType;
import com.goormthonuniv.derigo.domain.FilterReason;
import com.goormthonuniv.derigo.domain.ScoreRange;
import com.goormthonuniv.derigo.domain.UserPreferences;
import org.springframework.stereotype.Component;

/**
 * 분석 결과 + 유효 설정 → 단일 판정. 부수효과 없음.
 *
 * 평가 순서(첫 실패에서 종료):
 * economic → social → authority → globalism → 진실성 하한
 * → (작성자 있을 때) 진정성 하한 → 조직화 상한 → 차단 의도
 */
@Component
public class FilterDecisionEngine {

    public FilterAction decideFilterAction(ClassificationResult result, UserPreferences prefs) {
        UserPreferences p = prefs == null ? UserPreferences.defaults() : prefs;
        if (!p.isEnabled() || p.displayMode().isInactive()) {
            return FilterAction.none(result);
        }

        FilterReason reason = firstFailure(result, p);
        if (reason != null) {
            return new FilterAction(p.displayMode().toAction(), reason, result);
        }

        // 통과: 배지 모드면 배지만 표시
        return p.displayMode().toAction() == FilterActionType.BADGE
                ? new FilterAction(FilterActionType.BADGE, null, result)
                : FilterAction.none(result);
    }

    private FilterReason firstFailure(ClassificationResult result, UserPreferences p) {
        for (Axis axis : Axis.values()) {
            ScoreRange range = p.range(axis);
            if (range != null && !range.contains(result.axis(axis))) {
                return FilterReason.forAxis(axis);
            }
        }

        if (result.truthScore() < p.minTruthScore()) {
            return FilterReason.TRUTHFULNESS;
        }

        AuthorClassification author = result.author();
        if (author != null) {
            if (author.authenticity() < p.minAuthenticity()) {
                return FilterReason.AUTHENTICITY;
            }
            if (author.coordination() > p.maxCoordination()) {
                return FilterReason.COORDINATION;
            }
            if (author.intent() != null && p.blockedIntents().contains(author.intent().primary())) {
                return FilterReason.AUTHOR_INTENT;
            }
        }
        return null;
    }
}
