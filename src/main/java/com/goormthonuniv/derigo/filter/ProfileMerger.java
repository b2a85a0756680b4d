package com.goormthonuniv.derigo.filter;

import com.goormthonuniv.derigo.domain.PreferenceOverrides;
import com.goormthonuniv.derigo.domain.SiteProfile;
import com.goormthonuniv.derigo.domain.UserPreferences;
import org.springframework.stereotype.Component;

/**
 * 전역 설정 위에 사이트 프로필의 "명시된" 오버라이드만 덮어쓴다.
 * 0, 빈 집합도 명시 값이면 그대로 반영된다.
 */
@Component
public class ProfileMerger {

    public UserPreferences mergePreferences(UserPreferences global, SiteProfile profile) {
        UserPreferences base = global == null ? UserPreferences.defaults() : global;
        if (profile == null) return base;

        PreferenceOverrides o = profile.overrides();
        return base.toBuilder()
                .economicRange(o.economicRange().orElse(base.economicRange()))
                .socialRange(o.socialRange().orElse(base.socialRange()))
                .authorityRange(o.authorityRange().orElse(base.authorityRange()))
                .globalismRange(o.globalismRange().orElse(base.globalismRange()))
                .minTruthScore(o.minTruthScore().orElse(base.minTruthScore()))
                .minAuthenticity(o.minAuthenticity().orElse(base.minAuthenticity()))
                .maxCoordination(o.maxCoordination().orElse(base.maxCoordination()))
                .blockedIntents(o.blockedIntents().orElse(base.blockedIntents()))
                .displayMode(o.displayMode().orElse(base.displayMode()))
                .build();
    }
}
