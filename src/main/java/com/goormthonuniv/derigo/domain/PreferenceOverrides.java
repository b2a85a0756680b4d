package com.goormthonuniv.derigo.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonSetter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 사이트 프로필의 부분 오버라이드.
 * JSON 에 키가 없으면 unset, 키가 있으면(값이 0, [] 이어도) 명시 오버라이드로 취급.
 * Jackson 은 존재하는 키에 대해서만 setter 를 호출하므로 그 차이가 그대로 보존된다.
 * null 은 축 범위에서만 의미가 있다(해당 축 검사 해제). 숫자 임계값/표시 방식의 null 은 unset 과 같다.
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        fieldVisibility = JsonAutoDetect.Visibility.NONE)
public class PreferenceOverrides {

    private PreferenceOverride<ScoreRange> economicRange = PreferenceOverride.unset();
    private PreferenceOverride<ScoreRange> socialRange = PreferenceOverride.unset();
    private PreferenceOverride<ScoreRange> authorityRange = PreferenceOverride.unset();
    private PreferenceOverride<ScoreRange> globalismRange = PreferenceOverride.unset();
    private PreferenceOverride<Integer> minTruthScore = PreferenceOverride.unset();
    private PreferenceOverride<Integer> minAuthenticity = PreferenceOverride.unset();
    private PreferenceOverride<Integer> maxCoordination = PreferenceOverride.unset();
    private PreferenceOverride<Set<AuthorIntent>> blockedIntents = PreferenceOverride.unset();
    private PreferenceOverride<DisplayMode> displayMode = PreferenceOverride.unset();

    public static PreferenceOverrides none() {
        return new PreferenceOverrides();
    }

    // ===== 조회 =====

    public PreferenceOverride<ScoreRange> economicRange() { return economicRange; }
    public PreferenceOverride<ScoreRange> socialRange() { return socialRange; }
    public PreferenceOverride<ScoreRange> authorityRange() { return authorityRange; }
    public PreferenceOverride<ScoreRange> globalismRange() { return globalismRange; }
    public PreferenceOverride<Integer> minTruthScore() { return minTruthScore; }
    public PreferenceOverride<Integer> minAuthenticity() { return minAuthenticity; }
    public PreferenceOverride<Integer> maxCoordination() { return maxCoordination; }
    public PreferenceOverride<Set<AuthorIntent>> blockedIntents() { return blockedIntents; }
    public PreferenceOverride<DisplayMode> displayMode() { return displayMode; }

    public boolean isEmpty() {
        return explicitValues().isEmpty();
    }

    // ===== 명시 설정 (JSON setter 겸 플루언트 빌더) =====

    @JsonSetter("economicRange")
    public PreferenceOverrides economicRange(ScoreRange v) { economicRange = PreferenceOverride.of(v); return this; }

    @JsonSetter("socialRange")
    public PreferenceOverrides socialRange(ScoreRange v) { socialRange = PreferenceOverride.of(v); return this; }

    @JsonSetter("authorityRange")
    public PreferenceOverrides authorityRange(ScoreRange v) { authorityRange = PreferenceOverride.of(v); return this; }

    @JsonSetter("globalismRange")
    public PreferenceOverrides globalismRange(ScoreRange v) { globalismRange = PreferenceOverride.of(v); return this; }

    @JsonSetter("minTruthScore")
    public PreferenceOverrides minTruthScore(Integer v) { minTruthScore = scalar(v); return this; }

    @JsonSetter("minAuthenticity")
    public PreferenceOverrides minAuthenticity(Integer v) { minAuthenticity = scalar(v); return this; }

    @JsonSetter("maxCoordination")
    public PreferenceOverrides maxCoordination(Integer v) { maxCoordination = scalar(v); return this; }

    @JsonSetter("blockedIntents")
    public PreferenceOverrides blockedIntents(Set<AuthorIntent> v) {
        blockedIntents = PreferenceOverride.of(v == null ? Set.of() : Set.copyOf(v));
        return this;
    }

    @JsonSetter("displayMode")
    public PreferenceOverrides displayMode(DisplayMode v) { displayMode = scalar(v); return this; }

    /** 직렬화 시 명시된 항목만 내보낸다 */
    @JsonAnyGetter
    public Map<String, Object> explicitValues() {
        Map<String, Object> out = new LinkedHashMap<>();
        put(out, "economicRange", economicRange);
        put(out, "socialRange", socialRange);
        put(out, "authorityRange", authorityRange);
        put(out, "globalismRange", globalismRange);
        put(out, "minTruthScore", minTruthScore);
        put(out, "minAuthenticity", minAuthenticity);
        put(out, "maxCoordination", maxCoordination);
        put(out, "blockedIntents", blockedIntents);
        put(out, "displayMode", displayMode);
        return out;
    }

    private static <T> PreferenceOverride<T> scalar(T v) {
        return v == null ? PreferenceOverride.unset() : PreferenceOverride.of(v);
    }

    private static void put(Map<String, Object> out, String name, PreferenceOverride<?> o) {
        if (o.isPresent()) out.put(name, o.value());
    }
}
