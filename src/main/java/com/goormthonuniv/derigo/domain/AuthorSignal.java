package com.goormthonuniv.derigo.domain;

/**
 * 작성자 판정 근거 1건. 분류 과정에서 적용된 가감마다 하나씩 쌓인다.
 */
public record AuthorSignal(
        String type,                // 예: "repetitive_content", "known_actor"
        double value,               // 관측값(비율/횟수/신뢰도)
        double weight,              // 적용된 가중치
        SignalDirection direction
) {
    public static final String REPETITIVE_CONTENT = "repetitive_content";
    public static final String TEMPLATE_DETECTED = "template_detected";
    public static final String EMOTIONAL_LANGUAGE = "emotional_language";
    public static final String PERSONAL_ATTACKS = "personal_attacks";
    public static final String ENGAGEMENT_BAIT = "engagement_bait";
    public static final String BAD_FAITH_ARGUMENTS = "bad_faith_arguments";
    public static final String PROMOTIONAL_LANGUAGE = "promotional_language";
    public static final String AFFILIATE_LINKS = "affiliate_links";
    public static final String WHATABOUTISM = "whataboutism";
    public static final String PERSONAL_VOICE = "personal_voice";
    public static final String NUANCED_ARGUMENTS = "nuanced_arguments";
    public static final String ORIGINAL_CONTENT = "original_content";
    public static final String KNOWN_ACTOR = "known_actor";
    public static final String NEW_ACCOUNT = "new_account";
    public static final String VERIFIED_ACCOUNT = "verified_account";

    public static AuthorSignal suspicious(String type, double value, double weight) {
        return new AuthorSignal(type, value, weight, SignalDirection.SUSPICIOUS);
    }

    public static AuthorSignal authentic(String type, double value, double weight) {
        return new AuthorSignal(type, value, weight, SignalDirection.AUTHENTIC);
    }
}
