package com.goormthonuniv.derigo.util;

import com.goormthonuniv.derigo.domain.Axis;

/**
 * 점수 → 사람이 읽는 라벨.
 */
public final class ScoreLabels {

    private static final int CENTER_BAND = 33;

    private ScoreLabels() {}

    public static String axisLabel(Axis axis, int score) {
        String low = axis == null ? "Low" : axis.lowLabel();
        String high = axis == null ? "High" : axis.highLabel();
        if (score < -CENTER_BAND) return low;
        if (score > CENTER_BAND) return high;
        return "Center";
    }

    /** 축 키 문자열 버전. 모르는 축이면 Low/High */
    public static String axisLabel(String axisKey, int score) {
        return axisLabel(Axis.fromKey(axisKey), score);
    }

    public static String truthLabel(int score) {
        if (score >= 80) return "Highly credible";
        if (score >= 60) return "Generally reliable";
        if (score >= 40) return "Mixed/unverified";
        return "Low credibility";
    }

    public static String authenticityLabel(int score) {
        if (score < 30) return "Bot-like";
        if (score < 50) return "Suspicious";
        if (score < 70) return "Unclear";
        return "Human";
    }

    public static String coordinationLabel(int score) {
        if (score < 20) return "Organic";
        if (score < 40) return "Independent";
        if (score < 60) return "Aligned";
        if (score < 80) return "Coordinated";
        return "Orchestrated";
    }
}
