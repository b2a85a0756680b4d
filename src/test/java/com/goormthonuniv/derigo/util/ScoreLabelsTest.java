package com.goormthonuniv.derigo.util;

import com.goormthonuniv.derigo.domain.Axis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreLabelsTest {

    @ParameterizedTest(name = "{0} {1} → {2}")
    @CsvSource({
            "economic, -50, Left",
            "economic, 50, Right",
            "economic, 20, Center",
            "economic, -33, Center",
            "social, -50, Progressive",
            "social, 50, Conservative",
            "authority, -50, Libertarian",
            "authority, 50, Authoritarian",
            "globalism, -50, Nationalist",
            "globalism, 50, Globalist",
            "cultural, -50, Low",
            "cultural, 50, High"
    })
    @DisplayName("축 라벨(모르는 축은 Low/High)")
    void axisLabels(String axis, int score, String expected) {
        assertThat(ScoreLabels.axisLabel(axis, score)).isEqualTo(expected);
    }

    @Test
    @DisplayName("진실성 구간")
    void truth() {
        assertThat(ScoreLabels.truthLabel(85)).isEqualTo("Highly credible");
        assertThat(ScoreLabels.truthLabel(70)).isEqualTo("Generally reliable");
        assertThat(ScoreLabels.truthLabel(50)).isEqualTo("Mixed/unverified");
        assertThat(ScoreLabels.truthLabel(25)).isEqualTo("Low credibility");
    }

    @Test
    @DisplayName("진정성/조직화 구간")
    void authorBands() {
        assertThat(ScoreLabels.authenticityLabel(20)).isEqualTo("Bot-like");
        assertThat(ScoreLabels.authenticityLabel(45)).isEqualTo("Suspicious");
        assertThat(ScoreLabels.authenticityLabel(60)).isEqualTo("Unclear");
        assertThat(ScoreLabels.authenticityLabel(90)).isEqualTo("Human");
        assertThat(ScoreLabels.coordinationLabel(10)).isEqualTo("Organic");
        assertThat(ScoreLabels.coordinationLabel(30)).isEqualTo("Independent");
        assertThat(ScoreLabels.coordinationLabel(50)).isEqualTo("Aligned");
        assertThat(ScoreLabels.coordinationLabel(70)).isEqualTo("Coordinated");
        assertThat(ScoreLabels.coordinationLabel(95)).isEqualTo("Orchestrated");
        assertThat(ScoreLabels.axisLabel(Axis.ECONOMIC, 0)).isEqualTo("Center");
    }
}
