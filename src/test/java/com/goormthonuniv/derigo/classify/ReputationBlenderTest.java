package com.goormthonuniv.derigo.classify;

import com.goormthonuniv.derigo.Fixtures;
import com.goormthonuniv.derigo.config.ScoringProperties.BlendTuning;
import com.goormthonuniv.derigo.domain.Axis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReputationBlenderTest {

    private final ReputationBlender blender = new ReputationBlender(new BlendTuning());

    @Test
    @DisplayName("출처가 없으면 키워드 점수 그대로")
    void passThrough() {
        assertThat(blender.blend(Axis.ECONOMIC, -42, null)).isEqualTo(-42);
    }

    @Test
    @DisplayName("출처 편향 0.4 + 키워드 0.6")
    void blends() {
        // 80*0.4 + (-50)*0.6 = 32 - 30 = 2
        assertThat(blender.blend(Axis.ECONOMIC, -50, Fixtures.partisan())).isEqualTo(2);
        // -50*0.4 + 0*0.6 = -20
        assertThat(blender.blend(Axis.GLOBALISM, 0, Fixtures.partisan())).isEqualTo(-20);
    }
}
