package com.goormthonuniv.derigo.classify;

import com.goormthonuniv.derigo.config.ScoringProperties.ConfidenceTuning;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceEstimatorTest {

    private final ConfidenceEstimator estimator = new ConfidenceEstimator(new ConfidenceTuning());

    @Test
    @DisplayName("아무 근거가 없으면 기본값 0.1")
    void base() {
        assertThat(estimator.estimate(0, false, 0)).isCloseTo(0.1, within(1e-9));
    }

    @Test
    @DisplayName("매칭 수, 출처, 길이에 따라 단조 증가")
    void monotonic() {
        double none = estimator.estimate(0, false, 1000);
        double someMatches = estimator.estimate(5, false, 1000);
        double withSource = estimator.estimate(5, true, 1000);
        double longer = estimator.estimate(5, true, 4000);

        assertThat(someMatches).isGreaterThan(none);
        assertThat(withSource).isGreaterThan(someMatches);
        assertThat(longer).isGreaterThan(withSource);
    }

    @Test
    @DisplayName("모든 항이 포화되면 정확히 1")
    void saturates() {
        // 0.1 + 0.4 + 0.3 + 0.2
        assertThat(estimator.estimate(1000, true, 1_000_000)).isCloseTo(1.0, within(1e-9));
    }
}
