package com.goormthonuniv.derigo.classify;

import com.goormthonuniv.derigo.Fixtures;
import com.goormthonuniv.derigo.config.ScoringProperties;
import com.goormthonuniv.derigo.domain.Axis;
import com.goormthonuniv.derigo.domain.AxisScore;
import com.goormthonuniv.derigo.domain.ClassificationResult;
import com.goormthonuniv.derigo.domain.ResultSource;
import com.goormthonuniv.derigo.reference.KeywordTable;
import com.goormthonuniv.derigo.reference.KnownActorRegistry;
import com.goormthonuniv.derigo.reference.ReferenceData;
import com.goormthonuniv.derigo.reference.SourceReputationPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentClassifierTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private ContentClassifier classifier;

    @BeforeEach
    void setUp() {
        ScoringProperties props = new ScoringProperties();
        ReferenceData data = new ReferenceData(Fixtures.keywords(),
                new SourceReputationPolicy(List.of(Fixtures.reuters())), KnownActorRegistry.EMPTY);
        classifier = new ContentClassifier(data,
                new AxisScorer(props.getAxis()),
                new ReputationBlender(props.getBlend()),
                new TruthEstimator(props.getTruth()),
                new ConfidenceEstimator(props.getConfidence()),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("scoreAxis: 주어진 표로 한 축만 채점")
    void scoreAxisUsesGivenTable() {
        // given
        String text = "We need to nationalize healthcare and raise the wealth tax";

        // when
        AxisScore economic = classifier.scoreAxis(text, Fixtures.keywords(), Axis.ECONOMIC);
        AxisScore empty = classifier.scoreAxis(text, KeywordTable.EMPTY, Axis.ECONOMIC);

        // then
        assertThat(economic.score()).isLessThan(-30);
        assertThat(economic.matches()).isGreaterThanOrEqualTo(2);
        assertThat(empty).isEqualTo(AxisScore.ZERO);
    }

    @Test
    @DisplayName("출처 없이 본문만으로 4축 + 진실성 + 신뢰도 산출")
    void classifyWithoutSource() {
        // when
        ClassificationResult result = classifier.classifyContent(
                "Deregulation and tax cuts will boost free enterprise", null);

        // then
        assertThat(result.economic()).isGreaterThan(30);
        assertThat(result.social()).isZero();
        assertThat(result.authority()).isZero();
        assertThat(result.globalism()).isZero();
        assertThat(result.truthScore()).isEqualTo(50);
        assertThat(result.confidence()).isBetween(0.1, 0.3);
        assertThat(result.source()).isEqualTo(ResultSource.LOCAL);
        assertThat(result.timestamp()).isEqualTo(NOW);
        assertThat(result.hasAuthor()).isFalse();
    }

    @Test
    @DisplayName("출처가 있으면 편향이 섞이고 신뢰도가 오른다")
    void classifyWithSource() {
        // when
        ClassificationResult plain = classifier.classifyContent("Free trade helps", null);
        ClassificationResult sourced = classifier.classifyContent("Free trade helps", Fixtures.reuters());

        // then: 70*0.6 + 10*0.4 = 46
        assertThat(plain.axis(Axis.GLOBALISM)).isEqualTo(70);
        assertThat(sourced.axis(Axis.GLOBALISM)).isEqualTo(46);
        assertThat(sourced.truthScore()).isEqualTo(95);
        assertThat(sourced.confidence()).isGreaterThan(plain.confidence());
    }

    @Test
    @DisplayName("빈 본문은 실패하지 않고 낮은 신뢰도")
    void emptyText() {
        // when
        ClassificationResult result = classifier.classifyContent("", null);

        // then
        assertThat(result.economic()).isZero();
        assertThat(result.truthScore()).isEqualTo(50);
        assertThat(result.confidence()).isEqualTo(0.1);
    }
}
