package com.goormthonuniv.derigo.classify;

import com.goormthonuniv.derigo.domain.Axis;
import com.goormthonuniv.derigo.domain.AxisScore;
import com.goormthonuniv.derigo.domain.ClassificationResult;
import com.goormthonuniv.derigo.domain.ResultSource;
import com.goormthonuniv.derigo.domain.SourceEntry;
import com.goormthonuniv.derigo.reference.KeywordTable;
import com.goormthonuniv.derigo.reference.ReferenceData;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * 본문 분류 진입점: 축 4개 채점 → 출처 블렌딩 → 진실성 → 신뢰도.
 * 작성자 분류는 별도로 계산해 {@link ClassificationResult#withAuthor} 로 붙인다.
 */
@Service
@RequiredArgsConstructor
public class ContentClassifier {

    private final ReferenceData referenceData;
    private final AxisScorer axisScorer;
    private final ReputationBlender blender;
    private final TruthEstimator truthEstimator;
    private final ConfidenceEstimator confidenceEstimator;
    private final Clock clock;

    public AxisScore scoreAxis(String text, KeywordTable table, Axis axis) {
        return axisScorer.score(text, table, axis);
    }

    public ClassificationResult classifyContent(String text, SourceEntry source) {
        String body = text == null ? "" : text;
        KeywordTable table = referenceData.keywords();

        Map<Axis, Integer> scores = new EnumMap<>(Axis.class);
        int totalMatches = 0;
        for (Axis axis : Axis.values()) {
            AxisScore s = scoreAxis(body, table, axis);
            scores.put(axis, blender.blend(axis, s.score(), source));
            totalMatches += s.matches();
        }

        return new ClassificationResult(
                scores.get(Axis.ECONOMIC),
                scores.get(Axis.SOCIAL),
                scores.get(Axis.AUTHORITY),
                scores.get(Axis.GLOBALISM),
                truthEstimator.estimate(body, source),
                confidenceEstimator.estimate(totalMatches, source != null, body.length()),
                ResultSource.LOCAL,
                clock.instant(),
                null
        );
    }
}
