package com.goormthonuniv.derigo.config;

import com.goormthonuniv.derigo.domain.AuthorIntent;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * 채점 엔진의 수작업 튜닝 상수 모음.
 *
 * 유도 근거가 문서화되지 않은 값들이므로 재계산하지 않고 이름 붙은 기본값으로 보존하며,
 * application.yml 의 derigo.scoring.* 로 덮어쓸 수 있다.
 */
@Configuration
@ConfigurationProperties(prefix = "derigo.scoring")
@Data
public class ScoringProperties {

    private AxisTuning axis = new AxisTuning();
    private BlendTuning blend = new BlendTuning();
    private TruthTuning truth = new TruthTuning();
    private ConfidenceTuning confidence = new ConfidenceTuning();
    private AuthorTuning author = new AuthorTuning();

    public enum AxisNormalization {
        /** 유효 출현 횟수 × scale 로 나눔. 가중치 10 키워드만 있으면 ±100 */
        OCCURRENCE,
        /** 가중치 합 × scale 로 나눔(원형 공식). 결과가 ±100/scale 로 눌린다 */
        WEIGHT
    }

    @Data
    public static class AxisTuning {
        /** 키워드당 유효 출현 횟수 상한(체감 수익) */
        private int occurrenceCap = 3;
        /** 정규화 분모 배율(키워드 가중치 최대치) */
        private double normalizationScale = 10.0;
        private AxisNormalization normalization = AxisNormalization.OCCURRENCE;
    }

    @Data
    public static class BlendTuning {
        private double sourceWeight = 0.4;
        private double keywordWeight = 0.6;
    }

    @Data
    public static class TruthTuning {
        /** 출처 정보가 없을 때 기준점 */
        private int neutralBaseline = 50;
        /** 전부 대문자인 단어(3자 이상) 비율이 이 값을 넘으면 감점 */
        private double capsRatio = 0.2;
        private int capsPenalty = 5;
        private int clickbaitPenalty = 10;
        /** 선정적 단어 종류 수가 이 값을 넘으면 감점 */
        private int emotionalWordThreshold = 3;
        private int emotionalPenalty = 5;
        private int citationBonus = 5;
        private int statisticBonus = 3;
        private int quoteBonus = 2;
    }

    @Data
    public static class ConfidenceTuning {
        private double base = 0.1;
        private double perMatch = 0.02;
        private double matchCap = 0.4;
        private double knownSourceBonus = 0.3;
        /** 이 길이(문자)에서 길이 가산이 포화 */
        private int lengthSaturation = 5000;
        private double lengthWeight = 0.2;
    }

    @Data
    public static class AuthorTuning {
        private int initialAuthenticity = 60;
        private int initialCoordination = 15;
        private Map<AuthorIntent, Double> prior = defaultPrior();

        // ----- 신호별 규칙 (임계값 초과 시 적용) -----
        private SignalRule repetition = SignalRule.above(0.3, 0.25).authenticity(-25).bot(0.25).organic(-0.2);
        private SignalRule template = SignalRule.above(0.5, 0.3).authenticity(-30).bot(0.3);
        private SignalRule emotionalLanguage = SignalRule.above(0.15, 0.2).troll(0.2).organic(-0.1);
        private SignalRule personalAttacks = SignalRule.above(2, 0.25).troll(0.25).organic(-0.15);
        private SignalRule engagementBait = SignalRule.above(0.5, 0.2).troll(0.2);
        private SignalRule badFaith = SignalRule.above(1, 0.15).troll(0.15);
        private SignalRule promotional = SignalRule.above(0.2, 0.3).commercial(0.3).organic(-0.15);
        private SignalRule affiliateLinks = SignalRule.above(2, 0.25).commercial(0.25);
        private SignalRule whataboutism = SignalRule.above(0.1, 0.1).stateSponsored(0.1).troll(0.1).coordination(10);
        private SignalRule personalVoice = SignalRule.above(0.7, 0.15).authenticity(15).organic(0.15);
        private SignalRule nuance = SignalRule.above(0.5, 0.1).authenticity(10).organic(0.1);
        private SignalRule originalContent = SignalRule.above(0.8, 0.1).authenticity(10);

        // ----- 알려진 계정 -----
        private int botAuthenticityTarget = 10;
        private int stateSponsoredCoordinationTarget = 85;
        private double highQualityActorConfidence = 0.8;

        // ----- 메타데이터 -----
        private int newAccountDays = 30;
        private int newAccountPenalty = 10;
        private int verifiedBonus = 15;
        private double verifiedOrganicBoost = 0.1;

        // ----- 데이터 품질 -----
        private int accountAgePoints = 2;
        private int verifiedPoints = 2;
        private int followersPoints = 1;
        private double signalsPerPoint = 3;
        private double signalPointsCap = 3;
        private double highQualityScore = 6;
        private double mediumQualityScore = 4;
        private double lowQualityScore = 2;

        private static Map<AuthorIntent, Double> defaultPrior() {
            Map<AuthorIntent, Double> m = new EnumMap<>(AuthorIntent.class);
            m.put(AuthorIntent.ORGANIC, 0.6);
            m.put(AuthorIntent.TROLL, 0.1);
            m.put(AuthorIntent.BOT, 0.1);
            m.put(AuthorIntent.STATE_SPONSORED, 0.05);
            m.put(AuthorIntent.COMMERCIAL, 0.1);
            m.put(AuthorIntent.ACTIVIST, 0.05);
            return m;
        }
    }

    /**
     * 신호 1개에 대한 규칙: 값이 threshold 를 넘으면 각 델타를 더하고, weight 로 근거를 기록.
     */
    @Data
    public static class SignalRule {
        private double threshold;
        private double weight;
        private int authenticityDelta;
        private int coordinationDelta;
        private Map<AuthorIntent, Double> intentDeltas = new EnumMap<>(AuthorIntent.class);

        public static SignalRule above(double threshold, double weight) {
            SignalRule r = new SignalRule();
            r.threshold = threshold;
            r.weight = weight;
            return r;
        }

        public boolean appliesTo(double value) {
            return value > threshold;
        }

        SignalRule authenticity(int delta) { this.authenticityDelta = delta; return this; }
        SignalRule coordination(int delta) { this.coordinationDelta = delta; return this; }
        SignalRule organic(double d) { return intent(AuthorIntent.ORGANIC, d); }
        SignalRule troll(double d) { return intent(AuthorIntent.TROLL, d); }
        SignalRule bot(double d) { return intent(AuthorIntent.BOT, d); }
        SignalRule stateSponsored(double d) { return intent(AuthorIntent.STATE_SPONSORED, d); }
        SignalRule commercial(double d) { return intent(AuthorIntent.COMMERCIAL, d); }

        private SignalRule intent(AuthorIntent intent, double d) {
            intentDeltas.put(intent, d);
            return this;
        }
    }
}
