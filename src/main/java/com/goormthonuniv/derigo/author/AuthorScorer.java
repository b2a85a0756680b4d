package com.goormthonuniv.derigo.author;

import com.goormthonuniv.derigo.config.ScoringProperties.AuthorTuning;
import com.goormthonuniv.derigo.config.ScoringProperties.SignalRule;
import com.goormthonuniv.derigo.domain.AuthorClassification;
import com.goormthonuniv.derigo.domain.AuthorIntent;
import com.goormthonuniv.derigo.domain.AuthorMetadata;
import com.goormthonuniv.derigo.domain.AuthorSignal;
import com.goormthonuniv.derigo.domain.ContentSignals;
import com.goormthonuniv.derigo.domain.DataQuality;
import com.goormthonuniv.derigo.domain.ExtractedAuthor;
import com.goormthonuniv.derigo.domain.IntentAssessment;
import com.goormthonuniv.derigo.domain.KnownActorEntry;
import com.goormthonuniv.derigo.domain.SignalDirection;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 신호 + 알려진 계정 + 메타데이터 → 진정성/조직화/의도 분포.
 *
 * 적용 순서
 * 1) 초기값과 의도 사전분포
 * 2) 신호별 규칙(임계 초과 시 가감, 근거 기록)
 * 3) 알려진 계정: 진정성/조직화를 목표값 쪽으로 신뢰도만큼 당김
 * 4) 메타데이터(신생 계정, 인증 계정)
 * 5) 알려진 계정의 의도 고정(카테고리 = 신뢰도, 나머지 질량 = 1 - 신뢰도)
 * 6) 의도 분포 재정규화 후 argmax
 * 7) 데이터 품질
 */
public class AuthorScorer {

    private final AuthorTuning tuning;

    public AuthorScorer(AuthorTuning tuning) {
        this.tuning = tuning;
    }

    public AuthorClassification score(ExtractedAuthor author, ContentSignals signals, KnownActorEntry knownActor) {
        double authenticity = tuning.getInitialAuthenticity();
        double coordination = tuning.getInitialCoordination();
        Map<AuthorIntent, Double> intent = initialIntent();
        List<AuthorSignal> evidence = new ArrayList<>();

        // ----- 2) 신호 규칙 -----
        Delta d = new Delta(authenticity, coordination, intent, evidence);
        d.apply(tuning.getRepetition(), AuthorSignal.REPETITIVE_CONTENT, signals.repetitivePatterns(), SignalDirection.SUSPICIOUS);
        d.apply(tuning.getTemplate(), AuthorSignal.TEMPLATE_DETECTED, signals.templateLikelihood(), SignalDirection.SUSPICIOUS);
        d.apply(tuning.getEmotionalLanguage(), AuthorSignal.EMOTIONAL_LANGUAGE, signals.emotionalLanguageDensity(), SignalDirection.SUSPICIOUS);
        d.apply(tuning.getPersonalAttacks(), AuthorSignal.PERSONAL_ATTACKS, signals.personalAttacks(), SignalDirection.SUSPICIOUS);
        d.apply(tuning.getEngagementBait(), AuthorSignal.ENGAGEMENT_BAIT, signals.engagementBaiting(), SignalDirection.SUSPICIOUS);
        d.apply(tuning.getBadFaith(), AuthorSignal.BAD_FAITH_ARGUMENTS, signals.badFaithArguments(), SignalDirection.SUSPICIOUS);
        d.apply(tuning.getPromotional(), AuthorSignal.PROMOTIONAL_LANGUAGE, signals.promotionalLanguage(), SignalDirection.SUSPICIOUS);
        d.apply(tuning.getAffiliateLinks(), AuthorSignal.AFFILIATE_LINKS, signals.affiliateLinkCount(), SignalDirection.SUSPICIOUS);
        d.apply(tuning.getWhataboutism(), AuthorSignal.WHATABOUTISM, signals.whataboutismDensity(), SignalDirection.SUSPICIOUS);
        d.apply(tuning.getPersonalVoice(), AuthorSignal.PERSONAL_VOICE, signals.personalVoice(), SignalDirection.AUTHENTIC);
        d.apply(tuning.getNuance(), AuthorSignal.NUANCED_ARGUMENTS, signals.nuancedArguments(), SignalDirection.AUTHENTIC);
        d.apply(tuning.getOriginalContent(), AuthorSignal.ORIGINAL_CONTENT, signals.originalContent(), SignalDirection.AUTHENTIC);
        authenticity = d.authenticity;
        coordination = d.coordination;

        // ----- 3) 알려진 계정: 점수 블렌딩 -----
        if (knownActor != null) {
            double w = clamp(knownActor.confidence(), 0, 1);
            if (knownActor.category() == AuthorIntent.BOT) {
                authenticity = Math.round(authenticity * (1 - w) + tuning.getBotAuthenticityTarget() * w);
            }
            if (knownActor.category() == AuthorIntent.STATE_SPONSORED) {
                coordination = Math.round(coordination * (1 - w) + tuning.getStateSponsoredCoordinationTarget() * w);
            }
            evidence.add(AuthorSignal.suspicious(AuthorSignal.KNOWN_ACTOR, w, w));
        }

        // ----- 4) 메타데이터 -----
        AuthorMetadata meta = author.metadata();
        if (meta.accountAgeDays() != null && meta.accountAgeDays() < tuning.getNewAccountDays()) {
            authenticity -= tuning.getNewAccountPenalty();
            evidence.add(AuthorSignal.suspicious(AuthorSignal.NEW_ACCOUNT, meta.accountAgeDays(), 0.1));
        }
        if (meta.hasVerifiedBadge()) {
            authenticity += tuning.getVerifiedBonus();
            intent.merge(AuthorIntent.ORGANIC, tuning.getVerifiedOrganicBoost(), Double::sum);
            evidence.add(AuthorSignal.authentic(AuthorSignal.VERIFIED_ACCOUNT, 1, 0.15));
        }

        // ----- 5) 알려진 계정: 의도 고정 -----
        if (knownActor != null) {
            overrideIntent(intent, knownActor.category(), clamp(knownActor.confidence(), 0, 1));
        }

        // ----- 6) 재정규화 -----
        IntentAssessment assessment = normalize(intent);

        return new AuthorClassification(
                clampScore(authenticity),
                clampScore(coordination),
                assessment,
                evidence,
                dataQuality(signals, knownActor, meta),
                knownActor,
                author.identifier(),
                author.platform()
        );
    }

    // ===================== 의도 분포 =====================

    private Map<AuthorIntent, Double> initialIntent() {
        Map<AuthorIntent, Double> m = new EnumMap<>(AuthorIntent.class);
        for (AuthorIntent i : AuthorIntent.values()) {
            m.put(i, tuning.getPrior().getOrDefault(i, 0.0));
        }
        return m;
    }

    /** 카테고리 확률 = confidence, 나머지는 기존 비율대로 (1 - confidence) 를 나눠 가짐 */
    static void overrideIntent(Map<AuthorIntent, Double> intent, AuthorIntent category, double confidence) {
        double others = 0;
        for (Map.Entry<AuthorIntent, Double> e : intent.entrySet()) {
            if (e.getKey() != category) others += Math.max(0, e.getValue());
        }
        double remaining = 1 - confidence;
        for (AuthorIntent i : AuthorIntent.values()) {
            if (i == category) {
                intent.put(i, confidence);
            } else if (others > 0) {
                intent.put(i, Math.max(0, intent.getOrDefault(i, 0.0)) / others * remaining);
            } else {
                intent.put(i, 0.0);
            }
        }
    }

    static IntentAssessment normalize(Map<AuthorIntent, Double> raw) {
        Map<AuthorIntent, Double> out = new EnumMap<>(AuthorIntent.class);
        double total = 0;
        for (AuthorIntent i : AuthorIntent.values()) {
            double v = Math.max(0, raw.getOrDefault(i, 0.0));
            out.put(i, v);
            total += v;
        }
        if (total <= 0) {
            double uniform = 1.0 / AuthorIntent.values().length;
            out.replaceAll((k, v) -> uniform);
        } else {
            final double t = total;
            out.replaceAll((k, v) -> v / t);
        }

        // 동률이면 선언 순서(organic 우선)
        AuthorIntent primary = AuthorIntent.ORGANIC;
        double best = -1;
        for (AuthorIntent i : AuthorIntent.values()) {
            if (out.get(i) > best) {
                best = out.get(i);
                primary = i;
            }
        }
        return new IntentAssessment(primary, best, out);
    }

    // ===================== 데이터 품질 =====================

    DataQuality dataQuality(ContentSignals signals, KnownActorEntry knownActor, AuthorMetadata meta) {
        if (knownActor != null && knownActor.confidence() > tuning.getHighQualityActorConfidence()) {
            return DataQuality.HIGH;
        }
        double score = 0;
        if (meta.accountAgeDays() != null) score += tuning.getAccountAgePoints();
        if (meta.verified() != null) score += tuning.getVerifiedPoints();
        if (meta.followers() != null) score += tuning.getFollowersPoints();
        score += Math.min(tuning.getSignalPointsCap(), signals.nonZeroCount() / tuning.getSignalsPerPoint());

        if (score >= tuning.getHighQualityScore()) return DataQuality.HIGH;
        if (score >= tuning.getMediumQualityScore()) return DataQuality.MEDIUM;
        if (score >= tuning.getLowQualityScore()) return DataQuality.LOW;
        return DataQuality.MINIMAL;
    }

    // ===================== helpers =====================

    /** 규칙 적용 누적기 */
    private static final class Delta {
        double authenticity;
        double coordination;
        final Map<AuthorIntent, Double> intent;
        final List<AuthorSignal> evidence;

        Delta(double authenticity, double coordination, Map<AuthorIntent, Double> intent, List<AuthorSignal> evidence) {
            this.authenticity = authenticity;
            this.coordination = coordination;
            this.intent = intent;
            this.evidence = evidence;
        }

        void apply(SignalRule rule, String type, double value, SignalDirection direction) {
            if (rule == null || !rule.appliesTo(value)) return;
            authenticity += rule.getAuthenticityDelta();
            coordination += rule.getCoordinationDelta();
            rule.getIntentDeltas().forEach((i, delta) -> intent.merge(i, delta, Double::sum));
            evidence.add(new AuthorSignal(type, value, rule.getWeight(), direction));
        }
    }

    private static int clampScore(double v) {
        return (int) clamp(Math.round(v), 0, 100);
    }

    private static double clamp(double v, double lo, double hi) {
        if (v < lo) return lo;
        if (v > hi) return hi;
        return v;
    }
}
