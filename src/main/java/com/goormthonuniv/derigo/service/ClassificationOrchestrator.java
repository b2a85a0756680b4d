package com.goormthonuniv.derigo.service;

import com.goormthonuniv.derigo.author.AuthorClassifier;
import com.goormthonuniv.derigo.cache.CacheKeys;
import com.goormthonuniv.derigo.cache.CacheTtlPolicy;
import com.goormthonuniv.derigo.cache.ResultCache;
import com.goormthonuniv.derigo.classify.ContentClassifier;
import com.goormthonuniv.derigo.domain.AuthorClassification;
import com.goormthonuniv.derigo.domain.Axis;
import com.goormthonuniv.derigo.domain.ClassificationResult;
import com.goormthonuniv.derigo.domain.ExtractedAuthor;
import com.goormthonuniv.derigo.domain.FilterAction;
import com.goormthonuniv.derigo.domain.FilterActionType;
import com.goormthonuniv.derigo.domain.SiteProfile;
import com.goormthonuniv.derigo.domain.SourceEntry;
import com.goormthonuniv.derigo.domain.UserPreferences;
import com.goormthonuniv.derigo.dto.AnalysisResponse;
import com.goormthonuniv.derigo.dto.AnalyzeRequest;
import com.goormthonuniv.derigo.filter.FilterDecisionEngine;
import com.goormthonuniv.derigo.filter.ProfileMerger;
import com.goormthonuniv.derigo.filter.SiteProfileMatcher;
import com.goormthonuniv.derigo.reference.ReferenceData;
import com.goormthonuniv.derigo.reference.SourceReputationPolicy;
import com.goormthonuniv.derigo.util.ScoreLabels;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 페이지 1건 처리 흐름:
 * 활성/화이트리스트 확인 → 프로필 해석 → (캐시) 본문 분류 → (캐시) 작성자 분류 → 설정 병합 → 판정.
 *
 * 협력자(출처 조회, 알려진 계정, 캐시) 실패는 "데이터 없음"으로 처리하고 채점은 계속한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClassificationOrchestrator {

    // ===== 의존성 =====
    private final ContentClassifier contentClassifier;
    private final AuthorClassifier authorClassifier;
    private final ProfileMerger profileMerger;
    private final SiteProfileMatcher profileMatcher;
    private final FilterDecisionEngine decisionEngine;
    private final ReferenceData referenceData;
    private final CacheTtlPolicy ttlPolicy;

    // ===== 캐시 =====
    private final ResultCache<ClassificationResult> contentCache;
    private final ResultCache<AuthorClassification> authorCache;

    /** 메인 엔트리 */
    public AnalysisResponse analyze(AnalyzeRequest req) {
        UserPreferences global = req.preferences() == null ? UserPreferences.defaults() : req.preferences();

        // 1) 전역 비활성 / 화이트리스트
        if (!global.isEnabled()) {
            log.debug("[Derigo] disabled, skipping {}", req.url());
            return AnalysisResponse.skipped();
        }
        if (profileMatcher.isWhitelisted(req.url(), global.whitelistedDomains())) {
            log.debug("[Derigo] whitelisted, skipping {}", req.url());
            return AnalysisResponse.skipped();
        }

        // 2) 사이트 프로필 → 유효 설정
        SiteProfile profile = profileMatcher.findProfile(req.url(), req.profiles()).orElse(null);
        UserPreferences effective = profileMerger.mergePreferences(global, profile);
        String profileId = profile == null ? null : profile.id();
        if (effective.displayMode().isInactive()) {
            log.debug("[Derigo] display mode {} via profile {}, skipping {}", effective.displayMode().key(), profileId, req.url());
            return new AnalysisResponse(null, FilterActionType.NONE, null, null, profileId, false, Map.of());
        }

        // 3) 본문 분류(캐시 우선)
        String contentKey = CacheKeys.contentKey(req.url());
        Optional<ClassificationResult> hit = cacheGet(contentCache, contentKey);
        boolean cached = hit.isPresent();
        ClassificationResult result = hit.orElseGet(() -> {
            ClassificationResult fresh = contentClassifier.classifyContent(req.text(), lookupSource(req.url()));
            cachePut(contentCache, contentKey, fresh, contentTtl(req.url()));
            return fresh;
        });

        // 4) 작성자 분류(캐시 우선)
        if (req.author() != null) {
            result = result.withAuthor(classifyAuthorCached(req.author(), req.text()));
        }

        // 5) 판정
        FilterAction action = decisionEngine.decideFilterAction(result, effective);
        log.debug("[Derigo] url={} action={} reason={} cached={}", req.url(), action.action().key(),
                action.reason() == null ? "-" : action.reason().key(), cached);

        return new AnalysisResponse(
                result,
                action.action(),
                action.reason(),
                action.reason() == null ? null : action.reason().description(),
                profileId,
                cached,
                labels(result)
        );
    }

    /** 작성자 단독 분류(캐시 사용) */
    public AuthorClassification classifyAuthorCached(ExtractedAuthor author, String text) {
        String key = CacheKeys.authorKey(author);
        return cacheGet(authorCache, key).orElseGet(() -> {
            AuthorClassification fresh = authorClassifier.classifyAuthor(author, text == null ? "" : text);
            cachePut(authorCache, key, fresh, ttlPolicy.authorTtl(fresh));
            return fresh;
        });
    }

    /** 설정 병합 + 판정만(분석 없이) */
    public FilterAction decide(ClassificationResult result, UserPreferences preferences, SiteProfile profile) {
        UserPreferences global = preferences == null ? UserPreferences.defaults() : preferences;
        return decisionEngine.decideFilterAction(result, profileMerger.mergePreferences(global, profile));
    }

    // ===================== 협력자 경계 =====================

    private SourceEntry lookupSource(String url) {
        try {
            return referenceData.sources().lookup(url).orElse(null);
        } catch (RuntimeException e) {
            log.warn("[Derigo] source lookup failed for {}: {}", url, e.getMessage());
            return null;
        }
    }

    private Duration contentTtl(String url) {
        SourceReputationPolicy sources;
        try {
            sources = referenceData.sources();
        } catch (RuntimeException e) {
            sources = SourceReputationPolicy.EMPTY;
        }
        return ttlPolicy.contentTtl(url, sources);
    }

    private <V> Optional<V> cacheGet(ResultCache<V> cache, String key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            log.warn("[Derigo] cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private <V> void cachePut(ResultCache<V> cache, String key, V value, Duration ttl) {
        try {
            cache.put(key, value, ttl);
        } catch (RuntimeException e) {
            log.warn("[Derigo] cache write failed for {}: {}", key, e.getMessage());
        }
    }

    // ===================== 라벨 =====================

    private Map<String, String> labels(ClassificationResult r) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Axis axis : Axis.values()) {
            out.put(axis.key(), ScoreLabels.axisLabel(axis, r.axis(axis)));
        }
        out.put("truth", ScoreLabels.truthLabel(r.truthScore()));
        if (r.hasAuthor()) {
            out.put("authenticity", ScoreLabels.authenticityLabel(r.author().authenticity()));
            out.put("coordination", ScoreLabels.coordinationLabel(r.author().coordination()));
        }
        return out;
    }
}
