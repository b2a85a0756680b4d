package com.goormthonuniv.derigo.config;

import com.goormthonuniv.derigo.author.AuthorScorer;
import com.goormthonuniv.derigo.cache.InMemoryResultCache;
import com.goormthonuniv.derigo.cache.ResultCache;
import com.goormthonuniv.derigo.classify.AxisScorer;
import com.goormthonuniv.derigo.classify.ConfidenceEstimator;
import com.goormthonuniv.derigo.classify.ReputationBlender;
import com.goormthonuniv.derigo.classify.TruthEstimator;
import com.goormthonuniv.derigo.domain.AuthorClassification;
import com.goormthonuniv.derigo.domain.ClassificationResult;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 채점 엔진 부품과 결과 캐시 빈 등록.
 * 엔진 부품은 튜닝 값만 받는 일반 클래스라 테스트에서는 직접 생성한다.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ===== 본문 채점 =====

    @Bean
    public AxisScorer axisScorer(ScoringProperties props) {
        return new AxisScorer(props.getAxis());
    }

    @Bean
    public ReputationBlender reputationBlender(ScoringProperties props) {
        return new ReputationBlender(props.getBlend());
    }

    @Bean
    public TruthEstimator truthEstimator(ScoringProperties props) {
        return new TruthEstimator(props.getTruth());
    }

    @Bean
    public ConfidenceEstimator confidenceEstimator(ScoringProperties props) {
        return new ConfidenceEstimator(props.getConfidence());
    }

    // ===== 작성자 채점 =====

    @Bean
    public AuthorScorer authorScorer(ScoringProperties props) {
        return new AuthorScorer(props.getAuthor());
    }

    // ===== 캐시 =====

    @Bean
    public ResultCache<ClassificationResult> contentCache(Clock clock, CacheProperties props) {
        return new InMemoryResultCache<>("content", clock, props.getMaximumSize());
    }

    @Bean
    public ResultCache<AuthorClassification> authorCache(Clock clock, CacheProperties props) {
        return new InMemoryResultCache<>("author", clock, props.getMaximumSize());
    }
}
