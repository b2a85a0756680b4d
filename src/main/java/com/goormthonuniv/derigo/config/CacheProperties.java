package com.goormthonuniv.derigo.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 결과 캐시 TTL 정책.
 * - 본문: 기본 24h, 뉴스 도메인 6h, 소셜 도메인 1h
 * - 작성자: 기본 6h, 데이터 품질 high 는 7일, 소셜 플랫폼 12h
 */
@Configuration
@ConfigurationProperties(prefix = "derigo.cache")
@Data
public class CacheProperties {

    private Duration contentDefaultTtl = Duration.ofHours(24);
    private Duration contentNewsTtl = Duration.ofHours(6);
    private Duration contentSocialTtl = Duration.ofHours(1);

    private Duration authorDefaultTtl = Duration.ofHours(6);
    private Duration authorHighQualityTtl = Duration.ofDays(7);
    private Duration authorSocialTtl = Duration.ofHours(12);

    /** 작성자 TTL 을 짧게 가져갈 플랫폼 */
    private List<String> socialPlatforms = new ArrayList<>(List.of("twitter", "reddit"));

    /** 만료 엔트리 정리 주기 */
    private Duration purgeInterval = Duration.ofHours(1);

    /** 인메모리 저장소 상한(엔트리 수) */
    private long maximumSize = 10_000;
}
