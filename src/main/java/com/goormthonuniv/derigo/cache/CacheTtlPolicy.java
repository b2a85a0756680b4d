package com.goormthonuniv.derigo.cache;

import com.goormthonuniv.derigo.config.CacheProperties;
import com.goormthonuniv.derigo.domain.AuthorClassification;
import com.goormthonuniv.derigo.domain.DataQuality;
import com.goormthonuniv.derigo.reference.SourceReputationPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * URL 모양/작성자 품질에 따라 캐시 TTL 을 고른다.
 */
@Component
@RequiredArgsConstructor
public class CacheTtlPolicy {

    private final CacheProperties props;

    /** 소셜 1h → 뉴스 6h → 기본 24h */
    public Duration contentTtl(String url, SourceReputationPolicy sources) {
        if (sources.isSocialDomain(url)) return props.getContentSocialTtl();
        if (sources.isNewsDomain(url)) return props.getContentNewsTtl();
        return props.getContentDefaultTtl();
    }

    /** 품질 high 7일 → 소셜 플랫폼 12h → 기본 6h */
    public Duration authorTtl(AuthorClassification author) {
        if (author.dataQuality() == DataQuality.HIGH) return props.getAuthorHighQualityTtl();
        String platform = author.platform() == null ? "" : author.platform().toLowerCase(Locale.ROOT);
        if (props.getSocialPlatforms().stream().anyMatch(p -> p.equalsIgnoreCase(platform))) {
            return props.getAuthorSocialTtl();
        }
        return props.getAuthorDefaultTtl();
    }
}
