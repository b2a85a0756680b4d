package com.goormthonuniv.derigo.cache;

import com.goormthonuniv.derigo.domain.AuthorClassification;
import com.goormthonuniv.derigo.domain.ClassificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 만료 엔트리 주기 정리(기본 1시간).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheMaintenanceJob {

    private final ResultCache<ClassificationResult> contentCache;
    private final ResultCache<AuthorClassification> authorCache;

    @Scheduled(fixedDelayString = "${derigo.cache.purge-interval:PT1H}",
            initialDelayString = "${derigo.cache.purge-interval:PT1H}")
    public void purge() {
        int content = contentCache.purgeExpired();
        int authors = authorCache.purgeExpired();
        if (content + authors > 0) {
            log.info("[Derigo] cleared {} expired content and {} expired author cache entries", content, authors);
        }
    }
}
