package com.goormthonuniv.derigo.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Caffeine 을 저장소로 쓰는 인메모리 결과 캐시.
 * 만료 판정은 주입된 Clock 기준(엔트리마다 TTL 이 다르므로 엔트리에 직접 기록).
 */
@Slf4j
public class InMemoryResultCache<V> implements ResultCache<V> {

    private final String name;
    private final Clock clock;
    private final Cache<String, CacheEntry<V>> store;

    public InMemoryResultCache(String name, Clock clock, long maximumSize) {
        this.name = name;
        this.clock = clock;
        this.store = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public Optional<V> get(String key) {
        CacheEntry<V> entry = store.getIfPresent(key);
        if (entry == null) {
            log.debug("[Derigo] {} cache miss: {}", name, key);
            return Optional.empty();
        }
        if (entry.isStaleAt(clock.instant())) {
            store.invalidate(key);
            log.debug("[Derigo] {} cache expired: {}", name, key);
            return Optional.empty();
        }
        log.debug("[Derigo] {} cache hit: {}", name, key);
        return Optional.ofNullable(entry.payload());
    }

    @Override
    public void put(String key, V value, Duration ttl) {
        store.put(key, new CacheEntry<>(key, value, clock.instant(), ttl));
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int[] purged = {0};
        store.asMap().entrySet().removeIf(e -> {
            boolean stale = e.getValue().isStaleAt(now);
            if (stale) purged[0]++;
            return stale;
        });
        return purged[0];
    }

    @Override
    public long size() {
        return store.estimatedSize();
    }
}
