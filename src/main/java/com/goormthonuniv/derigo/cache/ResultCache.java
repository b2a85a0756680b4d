package com.goormthonuniv.derigo.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL 기반 결과 저장소 계약. 같은 키로 다시 쓰면 마지막 쓰기가 이긴다.
 */
public interface ResultCache<V> {

    /** timestamp + ttl 이전이면 값, 그 이후(경계 포함)면 empty */
    Optional<V> get(String key);

    void put(String key, V value, Duration ttl);

    /** 만료된 엔트리를 모두 지우고 지운 개수를 돌려준다 */
    int purgeExpired();

    long size();
}
