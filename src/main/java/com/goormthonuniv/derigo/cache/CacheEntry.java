package com.goormthonuniv.derigo.cache;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry<V>(
        String key,
        V payload,
        Instant timestamp,
        Duration ttl
) {
    /** now - timestamp >= ttl 이면 만료 */
    public boolean isStaleAt(Instant now) {
        return Duration.between(timestamp, now).compareTo(ttl) >= 0;
    }
}
