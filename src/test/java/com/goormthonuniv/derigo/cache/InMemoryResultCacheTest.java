package com.goormthonuniv.derigo.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryResultCacheTest {

    private MutableClock clock;
    private InMemoryResultCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        cache = new InMemoryResultCache<>("test", clock, 100);
    }

    @Test
    @DisplayName("만료 직전까지는 조회되고 만료 시각부터는 없음")
    void expiresAtBoundary() {
        // given
        cache.put("k", "v", Duration.ofHours(1));

        // when / then
        clock.advance(Duration.ofMinutes(59).plusSeconds(59));
        assertThat(cache.get("k")).contains("v");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    @DisplayName("같은 키로 다시 쓰면 마지막 쓰기가 이기고 TTL 도 갱신")
    void lastWriteWins() {
        // given
        cache.put("k", "old", Duration.ofMinutes(10));
        clock.advance(Duration.ofMinutes(9));

        // when
        cache.put("k", "new", Duration.ofMinutes(10));
        clock.advance(Duration.ofMinutes(5));

        // then
        assertThat(cache.get("k")).contains("new");
    }

    @Test
    @DisplayName("만료 정리는 지운 개수를 돌려준다")
    void purgeExpired() {
        // given
        cache.put("short", "a", Duration.ofMinutes(1));
        cache.put("long", "b", Duration.ofHours(1));
        cache.put("mid", "c", Duration.ofMinutes(30));

        // when
        clock.advance(Duration.ofMinutes(30));
        int purged = cache.purgeExpired();

        // then
        assertThat(purged).isEqualTo(2);
        assertThat(cache.get("long")).contains("b");
        assertThat(cache.purgeExpired()).isZero();
    }

    @Test
    @DisplayName("없는 키는 empty")
    void miss() {
        assertThat(cache.get("nothing")).isEmpty();
    }
}
