package com.goormthonuniv.derigo.cache;

import com.goormthonuniv.derigo.domain.ExtractedAuthor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    @Test
    @DisplayName("본문 키는 URL 의 SHA-256 hex")
    void contentKey() {
        // "abc" 의 SHA-256 공개 테스트 벡터
        assertThat(CacheKeys.contentKey("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(CacheKeys.contentKey("https://example.com/a"))
                .hasSize(64)
                .isNotEqualTo(CacheKeys.contentKey("https://example.com/b"));
    }

    @Test
    @DisplayName("작성자 키는 platform:identifier")
    void authorKey() {
        assertThat(CacheKeys.authorKey(new ExtractedAuthor("jdoe", "reddit"))).isEqualTo("reddit:jdoe");
    }
}
