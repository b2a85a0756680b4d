package com.goormthonuniv.derigo.cache;

import com.goormthonuniv.derigo.domain.ExtractedAuthor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 캐시 키 규칙.
 * - 본문: URL 의 SHA-256 hex(소문자 64자)
 * - 작성자: "platform:identifier" 그대로
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String contentKey(String url) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((url == null ? "" : url).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // 모든 JRE 에 SHA-256 이 있어야 한다
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public static String authorKey(ExtractedAuthor author) {
        return author.platform() + ":" + author.identifier();
    }
}
