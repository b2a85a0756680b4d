package com.goormthonuniv.derigo.reference;

import com.goormthonuniv.derigo.domain.SourceEntry;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;

/**
 * 출처(도메인) 평판 표를 조회하는 정책 클래스.
 * - 조회 순서: 정확한 host → 앞의 "www." 를 뗀 host
 * - URL 문자열 또는 host 문자열 모두 입력 가능
 * - 뉴스/소셜 도메인 판별(캐시 TTL 계층 선택용 가벼운 힌트)
 */
public class SourceReputationPolicy {

    public static final SourceReputationPolicy EMPTY = new SourceReputationPolicy(List.of());

    /** host(소문자) → 평판 */
    private final Map<String, SourceEntry> byDomain = new HashMap<>();

    /** 소셜 플랫폼 식별용 */
    private static final Set<String> SOCIAL_SUFFIXES = Set.of(
            "twitter.com", "x.com", "facebook.com", "fb.com", "reddit.com",
            "instagram.com", "tiktok.com", "linkedin.com"
    );

    /** 뉴스 성격 host 에 흔히 들어가는 토큰 */
    private static final List<String> NEWS_TOKENS = List.of(
            "news", "cnn", "bbc", "reuters", "nytimes", "washingtonpost",
            "guardian", "foxnews", "msnbc", "npr"
    );

    public SourceReputationPolicy(Collection<SourceEntry> entries) {
        for (SourceEntry e : entries) {
            byDomain.put(e.domain().toLowerCase(Locale.ROOT), e);
        }
    }

    /** 외부에서 평판을 얻는 대표 메서드. 모르는 출처면 empty */
    public Optional<SourceEntry> lookup(String urlOrHost) {
        String host = hostOf(urlOrHost);
        if (host == null || host.isEmpty()) return Optional.empty();

        // 1) exact
        SourceEntry exact = byDomain.get(host);
        if (exact != null) return Optional.of(exact);

        // 2) www. 제거
        if (host.startsWith("www.")) {
            return Optional.ofNullable(byDomain.get(host.substring(4)));
        }
        return Optional.empty();
    }

    public int size() {
        return byDomain.size();
    }

    /** 이 호스트가 (간단 휴리스틱상) 소셜 미디어인지 */
    public boolean isSocialDomain(String urlOrHost) {
        String host = stripCommonSubdomainPrefix(hostOf(urlOrHost));
        if (host == null) return false;
        for (String sfx : SOCIAL_SUFFIXES) {
            if (host.equals(sfx) || host.endsWith("." + sfx)) {
                return true;
            }
        }
        return false;
    }

    /** 이 호스트가 (간단 휴리스틱상) 뉴스/미디어 성격인지 */
    public boolean isNewsDomain(String urlOrHost) {
        String host = hostOf(urlOrHost);
        if (host == null) return false;
        for (String token : NEWS_TOKENS) {
            if (host.contains(token)) return true;
        }
        return false;
    }

    /** 입력이 URL이든 호스트든 받아서 소문자 host 를 반환 (www. 는 유지) */
    public static String hostOf(String urlOrHost) {
        if (urlOrHost == null || urlOrHost.isBlank()) return null;
        String raw = urlOrHost.trim().toLowerCase(Locale.ROOT);

        String host = raw;
        if (raw.contains("://")) {
            try {
                URI uri = new URI(raw);
                if (uri.getHost() != null) host = uri.getHost();
            } catch (URISyntaxException e) {
                host = raw.substring(raw.indexOf("://") + 3);
            }
        } else if (raw.contains("/")) {
            // "host/path" 형태일 수 있음
            try {
                URI uri = new URI("https://" + raw);
                if (uri.getHost() != null) host = uri.getHost();
            } catch (URISyntaxException e) {
                host = raw;
            }
        }
        int cut = indexOfAny(host, '/', '?', '#', ':');
        return cut >= 0 ? host.substring(0, cut) : host;
    }

    /** "www.", "m.", "mobile.", "amp." 중 하나를 한 번 제거 */
    static String stripCommonSubdomainPrefix(String host) {
        if (host == null) return null;
        for (String pref : List.of("www.", "m.", "mobile.", "amp.")) {
            if (host.startsWith(pref)) {
                return host.substring(pref.length());
            }
        }
        return host;
    }

    private static int indexOfAny(String s, char... chars) {
        int best = -1;
        for (char c : chars) {
            int i = s.indexOf(c);
            if (i >= 0 && (best < 0 || i < best)) best = i;
        }
        return best;
    }
}
