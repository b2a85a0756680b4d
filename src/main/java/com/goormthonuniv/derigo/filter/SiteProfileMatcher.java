package com.goormthonuniv.derigo.filter;

import com.goormthonuniv.derigo.domain.SiteProfile;
import com.goormthonuniv.derigo.reference.SourceReputationPolicy;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * host → 사이트 프로필 / 화이트리스트 판정.
 * - "www." 제거 후 대소문자 무시 비교
 * - 같은 도메인이거나 그 하위 도메인이면 일치 (notexample.com 은 example.com 과 불일치)
 * - 여러 프로필이 맞으면 가장 긴(구체적인) 도메인 패턴이 이긴다
 * - 화이트리스트는 하위 도메인까지 넓히지 않고 정확히 같은 host 만 본다
 */
@Component
public class SiteProfileMatcher {

    public Optional<SiteProfile> findProfile(String urlOrHost, Collection<SiteProfile> profiles) {
        String host = canonicalHost(urlOrHost);
        if (host == null || profiles == null) return Optional.empty();

        SiteProfile best = null;
        int bestLength = -1;
        for (SiteProfile profile : profiles) {
            if (profile == null) continue;
            for (String domain : profile.domains()) {
                String d = canonicalHost(domain);
                if (d != null && matches(host, d) && d.length() > bestLength) {
                    best = profile;
                    bestLength = d.length();
                }
            }
        }
        return Optional.ofNullable(best);
    }

    public boolean isWhitelisted(String urlOrHost, Collection<String> whitelistedDomains) {
        String host = canonicalHost(urlOrHost);
        if (host == null || whitelistedDomains == null) return false;
        for (String domain : whitelistedDomains) {
            String d = canonicalHost(domain);
            if (host.equals(d)) return true;
        }
        return false;
    }

    static boolean matches(String host, String domain) {
        return host.equals(domain) || host.endsWith("." + domain);
    }

    static String canonicalHost(String urlOrHost) {
        String host = SourceReputationPolicy.hostOf(urlOrHost);
        if (host == null || host.isBlank()) return null;
        host = host.toLowerCase(Locale.ROOT);
        return host.startsWith("www.") ? host.substring(4) : host;
    }
}
