package com.goormthonuniv.derigo.reference;

import com.goormthonuniv.derigo.domain.ExtractedAuthor;
import com.goormthonuniv.derigo.domain.KnownActorEntry;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 알려진 계정 색인. 키는 platform:identifier, 플랫폼 "all" 은 와일드카드.
 */
public class KnownActorRegistry {

    public static final KnownActorRegistry EMPTY = new KnownActorRegistry(List.of());

    private final Map<String, KnownActorEntry> byKey = new HashMap<>();

    public KnownActorRegistry(Collection<KnownActorEntry> actors) {
        for (KnownActorEntry a : actors) {
            byKey.put(key(a.platform(), a.identifier()), a);
        }
    }

    /** 정확한 platform:identifier → all:identifier 순으로 조회 */
    public Optional<KnownActorEntry> find(ExtractedAuthor author) {
        if (author == null || author.identifier() == null) return Optional.empty();
        KnownActorEntry exact = byKey.get(key(author.platform(), author.identifier()));
        if (exact != null) return Optional.of(exact);
        return Optional.ofNullable(byKey.get(key(KnownActorEntry.ALL_PLATFORMS, author.identifier())));
    }

    public int size() {
        return byKey.size();
    }

    private static String key(String platform, String identifier) {
        String p = platform == null ? "" : platform.toLowerCase(Locale.ROOT);
        return p + ":" + identifier.toLowerCase(Locale.ROOT);
    }
}
