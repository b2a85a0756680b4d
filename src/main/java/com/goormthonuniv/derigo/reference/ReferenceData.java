package com.goormthonuniv.derigo.reference;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * 프로세스 단위로 한 번 로드되는 참조 표 묶음.
 * 최초 사용 시점에 지연 로드하며, 동시 최초 호출은 하나의 로드를 공유한다.
 */
@Component
public class ReferenceData {

    private final LazyReference<KeywordTable> keywords;
    private final LazyReference<SourceReputationPolicy> sources;
    private final LazyReference<KnownActorRegistry> knownActors;

    @Autowired
    public ReferenceData(ReferenceDataLoader loader,
                         @Value("${derigo.reference.keywords:classpath:data/keywords.json}") Resource keywordsResource,
                         @Value("${derigo.reference.sources:classpath:data/sources.json}") Resource sourcesResource,
                         @Value("${derigo.reference.known-actors:classpath:data/known-actors.json}") Resource actorsResource) {
        this.keywords = new LazyReference<>(() -> new KeywordTable(loader.loadKeywords(keywordsResource)));
        this.sources = new LazyReference<>(() -> new SourceReputationPolicy(loader.loadSources(sourcesResource)));
        this.knownActors = new LazyReference<>(() -> new KnownActorRegistry(loader.loadKnownActors(actorsResource)));
    }

    /** 미리 만든 표로 구성(테스트/임베딩용) */
    public ReferenceData(KeywordTable keywords, SourceReputationPolicy sources, KnownActorRegistry knownActors) {
        this.keywords = LazyReference.of(keywords);
        this.sources = LazyReference.of(sources);
        this.knownActors = LazyReference.of(knownActors);
    }

    public KeywordTable keywords() {
        return keywords.get();
    }

    public SourceReputationPolicy sources() {
        return sources.get();
    }

    public KnownActorRegistry knownActors() {
        return knownActors.get();
    }
}
