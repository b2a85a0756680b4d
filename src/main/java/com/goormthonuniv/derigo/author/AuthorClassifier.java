package com.goormthonuniv.derigo.author;

import com.goormthonuniv.derigo.domain.AuthorClassification;
import com.goormthonuniv.derigo.domain.ContentSignals;
import com.goormthonuniv.derigo.domain.ExtractedAuthor;
import com.goormthonuniv.derigo.domain.KnownActorEntry;
import com.goormthonuniv.derigo.reference.ReferenceData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 작성자 분류 진입점: 본문 신호 추출 → (알려진 계정 조회) → 채점.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorClassifier {

    private final ContentSignalExtractor extractor;
    private final AuthorScorer scorer;
    private final ReferenceData referenceData;

    /** 알려진 계정 기록을 호출자가 이미 알고 있는 경우(없으면 null) */
    public AuthorClassification classifyAuthor(ExtractedAuthor author, String text, KnownActorEntry knownActor) {
        if (author == null) return AuthorClassification.unknown();
        ContentSignals signals = extractor.extract(text);
        return scorer.score(author, signals, knownActor);
    }

    /** 번들된 알려진 계정 색인에서 조회. 조회 실패는 "기록 없음"으로 취급 */
    public AuthorClassification classifyAuthor(ExtractedAuthor author, String text) {
        if (author == null) return AuthorClassification.unknown();
        return classifyAuthor(author, text, lookupKnownActor(author));
    }

    private KnownActorEntry lookupKnownActor(ExtractedAuthor author) {
        try {
            return referenceData.knownActors().find(author).orElse(null);
        } catch (RuntimeException e) {
            log.warn("[Derigo] known-actor lookup failed for {}: {}", author.key(), e.getMessage());
            return null;
        }
    }
}
