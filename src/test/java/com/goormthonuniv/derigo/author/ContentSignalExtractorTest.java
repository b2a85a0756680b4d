package com.goormthonuniv.derigo.author;

import com.goormthonuniv.derigo.domain.ContentSignals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ContentSignalExtractorTest {

    private final ContentSignalExtractor extractor = new ContentSignalExtractor();

    @Nested
    @DisplayName("봇 신호")
    class BotSignals {

        @Test
        @DisplayName("같은 문장이 반복되면 반복 비율이 오르고 원본성은 내려간다")
        void repetition() {
            // given
            String text = "Share before deleted! Share before deleted! Share before deleted! Something else entirely.";

            // when
            ContentSignals s = extractor.extract(text);

            // then: 4문장 중 3문장이 반복
            assertThat(s.repetitivePatterns()).isCloseTo(0.75, within(1e-9));
            assertThat(s.originalContent()).isCloseTo(0.25, within(1e-9));
        }

        @Test
        @DisplayName("문장이 3개 미만이면 반복 0")
        void repetitionNeedsThreeSentences() {
            ContentSignals s = extractor.extract("Share before deleted! Share before deleted!");
            assertThat(s.repetitivePatterns()).isZero();
        }

        @Test
        @DisplayName("자리표시자 2개면 템플릿 가능성 1")
        void templates() {
            ContentSignals s = extractor.extract("Hello [name], your {{code}} is ready");
            assertThat(s.templateLikelihood()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("트롤 신호")
    class TrollSignals {

        @Test
        @DisplayName("감정어 밀도는 구두점을 뗀 단어 기준")
        void emotionalDensity() {
            ContentSignals s = extractor.extract("This is disgusting and pathetic!");
            assertThat(s.emotionalLanguageDensity()).isCloseTo(0.4, within(1e-9));
        }

        @Test
        @DisplayName("인신공격 패턴 횟수")
        void personalAttacks() {
            ContentSignals s = extractor.extract("You are an idiot. People like you never learn.");
            assertThat(s.personalAttacks()).isEqualTo(2);
        }

        @Test
        @DisplayName("참여 유도 문구 1개당 0.3")
        void engagementBait() {
            ContentSignals s = extractor.extract("Unpopular opinion: cats are better. Change my mind.");
            assertThat(s.engagementBaiting()).isCloseTo(0.6, within(1e-9));
        }
    }

    @Nested
    @DisplayName("상업/조직화 신호")
    class CommercialSignals {

        @Test
        @DisplayName("홍보 문구는 문장 수로 나눈다")
        void promotional() {
            ContentSignals s = extractor.extract("Buy now! Use code SAVE10. Limited time only");
            assertThat(s.promotionalLanguage()).isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("추적 파라미터와 단축 URL 을 모두 센다")
        void affiliateLinks() {
            ContentSignals s = extractor.extract("https://bit.ly/abc?ref=spam https://amzn.to/xyz?tag=aff01");
            assertThat(s.affiliateLinkCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("물타기 문구 밀도")
        void whataboutism() {
            ContentSignals s = extractor.extract("What about the other party? But they also did it.");
            assertThat(s.whataboutismDensity()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("진정성 신호")
    class AuthenticSignals {

        @Test
        @DisplayName("1인칭 성찰/경험/유보 표현이 개인 목소리 점수를 올린다")
        void personalVoice() {
            ContentSignals s = extractor.extract(
                    "I think this might be right, but I could be wrong. In my experience I saw it work.");
            assertThat(s.personalVoice()).isCloseTo(0.85, within(1e-9));
        }

        @Test
        @DisplayName("관점 균형/조건/근거 표현이 뉘앙스 점수를 올린다")
        void nuance() {
            ContentSignals s = extractor.extract(
                    "However, it depends on the region. Research shows mixed results. What would change your view?");
            assertThat(s.nuancedArguments()).isCloseTo(0.55, within(1e-9));
        }

        @Test
        @DisplayName("질문 가점은 이어지는 질문 구간에만 붙는다")
        void questionSpans() {
            assertThat(extractor.extract("What changed?").nuancedArguments()).isZero();
            assertThat(extractor.extract("What changed? Why now? Who decided?").nuancedArguments())
                    .isCloseTo(0.05, within(1e-9));
            assertThat(extractor.extract("What changed? Seriously? Who decided?").nuancedArguments()).isZero();
        }
    }

    @Test
    @DisplayName("빈 본문은 원본성 외 모든 지표가 0")
    void emptyText() {
        // when
        ContentSignals s = extractor.extract("");

        // then
        assertThat(s.nonZeroCount()).isEqualTo(1);
        assertThat(s.originalContent()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("같은 입력이면 같은 결과")
    void deterministic() {
        String text = "I think, however, that you are an idiot. Buy now! What about them?";
        assertThat(extractor.extract(text)).isEqualTo(extractor.extract(text));
    }
}
