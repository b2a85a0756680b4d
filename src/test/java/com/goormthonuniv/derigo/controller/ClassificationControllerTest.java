package com.goormthonuniv.derigo.controller;

import com.goormthonuniv.derigo.domain.AuthorClassification;
import com.goormthonuniv.derigo.domain.ClassificationResult;
import com.goormthonuniv.derigo.domain.FilterAction;
import com.goormthonuniv.derigo.domain.FilterActionType;
import com.goormthonuniv.derigo.domain.FilterReason;
import com.goormthonuniv.derigo.domain.ResultSource;
import com.goormthonuniv.derigo.dto.AnalysisResponse;
import com.goormthonuniv.derigo.service.ClassificationOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ClassificationController.class)
class ClassificationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ClassificationOrchestrator orchestrator;

    private static final ClassificationResult RESULT = new ClassificationResult(
            80, 0, 0, 0, 70, 0.4, ResultSource.LOCAL, Instant.parse("2025-01-01T00:00:00Z"), null);

    @Nested
    @DisplayName("POST /api/v1/classify")
    class Classify {

        @Test
        @DisplayName("정상 요청이면 판정과 라벨을 돌려준다")
        void ok() throws Exception {
            // given
            given(orchestrator.analyze(any())).willReturn(new AnalysisResponse(
                    RESULT, FilterActionType.OVERLAY, FilterReason.ECONOMIC,
                    FilterReason.ECONOMIC.description(), null, false, Map.of("economic", "Right")));

            // when & then
            mockMvc.perform(post("/api/v1/classify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"url":"https://example.com/a","text":"tax cuts",
                                     "preferences":{"economicRange":[-50,50],"displayMode":"overlay"}}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.action").value("overlay"))
                    .andExpect(jsonPath("$.reason").value("economic"))
                    .andExpect(jsonPath("$.result.economic").value(80))
                    .andExpect(jsonPath("$.result.source").value("local"))
                    .andExpect(jsonPath("$.labels.economic").value("Right"));
        }

        @Test
        @DisplayName("url 이 비어 있으면 400 VALIDATION_ERROR")
        void blankUrl() throws Exception {
            mockMvc.perform(post("/api/v1/classify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"url\":\"\",\"text\":\"x\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

            verifyNoInteractions(orchestrator);
        }

        @Test
        @DisplayName("뒤집힌 범위는 400 BAD_REQUEST")
        void invertedRange() throws Exception {
            mockMvc.perform(post("/api/v1/classify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"url":"https://example.com/a","text":"x",
                                     "preferences":{"socialRange":[50,-50]}}
                                    """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
        }

        @Test
        @DisplayName("깨진 JSON 은 400 BAD_REQUEST")
        void malformedJson() throws Exception {
            mockMvc.perform(post("/api/v1/classify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"url\":"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
        }

        @Test
        @DisplayName("처리 중 예외는 500 INTERNAL_ERROR")
        void internalError() throws Exception {
            // given
            given(orchestrator.analyze(any())).willThrow(new IllegalStateException("boom"));

            // when & then
            mockMvc.perform(post("/api/v1/classify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"url\":\"https://example.com/a\",\"text\":\"x\"}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"))
                    .andExpect(jsonPath("$.message").value("boom"));
        }
    }

    @Nested
    @DisplayName("POST /api/v1/authors/classify")
    class AuthorClassify {

        @Test
        @DisplayName("작성자 프로파일을 돌려준다")
        void ok() throws Exception {
            // given
            given(orchestrator.classifyAuthorCached(any(), anyString())).willReturn(AuthorClassification.unknown());

            // when & then
            mockMvc.perform(post("/api/v1/authors/classify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"author":{"identifier":"jdoe","platform":"reddit"},"text":"hello"}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.authenticity").value(50))
                    .andExpect(jsonPath("$.intent.primary").value("organic"));
        }

        @Test
        @DisplayName("identifier 가 비어 있으면 400")
        void blankIdentifier() throws Exception {
            mockMvc.perform(post("/api/v1/authors/classify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"author\":{\"identifier\":\"\",\"platform\":\"reddit\"}}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
        }
    }

    @Nested
    @DisplayName("POST /api/v1/filter/decide")
    class Decide {

        @Test
        @DisplayName("판정만 돌려준다")
        void ok() throws Exception {
            // given
            given(orchestrator.decide(any(), any(), isNull()))
                    .willReturn(new FilterAction(FilterActionType.BLOCK, FilterReason.TRUTHFULNESS, RESULT));

            // when & then
            mockMvc.perform(post("/api/v1/filter/decide")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"result":{"economic":80,"social":0,"authority":0,"globalism":0,
                                               "truthScore":70,"confidence":0.4,"source":"local",
                                               "timestamp":"2025-01-01T00:00:00Z"},
                                     "preferences":{"minTruthScore":90,"displayMode":"block"}}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.action").value("block"))
                    .andExpect(jsonPath("$.reason").value("truthfulness"))
                    .andExpect(jsonPath("$.triggered").doesNotExist());
        }

        @Test
        @DisplayName("result 가 없으면 400")
        void missingResult() throws Exception {
            mockMvc.perform(post("/api/v1/filter/decide")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"preferences\":{}}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
        }
    }
}
