package com.goormthonuniv.derigo.controller;

import com.goormthonuniv.derigo.domain.AuthorClassification;
import com.goormthonuniv.derigo.domain.FilterAction;
import com.goormthonuniv.derigo.dto.AnalysisResponse;
import com.goormthonuniv.derigo.dto.AnalyzeRequest;
import com.goormthonuniv.derigo.dto.AuthorClassifyRequest;
import com.goormthonuniv.derigo.dto.FilterDecisionRequest;
import com.goormthonuniv.derigo.service.ClassificationOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ClassificationController {

    private final ClassificationOrchestrator orchestrator;

    @Operation(summary = "페이지 분석", description = "본문/URL/작성자를 전달하면 편향·진실성·작성자 프로파일과 필터 판정을 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "분석 성공"),
            @ApiResponse(responseCode = "400", description = "요청 형식 오류"),
            @ApiResponse(responseCode = "500", description = "서버 오류")
    })
    @PostMapping("/classify")
    public ResponseEntity<AnalysisResponse> classify(@Valid @RequestBody AnalyzeRequest req) {
        return ResponseEntity.ok(orchestrator.analyze(req));
    }

    @Operation(summary = "작성자 분류", description = "작성자 식별 정보와 본문으로 진정성/조직화/의도 분포를 계산합니다.")
    @PostMapping("/authors/classify")
    public ResponseEntity<AuthorClassification> classifyAuthor(@Valid @RequestBody AuthorClassifyRequest req) {
        return ResponseEntity.ok(orchestrator.classifyAuthorCached(req.author(), req.text()));
    }

    @Operation(summary = "필터 판정", description = "분석 결과에 전역 설정과 사이트 프로필을 적용해 단일 판정을 반환합니다.")
    @PostMapping("/filter/decide")
    public ResponseEntity<FilterAction> decide(@Valid @RequestBody FilterDecisionRequest req) {
        return ResponseEntity.ok(orchestrator.decide(req.result(), req.preferences(), req.profile()));
    }
}
