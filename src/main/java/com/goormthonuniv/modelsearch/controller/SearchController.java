package com.goormthonuniv.modelsearch.controller;

import com.goormthonuniv.modelsearch.dto.HealthResponse;
import com.goormthonuniv.modelsearch.dto.SearchResponse;
import com.goormthonuniv.modelsearch.service.AggregationCoordinator;
import com.goormthonuniv.modelsearch.service.ResponseAssembler;
import com.goormthonuniv.modelsearch.service.SearchHealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import lombok.RequiredArgsConstructor;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SearchController {

    private final AggregationCoordinator coordinator;
    private final ResponseAssembler assembler;
    private final SearchHealthService healthService;

    @Operation(summary = "3D 모델 통합 검색", description = "Thingiverse/Printables/MakerWorld 검색 결과를 소스 순서대로 합쳐 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "검색 성공(일부 소스 실패 시 해당 소스 0건)"),
            @ApiResponse(responseCode = "400", description = "검색어 누락/공백"),
            @ApiResponse(responseCode = "500", description = "서버 오류")
    })
    @GetMapping("/search")
    public ResponseEntity<SearchResponse> search(@RequestParam("q") String q) {
        SearchResponse res = assembler.assemble(coordinator.resolve(q).result());
        return ResponseEntity.ok(res);
    }

    @Operation(summary = "상태 확인", description = "캐시 통계와 페이지 로더 상태")
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(healthService.health());
    }
}
