package com.purchasingpower.reviewflow.controller;

import com.purchasingpower.reviewflow.model.dto.ApiResponse;
import com.purchasingpower.reviewflow.model.pattern.PatternStatus;
import com.purchasingpower.reviewflow.service.PatternCatalogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/patterns")
@RequiredArgsConstructor
public class PatternController {

    private final PatternCatalogService catalogService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<PatternStatus>>> list() {
        return ResponseEntity.ok(ApiResponse.success(catalogService.listPatterns()));
    }

    @PostMapping("/{patternId}/deactivate")
    public ResponseEntity<ApiResponse<PatternStatus>> deactivate(@PathVariable String patternId) {
        return ResponseEntity.ok(ApiResponse.success(catalogService.deactivate(patternId)));
    }

    @PostMapping("/{patternId}/activate")
    public ResponseEntity<ApiResponse<PatternStatus>> activate(@PathVariable String patternId) {
        return ResponseEntity.ok(ApiResponse.success(catalogService.activate(patternId)));
    }
}
