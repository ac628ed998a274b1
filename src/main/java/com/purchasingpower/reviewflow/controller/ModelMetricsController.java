package com.purchasingpower.reviewflow.controller;

import com.purchasingpower.reviewflow.model.dto.ApiResponse;
import com.purchasingpower.reviewflow.model.dto.ModelMetricsResponse;
import com.purchasingpower.reviewflow.orchestration.ResponseCache;
import com.purchasingpower.reviewflow.service.ModelCallMetricsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Model call volume, cost and cache effectiveness.
 */
@RestController
@RequestMapping("/api/v1/metrics")
@RequiredArgsConstructor
public class ModelMetricsController {

    private final ModelCallMetricsService metricsService;
    private final ResponseCache responseCache;

    @GetMapping("/models")
    public ResponseEntity<ApiResponse<ModelMetricsResponse>> models() {
        return ResponseEntity.ok(ApiResponse.success(ModelMetricsResponse.builder()
                .totalCost(metricsService.getTotalCost())
                .cache(responseCache.stats())
                .providers(metricsService.getStats())
                .build()));
    }

    @GetMapping("/models/reviews/{reviewId}/cost")
    public ResponseEntity<ApiResponse<Map<String, Object>>> reviewCost(@PathVariable String reviewId) {
        return ResponseEntity.ok(ApiResponse.success(Map.of(
                "reviewId", reviewId,
                "cost", metricsService.getCostForReview(reviewId))));
    }
}
