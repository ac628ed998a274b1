package com.purchasingpower.reviewflow.controller;

import com.purchasingpower.reviewflow.learning.FeedbackLearningLoop;
import com.purchasingpower.reviewflow.learning.MetricsRecomputeJob;
import com.purchasingpower.reviewflow.model.dto.ApiResponse;
import com.purchasingpower.reviewflow.model.dto.FeedbackRequest;
import com.purchasingpower.reviewflow.model.feedback.Feedback;
import com.purchasingpower.reviewflow.model.metrics.JobState;
import com.purchasingpower.reviewflow.model.metrics.LearningMetrics;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for feedback and learning metrics.
 *
 * Endpoints:
 * - POST /api/v1/feedback - Judge one suggestion
 * - POST /api/v1/feedback/batch - Judge several suggestions in order
 * - GET /api/v1/learning/metrics - Latest metrics snapshot
 * - POST /api/v1/learning/recompute - Recompute metrics now
 * - GET /api/v1/learning/jobs - Scheduled job state
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class FeedbackController {

    private final FeedbackLearningLoop learningLoop;
    private final MetricsRecomputeJob recomputeJob;

    @PostMapping("/feedback")
    public ResponseEntity<ApiResponse<LearningMetrics>> record(@Valid @RequestBody FeedbackRequest request) {
        return ResponseEntity.ok(ApiResponse.success(learningLoop.record(toFeedback(request))));
    }

    @PostMapping("/feedback/batch")
    public ResponseEntity<ApiResponse<LearningMetrics>> recordBatch(
            @RequestBody @NotEmpty List<@Valid FeedbackRequest> requests) {
        LearningMetrics metrics = learningLoop.currentMetrics();
        for (FeedbackRequest request : requests) {
            metrics = learningLoop.record(toFeedback(request));
        }
        log.info("Recorded feedback batch of {}", requests.size());
        return ResponseEntity.ok(ApiResponse.success(metrics));
    }

    @GetMapping("/learning/metrics")
    public ResponseEntity<ApiResponse<LearningMetrics>> metrics() {
        return ResponseEntity.ok(ApiResponse.success(learningLoop.currentMetrics()));
    }

    @PostMapping("/learning/recompute")
    public ResponseEntity<ApiResponse<JobState>> recompute() {
        recomputeJob.run();
        return ResponseEntity.ok(ApiResponse.success(recomputeJob.state()));
    }

    @GetMapping("/learning/jobs")
    public ResponseEntity<ApiResponse<List<JobState>>> jobs() {
        return ResponseEntity.ok(ApiResponse.success(List.of(recomputeJob.state())));
    }

    private Feedback toFeedback(FeedbackRequest request) {
        return Feedback.builder()
                .id(request.getFeedbackId())
                .suggestionId(request.getSuggestionId())
                .helpful(request.getHelpful())
                .correction(request.getCorrection())
                .category(request.getCategory())
                .build();
    }
}
