package com.purchasingpower.reviewflow.controller;

import com.purchasingpower.reviewflow.exception.ReviewNotFoundException;
import com.purchasingpower.reviewflow.model.dto.ApiResponse;
import com.purchasingpower.reviewflow.model.dto.ReviewEvent;
import com.purchasingpower.reviewflow.model.dto.SubmitReviewRequest;
import com.purchasingpower.reviewflow.model.review.Review;
import com.purchasingpower.reviewflow.model.review.ReviewRequest;
import com.purchasingpower.reviewflow.review.ReviewStateMachine;
import com.purchasingpower.reviewflow.service.ReviewEventLog;
import com.purchasingpower.reviewflow.service.ReviewStreamService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * REST API for reviews.
 *
 * Endpoints:
 * - POST /api/v1/reviews - Start a review (202, runs asynchronously)
 * - GET /api/v1/reviews/{id} - Current snapshot
 * - POST /api/v1/reviews/{id}/regenerate - Re-run a finished review
 * - POST /api/v1/reviews/{id}/cancel - Cancel a running review
 * - GET /api/v1/reviews/{id}/events - Ordered event log
 * - GET /api/v1/reviews/{id}/stream - Events over SSE
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/reviews")
@RequiredArgsConstructor
public class ReviewController {

    private final ReviewStateMachine stateMachine;
    private final ReviewEventLog eventLog;
    private final ReviewStreamService streamService;

    @PostMapping
    public ResponseEntity<ApiResponse<Review>> submit(@Valid @RequestBody SubmitReviewRequest request) {
        Review review = stateMachine.submit(ReviewRequest.builder()
                .reviewId(request.getReviewId())
                .repositoryRef(request.getRepositoryRef())
                .diff(request.getDiff())
                .filePaths(request.getFilePaths())
                .build());
        return ResponseEntity.accepted().body(ApiResponse.success(review));
    }

    @GetMapping("/{reviewId}")
    public ResponseEntity<ApiResponse<Review>> get(@PathVariable String reviewId) {
        Review review = stateMachine.find(reviewId).orElseThrow(() -> new ReviewNotFoundException(reviewId));
        return ResponseEntity.ok(ApiResponse.success(review));
    }

    @PostMapping("/{reviewId}/regenerate")
    public ResponseEntity<ApiResponse<Review>> regenerate(@PathVariable String reviewId) {
        return ResponseEntity.accepted().body(ApiResponse.success(stateMachine.regenerate(reviewId)));
    }

    @PostMapping("/{reviewId}/cancel")
    public ResponseEntity<ApiResponse<Review>> cancel(@PathVariable String reviewId) {
        return ResponseEntity.ok(ApiResponse.success(stateMachine.cancel(reviewId)));
    }

    @GetMapping("/{reviewId}/events")
    public ResponseEntity<ApiResponse<List<ReviewEvent>>> events(@PathVariable String reviewId,
                                                                 @RequestParam(defaultValue = "0") long after) {
        List<ReviewEvent> events = eventLog.eventsAfter(reviewId, after);
        if (events.isEmpty() && stateMachine.find(reviewId).isEmpty()) {
            throw new ReviewNotFoundException(reviewId);
        }
        return ResponseEntity.ok(ApiResponse.success(events));
    }

    @GetMapping(value = "/{reviewId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String reviewId) {
        log.info("📡 Client connected to review stream: {}", reviewId);
        return streamService.createStream(reviewId);
    }
}
