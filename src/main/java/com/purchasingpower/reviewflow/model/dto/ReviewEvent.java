package com.purchasingpower.reviewflow.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.reviewflow.exception.ReviewFailureCause;
import com.purchasingpower.reviewflow.model.finding.Suggestion;
import com.purchasingpower.reviewflow.model.review.ReviewStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Event emitted by the review state machine.
 *
 * The sequence number is assigned when the event is appended to the review's event log,
 * so events of one review are totally ordered.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReviewEvent {

    private String reviewId;
    private long sequence;
    private int generation;
    private ReviewEventType type;
    private ReviewStatus status;
    private String message;
    private List<Suggestion> suggestions;
    private ReviewFailureCause failureCause;
    private Instant timestamp;

    public static ReviewEvent progress(String reviewId, int generation, ReviewStatus status, String message, Instant now) {
        return ReviewEvent.builder()
                .reviewId(reviewId)
                .generation(generation)
                .type(ReviewEventType.PROGRESS)
                .status(status)
                .message(message)
                .timestamp(now)
                .build();
    }

    public static ReviewEvent completed(String reviewId, int generation, List<Suggestion> suggestions, Instant now) {
        return ReviewEvent.builder()
                .reviewId(reviewId)
                .generation(generation)
                .type(ReviewEventType.COMPLETE)
                .status(ReviewStatus.COMPLETED)
                .message("✅ Review completed with " + suggestions.size() + " suggestions")
                .suggestions(suggestions)
                .timestamp(now)
                .build();
    }

    public static ReviewEvent failed(String reviewId, int generation, ReviewFailureCause cause, String message, Instant now) {
        return ReviewEvent.builder()
                .reviewId(reviewId)
                .generation(generation)
                .type(ReviewEventType.COMPLETE)
                .status(ReviewStatus.FAILED)
                .failureCause(cause)
                .message(message)
                .timestamp(now)
                .build();
    }

    public boolean isTerminal() {
        return type == ReviewEventType.COMPLETE;
    }
}
