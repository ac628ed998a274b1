package com.purchasingpower.reviewflow.exception;

import lombok.Getter;

/**
 * Neither the rule engine nor the model orchestrator produced a result for a review.
 */
@Getter
public class AnalysisFailedException extends RuntimeException {

    private final String reviewId;

    public AnalysisFailedException(String reviewId, String message, Throwable cause) {
        super(message, cause);
        this.reviewId = reviewId;
    }
}
