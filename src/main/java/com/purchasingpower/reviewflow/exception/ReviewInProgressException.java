package com.purchasingpower.reviewflow.exception;

import lombok.Getter;

@Getter
public class ReviewInProgressException extends RuntimeException {

    private final String reviewId;

    public ReviewInProgressException(String reviewId, String status) {
        super("Review " + reviewId + " is still " + status);
        this.reviewId = reviewId;
    }
}
