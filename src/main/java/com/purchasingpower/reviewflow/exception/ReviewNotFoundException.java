package com.purchasingpower.reviewflow.exception;

import lombok.Getter;

@Getter
public class ReviewNotFoundException extends RuntimeException {

    private final String reviewId;

    public ReviewNotFoundException(String reviewId) {
        super("Review not found: " + reviewId);
        this.reviewId = reviewId;
    }
}
