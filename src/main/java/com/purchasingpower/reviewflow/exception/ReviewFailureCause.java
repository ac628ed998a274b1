package com.purchasingpower.reviewflow.exception;

/**
 * Why a review ended in FAILED.
 */
public enum ReviewFailureCause {
    CANCELLED,
    TIMEOUT,
    ANALYSIS_FAILED,
    INTERNAL_ERROR
}
