package com.purchasingpower.reviewflow.model.dto;

public enum ReviewEventType {
    /** A non-terminal state transition. */
    PROGRESS,
    /** The single terminal event of a review generation. */
    COMPLETE
}
