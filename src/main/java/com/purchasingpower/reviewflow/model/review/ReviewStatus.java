package com.purchasingpower.reviewflow.model.review;

/**
 * Lifecycle of a review.
 *
 * <pre>
 * PENDING → RETRIEVING → ANALYZING → AGGREGATING → COMPLETED
 *    └──────────┴────────────┴─────────────┴──────→ FAILED
 * </pre>
 *
 * COMPLETED and FAILED are terminal.
 */
public enum ReviewStatus {

    PENDING,

    /** Fetching related context from the similarity index. */
    RETRIEVING,

    /** Rule engine and model orchestrator running side by side. */
    ANALYZING,

    /** Merging findings into suggestions. */
    AGGREGATING,

    COMPLETED,

    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Forward edge of the happy path, or FAILED from any non-terminal state.
     */
    public boolean canTransitionTo(ReviewStatus next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
