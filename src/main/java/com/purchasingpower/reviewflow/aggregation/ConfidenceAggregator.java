package com.purchasingpower.reviewflow.aggregation;

import com.purchasingpower.reviewflow.model.finding.Finding;
import com.purchasingpower.reviewflow.model.finding.Suggestion;

import java.util.List;

/**
 * Merges findings from all sources into ranked suggestions.
 */
public interface ConfidenceAggregator {

    /**
     * Groups findings that describe the same issue and combines their confidence.
     *
     * <p>Agreeing independent sources raise confidence as 1 - prod(1 - c_i), capped; a
     * suggestion is never less confident than its strongest finding. Output is sorted by
     * confidence, then severity, then location.
     *
     * <p>Suggestion ids are stable within one generation of a review and differ across
     * generations, so a regenerated review never reuses the ids of its predecessor.
     */
    List<Suggestion> aggregate(String reviewId, int generation, List<Finding> findings);
}
