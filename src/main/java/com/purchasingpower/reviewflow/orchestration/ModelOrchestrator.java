package com.purchasingpower.reviewflow.orchestration;

import com.purchasingpower.reviewflow.model.diff.ParsedDiff;
import com.purchasingpower.reviewflow.model.finding.Finding;
import com.purchasingpower.reviewflow.model.retrieval.ContextChunk;

import java.util.List;

/**
 * Tiered model analysis: a cheap triage call decides whether an expensive deep call is made.
 */
public interface ModelOrchestrator {

    /**
     * @param reviewId review the calls are made for (logging, metrics)
     * @param diff parsed diff under review
     * @param context retrieved context, possibly empty
     * @param budget the review's cost budget; no provider call is made once it is exhausted
     * @return MODEL findings; empty when triage finds nothing or every provider fails
     */
    List<Finding> analyze(String reviewId, ParsedDiff diff, List<ContextChunk> context, CostBudget budget);
}
