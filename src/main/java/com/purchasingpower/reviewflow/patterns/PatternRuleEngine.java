package com.purchasingpower.reviewflow.patterns;

import com.purchasingpower.reviewflow.model.diff.ParsedDiff;
import com.purchasingpower.reviewflow.model.finding.Finding;
import com.purchasingpower.reviewflow.model.pattern.RuleStats;
import com.purchasingpower.reviewflow.model.retrieval.ContextChunk;

import java.util.List;
import java.util.Map;

/**
 * Deterministic pattern checks over the added lines of a diff.
 */
public interface PatternRuleEngine {

    /**
     * Evaluates every given pattern independently.
     *
     * <p>Identical inputs and weights always produce identical findings in identical order.
     * A pattern that fails is logged and skipped; the others still report.
     *
     * @param diff parsed diff under review
     * @param context retrieved context (may be empty)
     * @param activePatterns patterns to evaluate
     * @return RULE findings with confidence = base weight x learned factor
     */
    List<Finding> evaluate(ParsedDiff diff, List<ContextChunk> context, List<CompiledPattern> activePatterns);

    /**
     * Evaluation counters per pattern id.
     */
    Map<String, RuleStats> statistics();
}
