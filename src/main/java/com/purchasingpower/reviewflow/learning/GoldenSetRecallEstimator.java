package com.purchasingpower.reviewflow.learning;

/**
 * Estimates recall against a labelled set of diffs with known issues.
 */
public interface GoldenSetRecallEstimator {

    /**
     * @return share of expected categories that were reported, or NaN when there is nothing to measure
     */
    double estimateRecall();
}
