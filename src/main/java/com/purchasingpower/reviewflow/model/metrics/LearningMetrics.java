package com.purchasingpower.reviewflow.model.metrics;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of how well suggestions match user judgement.
 *
 * <ul>
 *   <li>precision: helpful share of feedback whose suggestion could be resolved</li>
 *   <li>recall: golden-set estimate, NaN when no golden cases are available</li>
 *   <li>calibrationError: expected calibration error over confidence buckets</li>
 *   <li>learningVelocity: helpful rate of the latest window minus the one before it</li>
 * </ul>
 */
@Value
@Builder
public class LearningMetrics {
    long totalFeedback;
    long helpfulCount;
    long resolvedFeedback;
    double helpfulRatio;
    double precision;
    double recall;
    double f1;
    double calibrationError;
    double learningVelocity;
    long falsePositives;
    Map<String, CategoryStats> categories;
    Map<String, Double> patternFactors;
    Instant computedAt;

    public static LearningMetrics empty(Instant now) {
        return LearningMetrics.builder()
                .recall(Double.NaN)
                .categories(Map.of())
                .patternFactors(Map.of())
                .computedAt(now)
                .build();
    }
}
