package com.purchasingpower.reviewflow.model.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated call counters for one provider and tier.
 */
@Value
@Builder
public class ModelCallStats {
    String providerId;
    String tier;
    long calls;
    long failures;
    long timeouts;
    long cacheHits;
    long inputTokens;
    long outputTokens;
    double totalCost;
    double averageLatencyMs;
}
