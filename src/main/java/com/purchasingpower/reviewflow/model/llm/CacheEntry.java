package com.purchasingpower.reviewflow.model.llm;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A parsed-successfully model output stored under its request fingerprint.
 */
@Value
@Builder
public class CacheEntry {
    String fingerprint;
    ModelTier tier;
    String providerId;
    String modelId;
    String output;
    double cost;
    Instant createdAt;
}
