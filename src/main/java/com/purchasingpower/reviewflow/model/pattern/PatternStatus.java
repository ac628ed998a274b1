package com.purchasingpower.reviewflow.model.pattern;

import lombok.Builder;
import lombok.Value;

/**
 * Runtime view of a pattern: definition plus active flag and learned factor.
 */
@Value
@Builder
public class PatternStatus {
    String id;
    String name;
    String category;
    String severity;
    boolean active;
    double baseWeight;
    double factor;
    double currentWeight;
    long evaluations;
    long matches;
    long errors;
}
