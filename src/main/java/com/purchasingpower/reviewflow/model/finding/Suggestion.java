package com.purchasingpower.reviewflow.model.finding;

import lombok.Builder;
import lombok.Value;

/**
 * A reconciled, confidence-scored issue shown to the user.
 */
@Value
@Builder
public class Suggestion {
    String id;
    String reviewId;
    String category;
    Severity severity;
    FileLocation location;
    String message;
    String fix;
    double confidence;
    Provenance provenance;
}
