package com.purchasingpower.reviewflow.model.feedback;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A user's verdict on one suggestion.
 */
@Value
@Builder(toBuilder = true)
public class Feedback {
    String id;
    String suggestionId;
    boolean helpful;
    String correction;
    String category;
    Instant createdAt;
}
