package com.purchasingpower.reviewflow.model.review;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.purchasingpower.reviewflow.exception.ReviewFailureCause;
import com.purchasingpower.reviewflow.model.finding.Suggestion;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a review at one point in its lifecycle.
 */
@Value
@Builder(toBuilder = true)
public class Review {
    String id;
    String repositoryRef;
    @JsonIgnore
    String diff;
    List<String> changedFiles;
    ReviewStatus status;
    int generation;
    Instant createdAt;
    Instant completedAt;
    long processingMillis;
    double cost;
    List<Suggestion> suggestions;
    ReviewFailureCause failureCause;
    String failureMessage;
}
