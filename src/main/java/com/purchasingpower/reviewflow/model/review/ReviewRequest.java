package com.purchasingpower.reviewflow.model.review;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class ReviewRequest {
    String reviewId;
    String repositoryRef;
    String diff;
    List<String> filePaths;
}
