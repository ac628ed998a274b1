package com.purchasingpower.reviewflow.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for starting a review. Without a reviewId a new one is generated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitReviewRequest {
    @Size(max = 100)
    private String reviewId;
    private String repositoryRef;
    @NotBlank
    private String diff;
    private List<String> filePaths;
}
