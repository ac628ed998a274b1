package com.purchasingpower.reviewflow.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for judging one suggestion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {
    @Size(max = 100)
    private String feedbackId;
    @NotBlank
    private String suggestionId;
    @NotNull
    private Boolean helpful;
    private String correction;
    private String category;
}
