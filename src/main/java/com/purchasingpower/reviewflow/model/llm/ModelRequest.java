package com.purchasingpower.reviewflow.model.llm;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ModelRequest {
    String reviewId;
    ModelTier tier;
    String templateName;
    String templateVersion;
    String prompt;
    double temperature;
    int maxOutputTokens;

    /**
     * Rough token count used for pre-call cost checks (about four characters per token).
     */
    public int estimatedInputTokens() {
        return prompt == null ? 0 : prompt.length() / 4 + 1;
    }
}
