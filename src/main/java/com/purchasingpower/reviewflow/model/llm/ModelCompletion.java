package com.purchasingpower.reviewflow.model.llm;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ModelCompletion {
    String providerId;
    String modelId;
    String text;
    int inputTokens;
    int outputTokens;
    long latencyMs;
}
