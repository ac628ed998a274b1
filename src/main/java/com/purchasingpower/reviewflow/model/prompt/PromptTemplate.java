package com.purchasingpower.reviewflow.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Versioned prompt loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: review-triage
 * version: v1.0
 * systemPrompt: |
 *   You are a senior code reviewer...
 * userPrompt: |
 *   Diff:
 *   {{diff}}
 * </pre>
 *
 * The version is part of the model response cache key; bump it whenever the text changes.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private double temperature;
    private String systemPrompt;
    private String userPrompt;
}
