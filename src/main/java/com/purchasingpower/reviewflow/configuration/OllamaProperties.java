package com.purchasingpower.reviewflow.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OllamaProperties {

    private boolean enabled = true;

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String triageModel = "qwen2.5-coder:1.5b";

    @NotBlank
    private String deepModel = "qwen2.5-coder:7b";

    @NotBlank
    private String embeddingModel = "mxbai-embed-large";

    /** Transport timeout; the orchestrator enforces the tighter per-tier limit. */
    @Min(1)
    private int timeoutSeconds = 120;
}
