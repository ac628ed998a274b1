package com.purchasingpower.reviewflow.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GeminiProperties {

    private boolean enabled = false;

    private String apiKey;

    @NotBlank
    private String triageModel = "gemini-1.5-flash";

    @NotBlank
    private String deepModel = "gemini-1.5-pro";

    @NotBlank
    private String baseUrl = "https://generativelanguage.googleapis.com";

    @NotBlank
    private String apiVersion = "v1beta";
}
