package com.purchasingpower.reviewflow.config;

import com.purchasingpower.reviewflow.model.llm.ModelTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Provider routing and pricing per model tier, bound from {@code app.models}.
 *
 * <pre>
 * app:
 *   models:
 *     triage:
 *       primary: ollama
 *       fallback: gemini
 *       timeout: 20s
 *     deep:
 *       primary: gemini
 *       fallback: ollama
 *     pricing:
 *       gemini:
 *         input-token-cost: 0.00000125
 *         output-token-cost: 0.000005
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.models")
public class ModelTierProperties {

    @Valid
    private Tier triage = Tier.defaults("review-triage", 256, Duration.ofSeconds(20));

    @Valid
    private Tier deep = Tier.defaults("review-deep", 2048, Duration.ofSeconds(60));

    /**
     * Per-token prices keyed by provider id. Providers without an entry are free.
     */
    private Map<String, Pricing> pricing = new HashMap<>();

    public Tier tier(ModelTier tier) {
        return tier == ModelTier.TRIAGE ? triage : deep;
    }

    public Pricing pricingFor(String providerId) {
        Pricing configured = pricing.get(providerId);
        return configured != null ? configured : new Pricing();
    }

    @Data
    public static class Tier {
        @NotBlank
        private String primary = "ollama";

        private String fallback;

        @NotBlank
        private String template;

        @NotNull
        private Duration timeout;

        @Min(1)
        private int maxOutputTokens;

        private double temperature = 0.0;

        static Tier defaults(String template, int maxOutputTokens, Duration timeout) {
            Tier tier = new Tier();
            tier.setTemplate(template);
            tier.setMaxOutputTokens(maxOutputTokens);
            tier.setTimeout(timeout);
            return tier;
        }
    }

    @Data
    public static class Pricing {
        private double inputTokenCost;
        private double outputTokenCost;

        public double cost(long inputTokens, long outputTokens) {
            return inputTokens * inputTokenCost + outputTokens * outputTokenCost;
        }
    }
}
