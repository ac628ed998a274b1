package com.purchasingpower.reviewflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.reviewflow.configuration.AppProperties;
import com.purchasingpower.reviewflow.configuration.GeminiProperties;
import com.purchasingpower.reviewflow.exception.ProviderException;
import com.purchasingpower.reviewflow.model.CallContext;
import com.purchasingpower.reviewflow.model.ServiceType;
import com.purchasingpower.reviewflow.model.llm.ModelCompletion;
import com.purchasingpower.reviewflow.model.llm.ModelRequest;
import com.purchasingpower.reviewflow.model.llm.ModelTier;
import com.purchasingpower.reviewflow.util.ExternalCallLogger;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini over its REST API.
 *
 * The API key travels in the {@code x-goog-api-key} header, never in the URL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.gemini", name = "enabled", havingValue = "true")
public class GeminiModelProvider implements ModelProvider {

    public static final String ID = "gemini";

    private final AppProperties props;
    private final ObjectMapper objectMapper;

    private WebClient geminiWebClient;

    @PostConstruct
    public void init() {
        GeminiProperties gemini = props.getGemini();
        if (gemini.getApiKey() == null || gemini.getApiKey().isBlank()) {
            throw new IllegalStateException("app.gemini.api-key is required when app.gemini.enabled=true");
        }
        this.geminiWebClient = WebClient.builder()
                .baseUrl(gemini.getBaseUrl())
                .defaultHeader("x-goog-api-key", gemini.getApiKey())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getModelId(ModelTier tier) {
        return ID + ":" + modelName(tier);
    }

    @Override
    public ModelCompletion complete(ModelRequest request, ModelTier tier, Duration timeout) {
        String model = modelName(tier);
        String url = String.format("/%s/models/%s:generateContent", props.getGemini().getApiVersion(), model);

        CallContext call = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent/" + tier.name().toLowerCase(), log);
        call.logRequest("Review prompt",
                "Review", request.getReviewId(),
                "Model", model,
                "Prompt Length", request.getPrompt().length() + " chars",
                "Prompt", ExternalCallLogger.truncate(request.getPrompt(), 500));

        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", request.getPrompt())))),
                "generationConfig", Map.of(
                        "responseMimeType", "application/json",
                        "temperature", request.getTemperature(),
                        "maxOutputTokens", request.getMaxOutputTokens()));

        try {
            String json = geminiWebClient.post().uri(url).bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();

            JsonNode root = objectMapper.readTree(json);
            JsonNode candidates = root.path("candidates");
            if (!candidates.isArray() || candidates.isEmpty()) {
                throw new ProviderException(ID, "Gemini returned no candidates", null);
            }
            String text = candidates.get(0).path("content").path("parts").path(0).path("text").asText("");

            JsonNode usage = root.path("usageMetadata");
            int inputTokens = usage.path("promptTokenCount").asInt(request.estimatedInputTokens());
            int outputTokens = usage.path("candidatesTokenCount").asInt(text.length() / 4);

            call.logResponse("Completion received",
                    "Tokens", inputTokens + " in + " + outputTokens + " out",
                    "Response", ExternalCallLogger.truncate(text, 500));

            return ModelCompletion.builder()
                    .providerId(ID)
                    .modelId(getModelId(tier))
                    .text(text)
                    .inputTokens(inputTokens)
                    .outputTokens(outputTokens)
                    .latencyMs(call.getElapsedMs())
                    .build();

        } catch (WebClientResponseException e) {
            call.logError(e.getStatusCode() + ": " + e.getMessage(), e);
            throw new ProviderException(ID, "Gemini returned " + e.getStatusCode().value(), e.getStatusCode().value(), e);
        } catch (ProviderException e) {
            call.logError(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            call.logError("Unexpected error", e);
            throw new ProviderException(ID, "Gemini call failed: " + e.getMessage(), e);
        }
    }

    private String modelName(ModelTier tier) {
        return tier == ModelTier.TRIAGE ? props.getGemini().getTriageModel() : props.getGemini().getDeepModel();
    }
}
