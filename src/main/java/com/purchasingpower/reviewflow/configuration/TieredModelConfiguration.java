package com.purchasingpower.reviewflow.configuration;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Local Ollama models used by the review tiers.
 *
 * TRIAGE uses a small, fast model to decide whether a diff needs a closer look;
 * DEEP uses a larger one for detailed findings. Retries are disabled here because
 * the orchestrator owns retry and fallback decisions against the review's budget.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class TieredModelConfiguration {

    private final AppProperties appProperties;

    @Bean("triageChatModel")
    @ConditionalOnProperty(prefix = "app.ollama", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ChatLanguageModel triageChatModel() {
        return buildChatModel(appProperties.getOllama().getTriageModel(), "triage");
    }

    @Bean("deepChatModel")
    @ConditionalOnProperty(prefix = "app.ollama", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ChatLanguageModel deepChatModel() {
        return buildChatModel(appProperties.getOllama().getDeepModel(), "deep");
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.review.retrieval", name = "provider", havingValue = "pinecone")
    public EmbeddingModel queryEmbeddingModel() {
        OllamaProperties ollama = appProperties.getOllama();
        log.info("🔷 Initializing query embedding model {} at {}", ollama.getEmbeddingModel(), ollama.getBaseUrl());
        return OllamaEmbeddingModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getEmbeddingModel())
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .maxRetries(0)
                .build();
    }

    private ChatLanguageModel buildChatModel(String modelName, String tier) {
        OllamaProperties ollama = appProperties.getOllama();
        log.info("🔧 Initializing {} model (Ollama - Local)", tier);
        log.info("   - URL: {}", ollama.getBaseUrl());
        log.info("   - Model: {}", modelName);

        ChatLanguageModel model = OllamaChatModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(modelName)
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .temperature(0.0)
                .format("json")
                .maxRetries(0)
                .logRequests(false)
                .logResponses(false)
                .build();

        log.info("✅ {} model initialized", tier);
        return model;
    }
}
