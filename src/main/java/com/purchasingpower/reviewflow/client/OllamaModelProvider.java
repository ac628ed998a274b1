package com.purchasingpower.reviewflow.client;

import com.purchasingpower.reviewflow.configuration.AppProperties;
import com.purchasingpower.reviewflow.exception.ProviderException;
import com.purchasingpower.reviewflow.model.CallContext;
import com.purchasingpower.reviewflow.model.ServiceType;
import com.purchasingpower.reviewflow.model.llm.ModelCompletion;
import com.purchasingpower.reviewflow.model.llm.ModelRequest;
import com.purchasingpower.reviewflow.model.llm.ModelTier;
import com.purchasingpower.reviewflow.util.ExternalCallLogger;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Local Ollama models through LangChain4j.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.ollama", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OllamaModelProvider implements ModelProvider {

    public static final String ID = "ollama";

    private final ChatLanguageModel triageModel;
    private final ChatLanguageModel deepModel;
    private final AppProperties props;

    public OllamaModelProvider(@Qualifier("triageChatModel") ChatLanguageModel triageModel,
                               @Qualifier("deepChatModel") ChatLanguageModel deepModel,
                               AppProperties props) {
        this.triageModel = triageModel;
        this.deepModel = deepModel;
        this.props = props;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getModelId(ModelTier tier) {
        return ID + ":" + (tier == ModelTier.TRIAGE
                ? props.getOllama().getTriageModel()
                : props.getOllama().getDeepModel());
    }

    @Override
    public ModelCompletion complete(ModelRequest request, ModelTier tier, Duration timeout) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.OLLAMA, "chat/" + tier.name().toLowerCase(), log);
        call.logRequest("Review prompt",
                "Review", request.getReviewId(),
                "Model", getModelId(tier),
                "Prompt Length", request.getPrompt().length() + " chars",
                "Prompt", ExternalCallLogger.truncate(request.getPrompt(), 500));

        ChatLanguageModel model = tier == ModelTier.TRIAGE ? triageModel : deepModel;
        try {
            Response<AiMessage> response = model.generate(UserMessage.from(request.getPrompt()));
            String text = response.content() != null ? response.content().text() : "";
            TokenUsage usage = response.tokenUsage();
            int inputTokens = usage != null && usage.inputTokenCount() != null
                    ? usage.inputTokenCount() : request.estimatedInputTokens();
            int outputTokens = usage != null && usage.outputTokenCount() != null
                    ? usage.outputTokenCount() : text.length() / 4;

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
        } catch (RuntimeException e) {
            call.logError(e.getMessage(), e);
            throw new ProviderException(ID, "Ollama call failed for " + getModelId(tier) + ": " + e.getMessage(), e);
        }
    }
}
