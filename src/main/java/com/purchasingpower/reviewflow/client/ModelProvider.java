package com.purchasingpower.reviewflow.client;

import com.purchasingpower.reviewflow.model.llm.ModelCompletion;
import com.purchasingpower.reviewflow.model.llm.ModelRequest;
import com.purchasingpower.reviewflow.model.llm.ModelTier;

import java.time.Duration;

/**
 * A model backend the orchestrator can route a tier to.
 *
 * Providers are selected by id through {@link ModelProviderRegistry}.
 */
public interface ModelProvider {

    /**
     * Stable id used in tier routing and pricing configuration ("ollama", "gemini").
     */
    String getId();

    /**
     * Model name serving the given tier, recorded in finding provenance.
     */
    String getModelId(ModelTier tier);

    /**
     * Runs one completion. Implementations do not retry.
     *
     * @param request rendered prompt and limits
     * @param tier tier the call belongs to
     * @param timeout hint for the transport; the caller enforces it independently
     * @throws com.purchasingpower.reviewflow.exception.ProviderException on any provider failure
     */
    ModelCompletion complete(ModelRequest request, ModelTier tier, Duration timeout);
}
