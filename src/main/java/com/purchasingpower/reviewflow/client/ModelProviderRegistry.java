package com.purchasingpower.reviewflow.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Model providers keyed by id. Routing configuration refers to providers only by these ids.
 */
@Slf4j
@Component
public class ModelProviderRegistry {

    private final Map<String, ModelProvider> providers = new TreeMap<>();

    public ModelProviderRegistry(List<ModelProvider> available) {
        for (ModelProvider provider : available) {
            if (providers.putIfAbsent(provider.getId(), provider) != null) {
                throw new IllegalStateException("Duplicate model provider id: " + provider.getId());
            }
        }
        log.info("🚀 Model providers registered: {}", providers.keySet());
    }

    public Optional<ModelProvider> find(String providerId) {
        return providerId == null ? Optional.empty() : Optional.ofNullable(providers.get(providerId));
    }

    public List<String> ids() {
        return List.copyOf(providers.keySet());
    }
}
