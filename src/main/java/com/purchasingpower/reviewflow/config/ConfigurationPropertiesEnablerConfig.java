package com.purchasingpower.reviewflow.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the engine's {@code @ConfigurationProperties} classes in one place.
 *
 * <ul>
 *   <li>{@link ReviewEngineProperties} - deadlines, retrieval, cache, budget, aggregation, learning
 *   <li>{@link PatternCatalogProperties} - pattern catalogue
 *   <li>{@link ModelTierProperties} - provider routing and pricing per tier
 * </ul>
 *
 * Provider connection settings live in {@link com.purchasingpower.reviewflow.configuration.AppProperties}.
 */
@Configuration
@EnableConfigurationProperties({
    ReviewEngineProperties.class,
    PatternCatalogProperties.class,
    ModelTierProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
