package com.purchasingpower.reviewflow.orchestration.impl;

import com.purchasingpower.reviewflow.client.ModelProvider;
import com.purchasingpower.reviewflow.client.ModelProviderRegistry;
import com.purchasingpower.reviewflow.config.ModelTierProperties;
import com.purchasingpower.reviewflow.config.ReviewEngineProperties;
import com.purchasingpower.reviewflow.exception.BudgetExhaustedException;
import com.purchasingpower.reviewflow.exception.ModelProviderException;
import com.purchasingpower.reviewflow.exception.ProviderException;
import com.purchasingpower.reviewflow.exception.ProviderTimeoutException;
import com.purchasingpower.reviewflow.model.diff.ParsedDiff;
import com.purchasingpower.reviewflow.model.finding.FileLocation;
import com.purchasingpower.reviewflow.model.finding.Finding;
import com.purchasingpower.reviewflow.model.finding.FindingOrigin;
import com.purchasingpower.reviewflow.model.finding.Severity;
import com.purchasingpower.reviewflow.model.llm.CacheEntry;
import com.purchasingpower.reviewflow.model.llm.ModelCompletion;
import com.purchasingpower.reviewflow.model.llm.ModelFinding;
import com.purchasingpower.reviewflow.model.llm.ModelRequest;
import com.purchasingpower.reviewflow.model.llm.ModelTier;
import com.purchasingpower.reviewflow.model.llm.TriageResult;
import com.purchasingpower.reviewflow.model.prompt.PromptTemplate;
import com.purchasingpower.reviewflow.model.retrieval.ContextChunk;
import com.purchasingpower.reviewflow.orchestration.CostBudget;
import com.purchasingpower.reviewflow.orchestration.ModelOrchestrator;
import com.purchasingpower.reviewflow.orchestration.ModelOutputParser;
import com.purchasingpower.reviewflow.orchestration.RequestFingerprinter;
import com.purchasingpower.reviewflow.orchestration.ResponseCache;
import com.purchasingpower.reviewflow.parser.UnifiedDiffParser;
import com.purchasingpower.reviewflow.service.ModelCallMetricsService;
import com.purchasingpower.reviewflow.service.PromptLibraryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Two-tier model analysis with caching, fallback and budget control.
 *
 * <p>For each tier: look up the request fingerprint in the cache; on a miss, try the tier's
 * primary provider, then its fallback, each at most once and each bounded by the tier timeout.
 * Every attempt is reserved against the review's {@link CostBudget} before it is made.
 * Only outputs that parse are cached.
 */
@Slf4j
@Service
public class ModelOrchestratorImpl implements ModelOrchestrator {

    private static final int CONTEXT_PREVIEW_CHARS = 1500;

    private final ModelProviderRegistry providers;
    private final ResponseCache cache;
    private final RequestFingerprinter fingerprinter;
    private final ModelOutputParser outputParser;
    private final PromptLibraryService promptLibrary;
    private final ModelCallMetricsService metrics;
    private final ModelTierProperties tierProperties;
    private final Duration cacheTtl;
    private final Executor providerExecutor;
    private final Clock clock;

    public ModelOrchestratorImpl(ModelProviderRegistry providers,
                                 ResponseCache cache,
                                 RequestFingerprinter fingerprinter,
                                 ModelOutputParser outputParser,
                                 PromptLibraryService promptLibrary,
                                 ModelCallMetricsService metrics,
                                 ModelTierProperties tierProperties,
                                 ReviewEngineProperties engineProperties,
                                 @Qualifier("providerExecutor") Executor providerExecutor,
                                 Clock clock) {
        this.providers = providers;
        this.cache = cache;
        this.fingerprinter = fingerprinter;
        this.outputParser = outputParser;
        this.promptLibrary = promptLibrary;
        this.metrics = metrics;
        this.tierProperties = tierProperties;
        this.cacheTtl = engineProperties.getCache().getTtl();
        this.providerExecutor = providerExecutor;
        this.clock = clock;
    }

    @Override
    public List<Finding> analyze(String reviewId, ParsedDiff diff, List<ContextChunk> context, CostBudget budget) {
        if (diff.addedLineCount() == 0) {
            log.debug("Review {} has no added lines, skipping model analysis", reviewId);
            return List.of();
        }
        try {
            Optional<Tiered<TriageResult>> triage = invokeTier(reviewId, ModelTier.TRIAGE, diff, context,
                    baseVariables(diff, context), "", budget, outputParser::parseTriage);
            if (triage.isEmpty()) {
                log.warn("⚠️ Review {}: no usable triage answer, continuing without model findings", reviewId);
                return List.of();
            }
            TriageResult result = triage.get().value;
            if (!result.isHasIssues()) {
                log.info("🟢 Review {}: triage found nothing worth a deep look", reviewId);
                return List.of();
            }

            log.info("🔍 Review {}: triage flagged {} - escalating to deep analysis", reviewId, result.getCategories());
            Map<String, Object> deepVars = baseVariables(diff, context);
            deepVars.put("categories", String.join(", ", result.getCategories()));
            String categoriesKey = String.join(",", result.getCategories());

            Optional<Tiered<List<ModelFinding>>> deep = invokeTier(reviewId, ModelTier.DEEP, diff, context,
                    deepVars, categoriesKey, budget, outputParser::parseFindings);
            if (deep.isEmpty()) {
                log.warn("⚠️ Review {}: no usable deep answer, continuing without model findings", reviewId);
                return List.of();
            }
            return toFindings(deep.get(), diff);

        } catch (BudgetExhaustedException e) {
            log.warn("💸 Review {}: {} - continuing with rule findings only", reviewId, e.getMessage());
            return List.of();
        }
    }

    private <T> Optional<Tiered<T>> invokeTier(String reviewId,
                                               ModelTier tier,
                                               ParsedDiff diff,
                                               List<ContextChunk> context,
                                               Map<String, Object> variables,
                                               String extraKey,
                                               CostBudget budget,
                                               Function<String, Optional<T>> parser) {
        ModelTierProperties.Tier settings = tierProperties.tier(tier);
        PromptTemplate template = promptLibrary.getTemplate(settings.getTemplate());
        String fingerprint = fingerprinter.fingerprint(tier, template.getVersion(), diff.getRaw(), context, extraKey);

        Optional<CacheEntry> cached = cache.get(fingerprint);
        if (cached.isPresent()) {
            Optional<T> parsed = parser.apply(cached.get().getOutput());
            if (parsed.isPresent()) {
                metrics.recordCacheHit(reviewId, cached.get().getProviderId(), tier);
                log.info("💾 Review {}: {} answer served from cache", reviewId, tier);
                return Optional.of(new Tiered<>(parsed.get(), cached.get().getModelId()));
            }
        }

        ModelRequest request = ModelRequest.builder()
                .reviewId(reviewId)
                .tier(tier)
                .templateName(template.getName())
                .templateVersion(template.getVersion())
                .prompt(promptLibrary.render(settings.getTemplate(), variables))
                .temperature(settings.getTemperature())
                .maxOutputTokens(settings.getMaxOutputTokens())
                .build();

        for (String providerId : providerChain(settings)) {
            Optional<ModelProvider> provider = providers.find(providerId);
            if (provider.isEmpty()) {
                log.warn("⚠️ {} provider '{}' is not registered, skipping", tier, providerId);
                continue;
            }

            ModelTierProperties.Pricing pricing = tierProperties.pricingFor(providerId);
            budget.reserve(providerId, pricing.cost(request.estimatedInputTokens(), request.getMaxOutputTokens()));

            ModelCompletion completion;
            try {
                completion = callWithTimeout(provider.get(), request, tier, settings.getTimeout());
            } catch (ProviderTimeoutException e) {
                metrics.recordFailure(reviewId, providerId, tier, settings.getTimeout().toMillis(), true);
                log.warn("⏱️ Review {}: {} provider {} timed out after {}ms", reviewId, tier, providerId,
                        settings.getTimeout().toMillis());
                continue;
            } catch (ModelProviderException e) {
                metrics.recordFailure(reviewId, providerId, tier, 0, false);
                log.warn("⚠️ Review {}: {} provider {} failed: {}", reviewId, tier, providerId, e.getMessage());
                continue;
            }

            double cost = pricing.cost(completion.getInputTokens(), completion.getOutputTokens());
            budget.charge(cost);
            metrics.recordSuccess(reviewId, providerId, tier, completion.getLatencyMs(),
                    completion.getInputTokens(), completion.getOutputTokens(), cost);

            Optional<T> parsed = parser.apply(completion.getText());
            if (parsed.isEmpty()) {
                log.warn("⚠️ Review {}: malformed {} output from {}, treating as no findings", reviewId, tier, providerId);
                return Optional.empty();
            }

            cache.put(fingerprint, CacheEntry.builder()
                    .fingerprint(fingerprint)
                    .tier(tier)
                    .providerId(providerId)
                    .modelId(completion.getModelId())
                    .output(completion.getText())
                    .cost(cost)
                    .createdAt(clock.instant())
                    .build(), cacheTtl);
            return Optional.of(new Tiered<>(parsed.get(), completion.getModelId()));
        }

        log.warn("❌ Review {}: every {} provider failed", reviewId, tier);
        return Optional.empty();
    }

    private ModelCompletion callWithTimeout(ModelProvider provider, ModelRequest request, ModelTier tier, Duration timeout) {
        CompletableFuture<ModelCompletion> future =
                CompletableFuture.supplyAsync(() -> provider.complete(request, tier, timeout), providerExecutor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderTimeoutException(provider.getId(), timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException(provider.getId(), "interrupted while waiting for provider", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ModelProviderException) {
                throw (ModelProviderException) cause;
            }
            throw new ProviderException(provider.getId(), String.valueOf(cause), cause);
        }
    }

    private List<String> providerChain(ModelTierProperties.Tier settings) {
        Set<String> chain = new LinkedHashSet<>();
        chain.add(settings.getPrimary());
        if (settings.getFallback() != null && !settings.getFallback().isBlank()) {
            chain.add(settings.getFallback());
        }
        return List.copyOf(chain);
    }

    private Map<String, Object> baseVariables(ParsedDiff diff, List<ContextChunk> context) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("diff", UnifiedDiffParser.normalize(diff.getRaw()));
        vars.put("files", String.join(", ", diff.filePaths()));
        vars.put("hasContext", !context.isEmpty());
        vars.put("context", context.stream()
                .map(c -> "// " + c.getLocation() + " (" + c.getOrigin() + ")\n" + preview(c.getText()))
                .collect(Collectors.joining("\n\n")));
        return vars;
    }

    private String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= CONTEXT_PREVIEW_CHARS ? text : text.substring(0, CONTEXT_PREVIEW_CHARS);
    }

    private List<Finding> toFindings(Tiered<List<ModelFinding>> deep, ParsedDiff diff) {
        List<String> paths = diff.filePaths();
        String defaultPath = paths.isEmpty() ? UnifiedDiffParser.UNKNOWN_PATH : paths.get(0);

        List<Finding> findings = new ArrayList<>();
        int index = 0;
        for (ModelFinding item : deep.value) {
            String message = firstNonBlank(item.getDescription(), item.getTitle());
            if (message == null) {
                continue;
            }
            String path = item.getFilePath() != null && !item.getFilePath().isBlank() ? item.getFilePath() : defaultPath;
            int line = item.getLineNumber() != null && item.getLineNumber() > 0 ? item.getLineNumber() : 0;
            double confidence = item.getConfidence() != null ? item.getConfidence() : 0.5;
            String category = firstNonBlank(item.getCategory(), item.getType());

            findings.add(Finding.builder()
                    .id("model:" + deep.modelId + "@" + path + ":" + line + "#" + index++)
                    .origin(FindingOrigin.MODEL)
                    .category(category != null ? category.trim().toLowerCase(Locale.ROOT) : "general")
                    .severity(Severity.parse(item.getSeverity()))
                    .location(new FileLocation(path, line))
                    .message(message)
                    .fix(item.getSuggestion())
                    .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                    .modelId(deep.modelId)
                    .build());
        }
        log.info("🧠 Deep analysis produced {} findings ({})", findings.size(), deep.modelId);
        return findings;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a;
        }
        return b != null && !b.isBlank() ? b : null;
    }

    private static final class Tiered<T> {
        final T value;
        final String modelId;

        Tiered(T value, String modelId) {
            this.value = value;
            this.modelId = modelId;
        }
    }
}
