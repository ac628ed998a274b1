package com.purchasingpower.reviewflow.service;

import com.purchasingpower.reviewflow.model.entity.ModelCallEntity;
import com.purchasingpower.reviewflow.model.llm.ModelTier;
import com.purchasingpower.reviewflow.model.metrics.ModelCallStats;
import com.purchasingpower.reviewflow.repository.ModelCallRepository;
import com.purchasingpower.reviewflow.repository.ModelCallRepository.ModelCallSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Records every model call in MODEL_CALL and derives per provider and tier
 * statistics from the stored rows: volume, failures, tokens, cost, latency.
 *
 * <p>Recording never breaks a review: a failed save is logged and dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelCallMetricsService {

    private final ModelCallRepository repository;
    private final Clock clock;

    public void recordSuccess(String reviewId, String providerId, ModelTier tier, long latencyMs,
                              int inputTokens, int outputTokens, double cost) {
        save(reviewId, providerId, tier, ModelCallEntity.SUCCESS, latencyMs, inputTokens, outputTokens, cost);
        log.debug("📊 {}/{} call: {}ms, {} in / {} out, ${}", providerId, tier, latencyMs,
                inputTokens, outputTokens, String.format("%.6f", cost));
    }

    public void recordFailure(String reviewId, String providerId, ModelTier tier, long latencyMs, boolean timeout) {
        save(reviewId, providerId, tier, timeout ? ModelCallEntity.TIMEOUT : ModelCallEntity.FAILURE,
                latencyMs, 0, 0, 0.0);
    }

    public void recordCacheHit(String reviewId, String providerId, ModelTier tier) {
        save(reviewId, providerId, tier, ModelCallEntity.CACHE_HIT, 0, 0, 0, 0.0);
    }

    public List<ModelCallStats> getStats() {
        return repository.summarizeByProviderAndTier().stream()
                .map(ModelCallMetricsService::toStats)
                .toList();
    }

    public double getTotalCost() {
        Double total = repository.calculateTotalCost();
        return total == null ? 0.0 : total;
    }

    public double getCostForReview(String reviewId) {
        Double total = repository.calculateCostForReview(reviewId);
        return total == null ? 0.0 : total;
    }

    private void save(String reviewId, String providerId, ModelTier tier, String outcome, long latencyMs,
                      int inputTokens, int outputTokens, double cost) {
        try {
            repository.save(ModelCallEntity.builder()
                    .callId(UUID.randomUUID().toString())
                    .reviewId(reviewId)
                    .providerId(providerId)
                    .tier(tier.name())
                    .outcome(outcome)
                    .latencyMs(latencyMs)
                    .inputTokens(inputTokens)
                    .outputTokens(outputTokens)
                    .cost(cost)
                    .createdAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.error("❌ Failed to record {} call to {}/{} for review {}: {}",
                    outcome, providerId, tier, reviewId, e.getMessage(), e);
        }
    }

    private static ModelCallStats toStats(ModelCallSummary s) {
        long calls = orZero(s.getCalls());
        return ModelCallStats.builder()
                .providerId(s.getProviderId())
                .tier(s.getTier())
                .calls(calls)
                .failures(orZero(s.getFailures()))
                .timeouts(orZero(s.getTimeouts()))
                .cacheHits(orZero(s.getCacheHits()))
                .inputTokens(orZero(s.getInputTokens()))
                .outputTokens(orZero(s.getOutputTokens()))
                .totalCost(s.getTotalCost() == null ? 0.0 : s.getTotalCost())
                .averageLatencyMs(calls == 0 ? 0.0 : (double) orZero(s.getTotalLatencyMs()) / calls)
                .build();
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
