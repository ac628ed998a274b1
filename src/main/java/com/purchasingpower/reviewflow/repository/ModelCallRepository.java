package com.purchasingpower.reviewflow.repository;

import com.purchasingpower.reviewflow.model.entity.ModelCallEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Model call history, for cost and latency analysis.
 */
@Repository
public interface ModelCallRepository extends JpaRepository<ModelCallEntity, Long> {

    /**
     * Per provider and tier totals. Cache hits are counted apart from calls.
     */
    @Query("SELECT c.providerId AS providerId, c.tier AS tier, "
            + "SUM(CASE WHEN c.outcome = 'CACHE_HIT' THEN 0 ELSE 1 END) AS calls, "
            + "SUM(CASE WHEN c.outcome = 'FAILURE' OR c.outcome = 'TIMEOUT' THEN 1 ELSE 0 END) AS failures, "
            + "SUM(CASE WHEN c.outcome = 'TIMEOUT' THEN 1 ELSE 0 END) AS timeouts, "
            + "SUM(CASE WHEN c.outcome = 'CACHE_HIT' THEN 1 ELSE 0 END) AS cacheHits, "
            + "SUM(c.inputTokens) AS inputTokens, SUM(c.outputTokens) AS outputTokens, "
            + "SUM(c.cost) AS totalCost, SUM(c.latencyMs) AS totalLatencyMs "
            + "FROM ModelCallEntity c GROUP BY c.providerId, c.tier ORDER BY c.providerId, c.tier")
    List<ModelCallSummary> summarizeByProviderAndTier();

    @Query("SELECT COALESCE(SUM(c.cost), 0.0) FROM ModelCallEntity c")
    Double calculateTotalCost();

    @Query("SELECT COALESCE(SUM(c.cost), 0.0) FROM ModelCallEntity c WHERE c.reviewId = :reviewId")
    Double calculateCostForReview(@Param("reviewId") String reviewId);

    /**
     * Grouped totals read through {@link #summarizeByProviderAndTier()}.
     */
    interface ModelCallSummary {
        String getProviderId();

        String getTier();

        Long getCalls();

        Long getFailures();

        Long getTimeouts();

        Long getCacheHits();

        Long getInputTokens();

        Long getOutputTokens();

        Double getTotalCost();

        Long getTotalLatencyMs();
    }
}
