package com.purchasingpower.reviewflow.service;

import com.purchasingpower.reviewflow.config.ClockConfig;
import com.purchasingpower.reviewflow.model.entity.ModelCallEntity;
import com.purchasingpower.reviewflow.model.llm.ModelTier;
import com.purchasingpower.reviewflow.model.metrics.ModelCallStats;
import com.purchasingpower.reviewflow.repository.ModelCallRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.assertj.core.api.Assertions.tuple;

@DataJpaTest
@Import({ModelCallMetricsService.class, ClockConfig.class})
@ActiveProfiles("test")
@DisplayName("Model call metrics")
class ModelCallMetricsServiceTest {

    @Autowired
    private ModelCallMetricsService metrics;

    @Autowired
    private ModelCallRepository repository;

    @Test
    @DisplayName("Should store one row per call and derive grouped statistics from them")
    void getStats_derivedFromStoredCalls() {
        // Given
        metrics.recordSuccess("rev-1", "gemini", ModelTier.DEEP, 800, 1000, 200, 0.0025);
        metrics.recordSuccess("rev-2", "gemini", ModelTier.DEEP, 400, 500, 100, 0.00125);
        metrics.recordFailure("rev-1", "ollama", ModelTier.TRIAGE, 20000, true);
        metrics.recordFailure("rev-2", "ollama", ModelTier.TRIAGE, 0, false);
        metrics.recordSuccess("rev-2", "ollama", ModelTier.TRIAGE, 300, 120, 10, 0.0);
        metrics.recordCacheHit("rev-3", "ollama", ModelTier.TRIAGE);

        // When
        List<ModelCallStats> stats = metrics.getStats();

        // Then
        assertThat(repository.findAll()).hasSize(6)
                .extracting(ModelCallEntity::getCallId).doesNotHaveDuplicates();
        assertThat(stats).extracting(ModelCallStats::getProviderId, ModelCallStats::getTier)
                .containsExactly(
                        tuple("gemini", "DEEP"),
                        tuple("ollama", "TRIAGE"));

        ModelCallStats gemini = stats.get(0);
        assertThat(gemini.getCalls()).isEqualTo(2);
        assertThat(gemini.getFailures()).isZero();
        assertThat(gemini.getInputTokens()).isEqualTo(1500);
        assertThat(gemini.getOutputTokens()).isEqualTo(300);
        assertThat(gemini.getTotalCost()).isCloseTo(0.00375, offset(1e-12));
        assertThat(gemini.getAverageLatencyMs()).isEqualTo(600.0);

        ModelCallStats ollama = stats.get(1);
        assertThat(ollama.getCalls()).isEqualTo(3);
        assertThat(ollama.getFailures()).isEqualTo(2);
        assertThat(ollama.getTimeouts()).isEqualTo(1);
        assertThat(ollama.getCacheHits()).isEqualTo(1);
        assertThat(ollama.getAverageLatencyMs()).isCloseTo((20000 + 300) / 3.0, offset(1e-9));
    }

    @Test
    @DisplayName("Should total cost across all calls and per review")
    void getTotalCost_sumsStoredCalls() {
        // Given
        metrics.recordSuccess("rev-1", "gemini", ModelTier.TRIAGE, 100, 400, 20, 0.0006);
        metrics.recordSuccess("rev-1", "gemini", ModelTier.DEEP, 900, 1000, 200, 0.0025);
        metrics.recordSuccess("rev-2", "gemini", ModelTier.DEEP, 700, 1000, 100, 0.002);

        // When / Then
        assertThat(metrics.getTotalCost()).isCloseTo(0.0051, offset(1e-12));
        assertThat(metrics.getCostForReview("rev-1")).isCloseTo(0.0031, offset(1e-12));
        assertThat(metrics.getCostForReview("rev-unknown")).isZero();
    }

    @Test
    @DisplayName("Should report no statistics and zero cost before any call")
    void getStats_empty() {
        assertThat(metrics.getStats()).isEmpty();
        assertThat(metrics.getTotalCost()).isZero();
    }
}
