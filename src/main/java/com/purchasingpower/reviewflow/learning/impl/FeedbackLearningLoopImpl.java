package com.purchasingpower.reviewflow.learning.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.reviewflow.config.ReviewEngineProperties;
import com.purchasingpower.reviewflow.learning.FeedbackLearningLoop;
import com.purchasingpower.reviewflow.learning.LearningMetricsCalculator;
import com.purchasingpower.reviewflow.learning.SuggestionLedger;
import com.purchasingpower.reviewflow.model.feedback.Feedback;
import com.purchasingpower.reviewflow.model.feedback.FeedbackRecord;
import com.purchasingpower.reviewflow.model.finding.Suggestion;
import com.purchasingpower.reviewflow.model.metrics.LearningMetrics;
import com.purchasingpower.reviewflow.patterns.PatternWeightTable;
import com.purchasingpower.reviewflow.storage.ReviewPersistence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Exponential moving average over pattern factors: {@code factor += rate * (target - factor)}.
 *
 * <p>Only patterns named in the judged suggestion's provenance move. Model-only suggestions
 * change nothing but the metrics. All mutation happens under this object's monitor.
 */
@Slf4j
@Service
public class FeedbackLearningLoopImpl implements FeedbackLearningLoop {

    private final SuggestionLedger ledger;
    private final ReviewPersistence persistence;
    private final PatternWeightTable weights;
    private final LearningMetricsCalculator calculator;
    private final Executor learningExecutor;
    private final Clock clock;
    private final double learningRate;

    private final List<FeedbackRecord> history = new ArrayList<>();
    private final Set<String> seen = new HashSet<>();
    private volatile LearningMetrics current;

    public FeedbackLearningLoopImpl(SuggestionLedger ledger,
                                    ReviewPersistence persistence,
                                    PatternWeightTable weights,
                                    LearningMetricsCalculator calculator,
                                    ReviewEngineProperties properties,
                                    @Qualifier("learningExecutor") Executor learningExecutor,
                                    Clock clock) {
        this.ledger = ledger;
        this.persistence = persistence;
        this.weights = weights;
        this.calculator = calculator;
        this.learningExecutor = learningExecutor;
        this.clock = clock;
        this.learningRate = properties.getLearning().getLearningRate();
        this.current = LearningMetrics.empty(clock.instant());
    }

    @Override
    public synchronized LearningMetrics record(Feedback feedback) {
        Preconditions.checkNotNull(feedback, "feedback");
        Preconditions.checkArgument(feedback.getSuggestionId() != null && !feedback.getSuggestionId().isBlank(),
                "suggestionId must not be blank");

        Feedback normalized = normalize(feedback);
        if (seen.contains(normalized.getId()) || persistence.feedbackExists(normalized.getId())) {
            log.debug("Feedback {} already recorded, ignoring", normalized.getId());
            return current;
        }

        persistence.saveFeedback(normalized);
        apply(normalized);

        current = calculator.compute(history, weights.snapshot(), clock.instant());
        log.info("👍 Feedback {} on {} ({}), precision now {}", normalized.getId(), normalized.getSuggestionId(),
                normalized.isHelpful() ? "helpful" : "not helpful", String.format("%.3f", current.getPrecision()));
        return current;
    }

    @Override
    public CompletableFuture<LearningMetrics> submitAsync(Feedback feedback) {
        return CompletableFuture.supplyAsync(() -> record(feedback), learningExecutor);
    }

    @Override
    public synchronized LearningMetrics replay(List<Feedback> feedbackHistory) {
        weights.reset();
        history.clear();
        seen.clear();

        for (Feedback feedback : feedbackHistory) {
            if (feedback.getId() != null && seen.contains(feedback.getId())) {
                continue;
            }
            apply(normalize(feedback));
        }

        current = calculator.compute(history, weights.snapshot(), clock.instant());
        log.info("🔄 Replayed {} feedback items into {} pattern factors", history.size(), weights.snapshot().size());
        return current;
    }

    @Override
    public LearningMetrics currentMetrics() {
        return current;
    }

    @Override
    public synchronized LearningMetrics recomputeMetrics() {
        current = calculator.compute(history, weights.snapshot(), clock.instant());
        return current;
    }

    private void apply(Feedback feedback) {
        Optional<Suggestion> suggestion = ledger.find(feedback.getSuggestionId());
        seen.add(feedback.getId());
        history.add(new FeedbackRecord(feedback, suggestion.orElse(null)));

        if (suggestion.isEmpty()) {
            log.warn("⚠️ Feedback {} targets unknown suggestion {}; metrics only",
                    feedback.getId(), feedback.getSuggestionId());
            return;
        }

        double target = feedback.isHelpful() ? PatternWeightTable.NEUTRAL : weights.getFloor();
        for (String patternId : suggestion.get().getProvenance().getPatternIds()) {
            weights.update(patternId, factor -> factor + learningRate * (target - factor));
        }
    }

    private Feedback normalize(Feedback feedback) {
        Feedback.FeedbackBuilder builder = feedback.toBuilder();
        if (feedback.getId() == null || feedback.getId().isBlank()) {
            builder.id(UUID.randomUUID().toString());
        }
        if (feedback.getCreatedAt() == null) {
            builder.createdAt(clock.instant());
        }
        return builder.build();
    }
}
