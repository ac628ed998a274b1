package com.purchasingpower.reviewflow.learning;

import com.purchasingpower.reviewflow.model.feedback.Feedback;
import com.purchasingpower.reviewflow.model.metrics.LearningMetrics;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Turns user feedback into pattern weight adjustments and quality metrics.
 */
public interface FeedbackLearningLoop {

    /**
     * Persists one feedback item and moves the factors of the patterns behind its
     * suggestion toward 1.0 (helpful) or the floor (not helpful).
     * A feedback id that was already recorded is ignored.
     *
     * @return metrics after the update
     */
    LearningMetrics record(Feedback feedback);

    /**
     * Same as {@link #record(Feedback)}, on the learning thread so analyses never wait on it.
     */
    CompletableFuture<LearningMetrics> submitAsync(Feedback feedback);

    /**
     * Rebuilds factors and metrics from scratch out of the given history, without persisting it.
     * Replaying the same history twice yields the same state.
     */
    LearningMetrics replay(List<Feedback> history);

    LearningMetrics currentMetrics();

    LearningMetrics recomputeMetrics();
}
