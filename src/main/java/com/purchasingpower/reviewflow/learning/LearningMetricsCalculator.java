package com.purchasingpower.reviewflow.learning;

import com.purchasingpower.reviewflow.config.ReviewEngineProperties;
import com.purchasingpower.reviewflow.model.feedback.FeedbackRecord;
import com.purchasingpower.reviewflow.model.metrics.CategoryStats;
import com.purchasingpower.reviewflow.model.metrics.LearningMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pure function from feedback history to a metrics snapshot. Same history, same snapshot.
 */
@Slf4j
@Component
public class LearningMetricsCalculator {

    private final GoldenSetRecallEstimator recallEstimator;
    private final int calibrationBuckets;
    private final int velocityWindow;

    @Autowired
    public LearningMetricsCalculator(GoldenSetRecallEstimator recallEstimator, ReviewEngineProperties properties) {
        this(recallEstimator, properties.getLearning().getCalibrationBuckets(), properties.getLearning().getVelocityWindow());
    }

    public LearningMetricsCalculator(GoldenSetRecallEstimator recallEstimator, int calibrationBuckets, int velocityWindow) {
        this.recallEstimator = recallEstimator;
        this.calibrationBuckets = calibrationBuckets;
        this.velocityWindow = velocityWindow;
    }

    public LearningMetrics compute(List<FeedbackRecord> history, Map<String, Double> patternFactors, Instant now) {
        long total = history.size();
        long helpful = history.stream().filter(r -> r.getFeedback().isHelpful()).count();
        List<FeedbackRecord> resolved = history.stream().filter(FeedbackRecord::isResolved).toList();
        long resolvedHelpful = resolved.stream().filter(r -> r.getFeedback().isHelpful()).count();

        double precision = resolved.isEmpty() ? 0.0 : (double) resolvedHelpful / resolved.size();
        double recall = estimateRecall();

        return LearningMetrics.builder()
                .totalFeedback(total)
                .helpfulCount(helpful)
                .resolvedFeedback(resolved.size())
                .helpfulRatio(total == 0 ? 0.0 : (double) helpful / total)
                .precision(precision)
                .recall(recall)
                .f1(f1(precision, recall))
                .calibrationError(calibrationError(resolved))
                .learningVelocity(learningVelocity(resolved))
                .falsePositives(resolved.size() - resolvedHelpful)
                .categories(categories(history))
                .patternFactors(new TreeMap<>(patternFactors))
                .computedAt(now)
                .build();
    }

    /**
     * Expected calibration error: per confidence bucket, the gap between mean predicted
     * confidence and the observed helpful rate, weighted by bucket size.
     */
    public double calibrationError(List<FeedbackRecord> resolved) {
        if (resolved.isEmpty()) {
            return 0.0;
        }
        double[] confidenceSum = new double[calibrationBuckets];
        long[] helpfulCount = new long[calibrationBuckets];
        long[] count = new long[calibrationBuckets];

        for (FeedbackRecord record : resolved) {
            double confidence = record.getSuggestion().getConfidence();
            int bucket = Math.min(calibrationBuckets - 1, (int) Math.floor(confidence * calibrationBuckets));
            bucket = Math.max(0, bucket);
            confidenceSum[bucket] += confidence;
            count[bucket]++;
            if (record.getFeedback().isHelpful()) {
                helpfulCount[bucket]++;
            }
        }

        double error = 0.0;
        for (int b = 0; b < calibrationBuckets; b++) {
            if (count[b] == 0) {
                continue;
            }
            double meanConfidence = confidenceSum[b] / count[b];
            double helpfulRate = (double) helpfulCount[b] / count[b];
            error += Math.abs(meanConfidence - helpfulRate) * count[b] / resolved.size();
        }
        return error;
    }

    /**
     * Helpful rate of the latest window minus the window before it. Zero until two full windows exist.
     */
    public double learningVelocity(List<FeedbackRecord> resolved) {
        if (resolved.size() < 2 * velocityWindow) {
            return 0.0;
        }
        int end = resolved.size();
        double latest = helpfulRate(resolved.subList(end - velocityWindow, end));
        double previous = helpfulRate(resolved.subList(end - 2 * velocityWindow, end - velocityWindow));
        return latest - previous;
    }

    private double estimateRecall() {
        try {
            return recallEstimator.estimateRecall();
        } catch (RuntimeException e) {
            log.warn("⚠️ Golden set recall estimate failed: {}", e.getMessage());
            return Double.NaN;
        }
    }

    private static double helpfulRate(List<FeedbackRecord> window) {
        return (double) window.stream().filter(r -> r.getFeedback().isHelpful()).count() / window.size();
    }

    private static double f1(double precision, double recall) {
        if (Double.isNaN(recall) || precision + recall == 0.0) {
            return 0.0;
        }
        return 2 * precision * recall / (precision + recall);
    }

    private static Map<String, CategoryStats> categories(List<FeedbackRecord> history) {
        Map<String, long[]> counts = new TreeMap<>();
        for (FeedbackRecord record : history) {
            long[] c = counts.computeIfAbsent(record.category(), k -> new long[2]);
            c[0]++;
            if (record.getFeedback().isHelpful()) {
                c[1]++;
            }
        }
        Map<String, CategoryStats> stats = new TreeMap<>();
        counts.forEach((category, c) -> stats.put(category, new CategoryStats(c[0], c[1])));
        return stats;
    }
}
