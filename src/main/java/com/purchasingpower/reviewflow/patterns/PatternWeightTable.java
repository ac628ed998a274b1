package com.purchasingpower.reviewflow.patterns;

import com.purchasingpower.reviewflow.config.ReviewEngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleUnaryOperator;

/**
 * Feedback-adjusted confidence factor per pattern id.
 *
 * <p>A pattern with no recorded feedback has factor 1.0. Every stored factor is
 * clamped to [floor, 1.0], and updates are atomic per key so the rule engine can
 * read while the learning loop writes.
 */
@Slf4j
@Component
public class PatternWeightTable {

    public static final double NEUTRAL = 1.0;

    private final Map<String, Double> factors = new ConcurrentHashMap<>();
    private final double floor;

    @Autowired
    public PatternWeightTable(ReviewEngineProperties properties) {
        this(properties.getLearning().getConfidenceFloor());
    }

    public PatternWeightTable(double floor) {
        this.floor = floor;
    }

    public double factor(String patternId) {
        return factors.getOrDefault(patternId, NEUTRAL);
    }

    /**
     * Applies an update to one factor atomically and returns the clamped result.
     */
    public double update(String patternId, DoubleUnaryOperator update) {
        double updated = factors.compute(patternId, (id, current) -> {
            double base = current == null ? NEUTRAL : current;
            return clamp(update.applyAsDouble(base));
        });
        log.debug("Pattern {} factor -> {}", patternId, String.format("%.4f", updated));
        return updated;
    }

    public void reset() {
        factors.clear();
    }

    public Map<String, Double> snapshot() {
        return new TreeMap<>(factors);
    }

    public double getFloor() {
        return floor;
    }

    private double clamp(double value) {
        if (Double.isNaN(value)) {
            return floor;
        }
        return Math.max(floor, Math.min(NEUTRAL, value));
    }
}
