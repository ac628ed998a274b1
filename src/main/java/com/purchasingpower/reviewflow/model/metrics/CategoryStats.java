package com.purchasingpower.reviewflow.model.metrics;

import lombok.Value;

@Value
public class CategoryStats {
    long total;
    long helpful;

    public double getHelpfulRatio() {
        return total == 0 ? 0.0 : (double) helpful / total;
    }
}
