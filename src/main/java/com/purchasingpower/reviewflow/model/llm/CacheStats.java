package com.purchasingpower.reviewflow.model.llm;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStats {
    long hits;
    long misses;
    int size;

    public double getHitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
