package com.purchasingpower.reviewflow.model.metrics;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class JobState {
    String name;
    boolean inProgress;
    Instant lastRunAt;
    long lastDurationMs;
    long runCount;
    String lastError;
}
