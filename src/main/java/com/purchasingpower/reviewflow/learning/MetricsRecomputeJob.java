package com.purchasingpower.reviewflow.learning;

import com.purchasingpower.reviewflow.model.metrics.JobState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic recomputation of the learning metrics snapshot.
 *
 * A run that starts while another is still in progress is skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsRecomputeJob {

    public static final String NAME = "learning-metrics-recompute";

    private final FeedbackLearningLoop learningLoop;
    private final Clock clock;

    private final AtomicBoolean inProgress = new AtomicBoolean(false);
    private final AtomicLong runCount = new AtomicLong();
    private final AtomicReference<Instant> lastRunAt = new AtomicReference<>();
    private final AtomicLong lastDurationMs = new AtomicLong();
    private final AtomicReference<String> lastError = new AtomicReference<>();

    @Scheduled(fixedDelayString = "${app.review.learning.recompute-interval-ms:300000}",
            initialDelayString = "${app.review.learning.recompute-interval-ms:300000}")
    public void scheduledRun() {
        run();
    }

    /**
     * @return true when this call performed the recomputation
     */
    public boolean run() {
        if (!inProgress.compareAndSet(false, true)) {
            log.debug("Metrics recompute already running, skipping");
            return false;
        }
        Instant start = clock.instant();
        try {
            learningLoop.recomputeMetrics();
            lastError.set(null);
            return true;
        } catch (RuntimeException e) {
            log.error("❌ Learning metrics recompute failed", e);
            lastError.set(e.getClass().getSimpleName() + ": " + e.getMessage());
            return false;
        } finally {
            lastRunAt.set(start);
            lastDurationMs.set(Math.max(0, clock.millis() - start.toEpochMilli()));
            runCount.incrementAndGet();
            inProgress.set(false);
        }
    }

    public JobState state() {
        return JobState.builder()
                .name(NAME)
                .inProgress(inProgress.get())
                .lastRunAt(lastRunAt.get())
                .lastDurationMs(lastDurationMs.get())
                .runCount(runCount.get())
                .lastError(lastError.get())
                .build();
    }
}
