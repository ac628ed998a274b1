package com.purchasingpower.reviewflow.learning;

import com.purchasingpower.reviewflow.config.ReviewEngineProperties;
import com.purchasingpower.reviewflow.model.feedback.Feedback;
import com.purchasingpower.reviewflow.storage.ReviewPersistence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rebuilds pattern factors from the persisted feedback history at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedbackHistoryBootstrap implements ApplicationRunner {

    private final ReviewPersistence persistence;
    private final FeedbackLearningLoop learningLoop;
    private final ReviewEngineProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getLearning().isReplayOnStartup()) {
            log.info("Feedback replay on startup disabled");
            return;
        }
        List<Feedback> history = persistence.loadFeedbackHistory();
        if (history.isEmpty()) {
            log.info("No feedback history to replay");
            return;
        }
        learningLoop.replay(history);
    }
}
