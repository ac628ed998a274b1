package com.purchasingpower.reviewflow.configuration;

import com.purchasingpower.reviewflow.config.ReviewEngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools of the review engine.
 *
 * <ul>
 *   <li>reviewExecutor - one task per review pipeline</li>
 *   <li>analysisExecutor - rule engine and model orchestrator running side by side</li>
 *   <li>providerExecutor - blocking provider and index calls, so timeouts can be enforced</li>
 *   <li>learningExecutor - single thread, feedback applied in arrival order</li>
 *   <li>reviewScheduler - review deadlines</li>
 * </ul>
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final ReviewEngineProperties properties;

    @Bean(name = "reviewExecutor")
    public ThreadPoolTaskExecutor reviewExecutor() {
        ReviewEngineProperties.Concurrency c = properties.getConcurrency();
        return buildExecutor("review-", c.getReviewThreads(), c.getReviewThreads() * 2, c.getQueueCapacity());
    }

    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        ReviewEngineProperties.Concurrency c = properties.getConcurrency();
        return buildExecutor("analysis-", c.getAnalysisThreads(), c.getAnalysisThreads() * 2, c.getQueueCapacity());
    }

    @Bean(name = "providerExecutor")
    public ThreadPoolTaskExecutor providerExecutor() {
        ReviewEngineProperties.Concurrency c = properties.getConcurrency();
        return buildExecutor("provider-", c.getProviderThreads(), c.getProviderThreads() * 2, c.getQueueCapacity());
    }

    @Bean(name = "learningExecutor")
    public ThreadPoolTaskExecutor learningExecutor() {
        return buildExecutor("learning-", 1, 1, Integer.MAX_VALUE);
    }

    @Bean(name = "reviewScheduler")
    public ThreadPoolTaskScheduler reviewScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("review-deadline-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    private ThreadPoolTaskExecutor buildExecutor(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("✅ Executor {} configured: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }
}
