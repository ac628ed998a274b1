package com.purchasingpower.reviewflow.review;

import com.google.common.base.Preconditions;
import com.purchasingpower.reviewflow.config.ReviewEngineProperties;
import com.purchasingpower.reviewflow.exception.AnalysisFailedException;
import com.purchasingpower.reviewflow.exception.ReviewFailureCause;
import com.purchasingpower.reviewflow.exception.ReviewInProgressException;
import com.purchasingpower.reviewflow.exception.ReviewNotFoundException;
import com.purchasingpower.reviewflow.model.finding.Suggestion;
import com.purchasingpower.reviewflow.model.review.Review;
import com.purchasingpower.reviewflow.model.review.ReviewRequest;
import com.purchasingpower.reviewflow.orchestration.CostBudget;
import com.purchasingpower.reviewflow.parser.UnifiedDiffParser;
import com.purchasingpower.reviewflow.storage.ReviewPersistence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the lifecycle of every review.
 *
 * <pre>
 * submit / regenerate → PENDING → RETRIEVING → ANALYZING → AGGREGATING → COMPLETED
 *                          └──── cancel / deadline / failure ──────────→ FAILED
 * </pre>
 *
 * At most one generation of a review id is active at a time. A request for an id whose
 * current generation is not terminal is rejected with {@link ReviewInProgressException}.
 * Terminal snapshots are written to {@link ReviewPersistence}.
 */
@Slf4j
@Service
public class ReviewStateMachine {

    private final ReviewPipeline pipeline;
    private final ReviewEventPublisher publisher;
    private final ReviewPersistence persistence;
    private final UnifiedDiffParser diffParser;
    private final ReviewEngineProperties properties;
    private final AsyncTaskExecutor reviewExecutor;
    private final TaskScheduler reviewScheduler;
    private final Clock clock;

    private final Map<String, ReviewSession> sessions = new ConcurrentHashMap<>();

    public ReviewStateMachine(ReviewPipeline pipeline,
                              ReviewEventPublisher publisher,
                              ReviewPersistence persistence,
                              UnifiedDiffParser diffParser,
                              ReviewEngineProperties properties,
                              @Qualifier("reviewExecutor") AsyncTaskExecutor reviewExecutor,
                              @Qualifier("reviewScheduler") TaskScheduler reviewScheduler,
                              Clock clock) {
        this.pipeline = pipeline;
        this.publisher = publisher;
        this.persistence = persistence;
        this.diffParser = diffParser;
        this.properties = properties;
        this.reviewExecutor = reviewExecutor;
        this.reviewScheduler = reviewScheduler;
        this.clock = clock;
    }

    /**
     * Starts analysis of a diff. Returns immediately with the PENDING snapshot.
     *
     * @throws ReviewInProgressException when the id is already being analyzed
     */
    public Review submit(ReviewRequest request) {
        Preconditions.checkNotNull(request, "request");
        Preconditions.checkArgument(request.getDiff() != null && !request.getDiff().isBlank(),
                "diff must not be blank");

        String reviewId = request.getReviewId() == null || request.getReviewId().isBlank()
                ? UUID.randomUUID().toString()
                : request.getReviewId();
        List<String> filePaths = request.getFilePaths() == null || request.getFilePaths().isEmpty()
                ? diffParser.parse(request.getDiff()).filePaths()
                : List.copyOf(request.getFilePaths());
        ReviewRequest normalized = request.toBuilder().reviewId(reviewId).filePaths(filePaths).build();

        ReviewSession session = sessions.compute(reviewId, (id, existing) -> {
            rejectIfActive(id, existing);
            int generation = existing != null
                    ? existing.getGeneration() + 1
                    : persistence.findReview(id).map(r -> r.getGeneration() + 1).orElse(1);
            return newSession(normalized, generation);
        });

        log.info("📥 Review {} submitted (gen {}, {} files)", reviewId, session.getGeneration(), filePaths.size());
        return start(session);
    }

    /**
     * Re-runs the analysis of a finished review from PENDING under the same id.
     * Previous suggestions are dropped from the review; feedback on them is kept.
     *
     * @throws ReviewNotFoundException when the id is unknown
     * @throws ReviewInProgressException when the current generation is still running
     */
    public Review regenerate(String reviewId) {
        ReviewSession session = sessions.compute(reviewId, (id, existing) -> {
            rejectIfActive(id, existing);
            if (existing != null) {
                return newSession(existing.getRequest(), existing.getGeneration() + 1);
            }
            Review stored = persistence.findReview(id).orElseThrow(() -> new ReviewNotFoundException(id));
            ReviewRequest request = ReviewRequest.builder()
                    .reviewId(id)
                    .repositoryRef(stored.getRepositoryRef())
                    .diff(stored.getDiff())
                    .filePaths(stored.getChangedFiles())
                    .build();
            return newSession(request, stored.getGeneration() + 1);
        });

        log.info("🔁 Review {} regenerating (gen {})", reviewId, session.getGeneration());
        return start(session);
    }

    /**
     * Abandons in-flight work and fails the review with CANCELLED.
     * A review that is already terminal is returned unchanged.
     */
    public Review cancel(String reviewId) {
        ReviewSession session = sessions.get(reviewId);
        if (session == null) {
            return persistence.findReview(reviewId).orElseThrow(() -> new ReviewNotFoundException(reviewId));
        }
        if (session.fail(ReviewFailureCause.CANCELLED, "Review cancelled")) {
            log.info("⏹️ Review {} cancelled", reviewId);
            session.releaseTimers(true);
            finish(session);
        }
        return session.snapshot();
    }

    public Optional<Review> find(String reviewId) {
        ReviewSession session = sessions.get(reviewId);
        if (session != null) {
            return Optional.of(session.snapshot());
        }
        return persistence.findReview(reviewId);
    }

    /**
     * Blocks until the current generation is terminal or the timeout elapses.
     *
     * @return the latest snapshot, terminal unless the wait timed out
     */
    public Review awaitCompletion(String reviewId, Duration timeout) throws InterruptedException {
        ReviewSession session = sessions.get(reviewId);
        if (session == null) {
            return persistence.findReview(reviewId).orElseThrow(() -> new ReviewNotFoundException(reviewId));
        }
        session.awaitDone(timeout);
        return session.snapshot();
    }

    private void rejectIfActive(String reviewId, ReviewSession existing) {
        if (existing != null && !existing.isTerminal()) {
            throw new ReviewInProgressException(reviewId, existing.getStatus().name());
        }
    }

    private ReviewSession newSession(ReviewRequest request, int generation) {
        CostBudget budget = new CostBudget(request.getReviewId(),
                properties.getBudget().getMaxCostPerReview(),
                properties.getBudget().getMaxProviderAttempts());
        ReviewSession session = new ReviewSession(request, generation, budget, publisher, clock);
        session.open();
        return session;
    }

    private Review start(ReviewSession session) {
        Review accepted = session.snapshot();
        try {
            ScheduledFuture<?> deadline = reviewScheduler.schedule(
                    () -> onDeadline(session), clock.instant().plus(properties.getDeadline()));
            Future<?> running = reviewExecutor.submit(() -> run(session));
            session.attach(running, deadline);
        } catch (TaskRejectedException e) {
            log.error("❌ Review {} could not be scheduled", session.getReviewId(), e);
            if (session.fail(ReviewFailureCause.INTERNAL_ERROR, "Review could not be scheduled: " + e.getMessage())) {
                session.releaseTimers(false);
                finish(session);
            }
            return session.snapshot();
        }
        return accepted;
    }

    private void run(ReviewSession session) {
        String reviewId = session.getReviewId();
        try {
            Optional<List<Suggestion>> result = pipeline.execute(session);
            if (result.isPresent() && session.complete(result.get())) {
                log.info("✅ Review {} completed with {} suggestions", reviewId, result.get().size());
                session.releaseTimers(false);
                finish(session);
            }
        } catch (AnalysisFailedException e) {
            if (session.fail(ReviewFailureCause.ANALYSIS_FAILED, e.getMessage())) {
                session.releaseTimers(false);
                finish(session);
            }
        } catch (RuntimeException e) {
            log.error("❌ Review {} failed unexpectedly", reviewId, e);
            if (session.fail(ReviewFailureCause.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage())) {
                session.releaseTimers(false);
                finish(session);
            }
        }
    }

    private void onDeadline(ReviewSession session) {
        if (session.fail(ReviewFailureCause.TIMEOUT, "Review exceeded its deadline of " + properties.getDeadline())) {
            log.warn("⏱️ Review {} timed out after {}", session.getReviewId(), properties.getDeadline());
            session.releaseTimers(true);
            finish(session);
        }
    }

    private void finish(ReviewSession session) {
        try {
            persistence.saveReview(session.snapshot());
        } catch (RuntimeException e) {
            log.error("❌ Failed to persist review {} (gen {})", session.getReviewId(), session.getGeneration(), e);
        } finally {
            session.markDone();
        }
    }
}
