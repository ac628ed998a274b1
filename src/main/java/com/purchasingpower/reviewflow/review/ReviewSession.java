package com.purchasingpower.reviewflow.review;

import com.purchasingpower.reviewflow.exception.ReviewFailureCause;
import com.purchasingpower.reviewflow.model.dto.ReviewEvent;
import com.purchasingpower.reviewflow.model.finding.Suggestion;
import com.purchasingpower.reviewflow.model.review.Review;
import com.purchasingpower.reviewflow.model.review.ReviewRequest;
import com.purchasingpower.reviewflow.model.review.ReviewStatus;
import com.purchasingpower.reviewflow.orchestration.CostBudget;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One generation of one review.
 *
 * <p>All transitions go through this object under its monitor and publish their event before
 * releasing it, so event order matches transition order. Once terminal, nothing changes.
 */
@Slf4j
public class ReviewSession {

    @Getter
    private final ReviewRequest request;
    @Getter
    private final int generation;
    @Getter
    private final CostBudget budget;
    private final Instant createdAt;
    private final ReviewEventPublisher publisher;
    private final Clock clock;
    private final CountDownLatch done = new CountDownLatch(1);

    private volatile ReviewStatus status = ReviewStatus.PENDING;
    private List<Suggestion> suggestions = List.of();
    private ReviewFailureCause failureCause;
    private String failureMessage;
    private Instant completedAt;
    private Future<?> pipeline;
    private ScheduledFuture<?> deadline;

    public ReviewSession(ReviewRequest request, int generation, CostBudget budget,
                         ReviewEventPublisher publisher, Clock clock) {
        this.request = request;
        this.generation = generation;
        this.budget = budget;
        this.publisher = publisher;
        this.clock = clock;
        this.createdAt = clock.instant();
    }

    public String getReviewId() {
        return request.getReviewId();
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    synchronized void open() {
        publisher.publish(ReviewEvent.progress(getReviewId(), generation, ReviewStatus.PENDING,
                "📝 Review queued (generation " + generation + ")", clock.instant()));
    }

    /**
     * Moves along the happy path.
     *
     * @return false when the transition is not allowed, typically because the review
     *         was cancelled or timed out in the meantime
     */
    public synchronized boolean advance(ReviewStatus next, String message) {
        if (next.isTerminal() || !status.canTransitionTo(next)) {
            return false;
        }
        status = next;
        publisher.publish(ReviewEvent.progress(getReviewId(), generation, next, message, clock.instant()));
        return true;
    }

    public synchronized boolean complete(List<Suggestion> result) {
        if (!status.canTransitionTo(ReviewStatus.COMPLETED)) {
            return false;
        }
        status = ReviewStatus.COMPLETED;
        suggestions = List.copyOf(result);
        completedAt = clock.instant();
        publisher.publish(ReviewEvent.completed(getReviewId(), generation, suggestions, completedAt));
        return true;
    }

    public synchronized boolean fail(ReviewFailureCause cause, String message) {
        if (!status.canTransitionTo(ReviewStatus.FAILED)) {
            return false;
        }
        status = ReviewStatus.FAILED;
        failureCause = cause;
        failureMessage = message;
        completedAt = clock.instant();
        publisher.publish(ReviewEvent.failed(getReviewId(), generation, cause, message, completedAt));
        return true;
    }

    synchronized void attach(Future<?> pipeline, ScheduledFuture<?> deadline) {
        this.pipeline = pipeline;
        this.deadline = deadline;
        if (status.isTerminal()) {
            releaseTimers(false);
        }
    }

    /**
     * Cancels the deadline and, when asked, interrupts the running pipeline.
     */
    synchronized void releaseTimers(boolean interruptPipeline) {
        if (deadline != null) {
            deadline.cancel(false);
        }
        if (interruptPipeline && pipeline != null) {
            pipeline.cancel(true);
        }
    }

    void markDone() {
        done.countDown();
    }

    public boolean awaitDone(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized Review snapshot() {
        Instant end = completedAt != null ? completedAt : clock.instant();
        return Review.builder()
                .id(getReviewId())
                .repositoryRef(request.getRepositoryRef())
                .diff(request.getDiff())
                .changedFiles(request.getFilePaths() != null ? request.getFilePaths() : List.of())
                .status(status)
                .generation(generation)
                .createdAt(createdAt)
                .completedAt(completedAt)
                .processingMillis(Duration.between(createdAt, end).toMillis())
                .cost(budget.getSpent())
                .suggestions(suggestions)
                .failureCause(failureCause)
                .failureMessage(failureMessage)
                .build();
    }
}
