package com.purchasingpower.reviewflow.storage;

import com.purchasingpower.reviewflow.model.feedback.Feedback;
import com.purchasingpower.reviewflow.model.finding.Suggestion;
import com.purchasingpower.reviewflow.model.review.Review;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for terminal review snapshots, their suggestions, and feedback history.
 */
public interface ReviewPersistence {

    /**
     * Stores a terminal review snapshot, replacing the previous generation's snapshot.
     * Suggestions of earlier generations stay retrievable by id.
     */
    void saveReview(Review review);

    Optional<Review> findReview(String reviewId);

    Optional<Suggestion> findSuggestion(String suggestionId);

    void saveFeedback(Feedback feedback);

    boolean feedbackExists(String feedbackId);

    /**
     * All feedback in arrival order.
     */
    List<Feedback> loadFeedbackHistory();
}
