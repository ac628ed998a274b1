package com.purchasingpower.reviewflow.support;

import com.purchasingpower.reviewflow.model.feedback.Feedback;
import com.purchasingpower.reviewflow.model.finding.Suggestion;
import com.purchasingpower.reviewflow.model.review.Review;
import com.purchasingpower.reviewflow.storage.ReviewPersistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryReviewPersistence implements ReviewPersistence {

    private final Map<String, Review> reviews = new ConcurrentHashMap<>();
    private final Map<String, Suggestion> suggestions = new ConcurrentHashMap<>();
    private final List<Feedback> feedback = new CopyOnWriteArrayList<>();
    private final List<Review> saved = new CopyOnWriteArrayList<>();

    @Override
    public void saveReview(Review review) {
        reviews.put(review.getId(), review);
        saved.add(review);
        review.getSuggestions().forEach(s -> suggestions.put(s.getId(), s));
    }

    @Override
    public Optional<Review> findReview(String reviewId) {
        return Optional.ofNullable(reviews.get(reviewId));
    }

    @Override
    public Optional<Suggestion> findSuggestion(String suggestionId) {
        return Optional.ofNullable(suggestions.get(suggestionId));
    }

    @Override
    public void saveFeedback(Feedback item) {
        feedback.add(item);
    }

    @Override
    public boolean feedbackExists(String feedbackId) {
        return feedback.stream().anyMatch(f -> f.getId().equals(feedbackId));
    }

    @Override
    public List<Feedback> loadFeedbackHistory() {
        return new ArrayList<>(feedback);
    }

    public void putSuggestion(Suggestion suggestion) {
        suggestions.put(suggestion.getId(), suggestion);
    }

    /**
     * Every terminal snapshot written, in order.
     */
    public List<Review> savedSnapshots() {
        return List.copyOf(saved);
    }
}
