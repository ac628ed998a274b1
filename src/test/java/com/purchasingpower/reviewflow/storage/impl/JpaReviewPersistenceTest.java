package com.purchasingpower.reviewflow.storage.impl;

import com.purchasingpower.reviewflow.exception.ReviewFailureCause;
import com.purchasingpower.reviewflow.model.feedback.Feedback;
import com.purchasingpower.reviewflow.model.finding.FileLocation;
import com.purchasingpower.reviewflow.model.finding.FindingOrigin;
import com.purchasingpower.reviewflow.model.finding.Provenance;
import com.purchasingpower.reviewflow.model.finding.Severity;
import com.purchasingpower.reviewflow.model.finding.Suggestion;
import com.purchasingpower.reviewflow.model.review.Review;
import com.purchasingpower.reviewflow.model.review.ReviewStatus;
import com.purchasingpower.reviewflow.support.TestDiffs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaReviewPersistence.class)
@ActiveProfiles("test")
@DisplayName("JPA review persistence")
class JpaReviewPersistenceTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private JpaReviewPersistence persistence;

    @Test
    @DisplayName("Should store a completed review with ranked suggestions and provenance")
    void saveReview_roundTripsSuggestions() {
        // Given
        Review review = completed("rev-1", 1, List.of(
                suggestion("sug-a", "rev-1", 0.95, List.of("hardcoded-password"), List.of("ollama-deep")),
                suggestion("sug-b", "rev-1", 0.5, List.of("magic-number"), List.of())));

        // When
        persistence.saveReview(review);
        Optional<Review> loaded = persistence.findReview("rev-1");

        // Then
        assertThat(loaded).isPresent();
        assertThat(loaded.get().getStatus()).isEqualTo(ReviewStatus.COMPLETED);
        assertThat(loaded.get().getChangedFiles()).containsExactly(TestDiffs.CREDENTIAL_PATH);
        assertThat(loaded.get().getDiff()).isEqualTo(TestDiffs.CREDENTIAL);
        assertThat(loaded.get().getSuggestions()).extracting(Suggestion::getId).containsExactly("sug-a", "sug-b");

        Suggestion top = loaded.get().getSuggestions().get(0);
        assertThat(top.getProvenance().getPatternIds()).containsExactly("hardcoded-password");
        assertThat(top.getProvenance().getModelIds()).containsExactly("ollama-deep");
        assertThat(top.getProvenance().getOrigins()).containsExactlyInAnyOrder(FindingOrigin.RULE, FindingOrigin.MODEL);
        assertThat(top.getLocation()).isEqualTo(new FileLocation(TestDiffs.CREDENTIAL_PATH, 12));
    }

    @Test
    @DisplayName("Should replace the review snapshot on a new generation but keep old suggestions findable")
    void saveReview_newGeneration_keepsOrphanedSuggestions() {
        // Given
        persistence.saveReview(completed("rev-2", 1, List.of(
                suggestion("sug-old", "rev-2", 0.8, List.of("todo-marker"), List.of()))));

        // When
        persistence.saveReview(failed("rev-2", 2));

        // Then
        Review latest = persistence.findReview("rev-2").orElseThrow();
        assertThat(latest.getGeneration()).isEqualTo(2);
        assertThat(latest.getStatus()).isEqualTo(ReviewStatus.FAILED);
        assertThat(latest.getFailureCause()).isEqualTo(ReviewFailureCause.TIMEOUT);
        assertThat(latest.getSuggestions()).isEmpty();
        assertThat(persistence.findSuggestion("sug-old")).isPresent();
    }

    @Test
    @DisplayName("Should keep feedback history in arrival order")
    void feedback_history() {
        // Given
        persistence.saveFeedback(feedback("fb-2", CREATED.plusSeconds(5)));
        persistence.saveFeedback(feedback("fb-1", CREATED));

        // When
        List<Feedback> history = persistence.loadFeedbackHistory();

        // Then
        assertThat(history).extracting(Feedback::getId).containsExactly("fb-1", "fb-2");
        assertThat(persistence.feedbackExists("fb-1")).isTrue();
        assertThat(persistence.feedbackExists("fb-9")).isFalse();
    }

    private static Review completed(String id, int generation, List<Suggestion> suggestions) {
        return Review.builder()
                .id(id)
                .repositoryRef("acme/billing")
                .diff(TestDiffs.CREDENTIAL)
                .changedFiles(List.of(TestDiffs.CREDENTIAL_PATH))
                .status(ReviewStatus.COMPLETED)
                .generation(generation)
                .createdAt(CREATED)
                .completedAt(CREATED.plusSeconds(2))
                .processingMillis(2000)
                .suggestions(suggestions)
                .build();
    }

    private static Review failed(String id, int generation) {
        return completed(id, generation, List.of()).toBuilder()
                .status(ReviewStatus.FAILED)
                .failureCause(ReviewFailureCause.TIMEOUT)
                .failureMessage("Review exceeded its deadline")
                .build();
    }

    private static Suggestion suggestion(String id, String reviewId, double confidence,
                                         List<String> patternIds, List<String> modelIds) {
        EnumSet<FindingOrigin> origins = EnumSet.noneOf(FindingOrigin.class);
        if (!patternIds.isEmpty()) {
            origins.add(FindingOrigin.RULE);
        }
        if (!modelIds.isEmpty()) {
            origins.add(FindingOrigin.MODEL);
        }
        return Suggestion.builder()
                .id(id)
                .reviewId(reviewId)
                .category("security")
                .severity(Severity.HIGH)
                .location(new FileLocation(TestDiffs.CREDENTIAL_PATH, 12))
                .message("Hardcoded password detected")
                .fix("Load it from a secret store")
                .confidence(confidence)
                .provenance(Provenance.builder()
                        .findingIds(List.of(id + "-finding"))
                        .patternIds(patternIds)
                        .modelIds(modelIds)
                        .origins(origins)
                        .build())
                .build();
    }

    private static Feedback feedback(String id, Instant createdAt) {
        return Feedback.builder()
                .id(id)
                .suggestionId("sug-a")
                .helpful(true)
                .createdAt(createdAt)
                .build();
    }
}
