package com.purchasingpower.reviewflow.storage.impl;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.purchasingpower.reviewflow.exception.ReviewFailureCause;
import com.purchasingpower.reviewflow.model.entity.FeedbackEntity;
import com.purchasingpower.reviewflow.model.entity.ReviewEntity;
import com.purchasingpower.reviewflow.model.entity.SuggestionEntity;
import com.purchasingpower.reviewflow.model.feedback.Feedback;
import com.purchasingpower.reviewflow.model.finding.FileLocation;
import com.purchasingpower.reviewflow.model.finding.FindingOrigin;
import com.purchasingpower.reviewflow.model.finding.Provenance;
import com.purchasingpower.reviewflow.model.finding.Severity;
import com.purchasingpower.reviewflow.model.finding.Suggestion;
import com.purchasingpower.reviewflow.model.review.Review;
import com.purchasingpower.reviewflow.model.review.ReviewStatus;
import com.purchasingpower.reviewflow.repository.FeedbackRepository;
import com.purchasingpower.reviewflow.repository.ReviewRepository;
import com.purchasingpower.reviewflow.repository.SuggestionRepository;
import com.purchasingpower.reviewflow.storage.ReviewPersistence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Spring Data JPA implementation. List-valued fields are stored comma-joined.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaReviewPersistence implements ReviewPersistence {

    private static final Joiner JOINER = Joiner.on(',').skipNulls();
    private static final Splitter SPLITTER = Splitter.on(',').omitEmptyStrings().trimResults();

    private final ReviewRepository reviewRepository;
    private final SuggestionRepository suggestionRepository;
    private final FeedbackRepository feedbackRepository;

    @Override
    @Transactional
    public void saveReview(Review review) {
        ReviewEntity entity = reviewRepository.findByReviewId(review.getId())
                .orElseGet(() -> ReviewEntity.builder().reviewId(review.getId()).build());

        entity.setRepositoryRef(review.getRepositoryRef());
        entity.setDiff(review.getDiff());
        entity.setChangedFiles(JOINER.join(nullToEmpty(review.getChangedFiles())));
        entity.setStatus(review.getStatus().name());
        entity.setGeneration(review.getGeneration());
        entity.setFailureCause(review.getFailureCause() != null ? review.getFailureCause().name() : null);
        entity.setFailureMessage(truncate(review.getFailureMessage(), 4000));
        entity.setProcessingMillis(review.getProcessingMillis());
        entity.setCost(review.getCost());
        entity.setCreatedAt(review.getCreatedAt());
        entity.setCompletedAt(review.getCompletedAt());
        reviewRepository.save(entity);

        List<Suggestion> suggestions = nullToEmpty(review.getSuggestions());
        for (int i = 0; i < suggestions.size(); i++) {
            Suggestion s = suggestions.get(i);
            SuggestionEntity row = suggestionRepository.findBySuggestionId(s.getId())
                    .orElseGet(SuggestionEntity::new);
            copyInto(row, s, review.getGeneration(), i);
            suggestionRepository.save(row);
        }

        log.debug("💾 Saved review {} gen {} ({}, {} suggestions)",
                review.getId(), review.getGeneration(), review.getStatus(), suggestions.size());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Review> findReview(String reviewId) {
        return reviewRepository.findByReviewId(reviewId).map(entity -> {
            List<Suggestion> suggestions = suggestionRepository
                    .findByReviewIdAndGenerationOrderByRankPositionAsc(reviewId, entity.getGeneration())
                    .stream()
                    .map(this::toSuggestion)
                    .toList();

            return Review.builder()
                    .id(entity.getReviewId())
                    .repositoryRef(entity.getRepositoryRef())
                    .diff(entity.getDiff())
                    .changedFiles(SPLITTER.splitToList(nullToEmpty(entity.getChangedFiles())))
                    .status(ReviewStatus.valueOf(entity.getStatus()))
                    .generation(entity.getGeneration())
                    .failureCause(entity.getFailureCause() != null ? ReviewFailureCause.valueOf(entity.getFailureCause()) : null)
                    .failureMessage(entity.getFailureMessage())
                    .processingMillis(entity.getProcessingMillis())
                    .cost(entity.getCost())
                    .createdAt(entity.getCreatedAt())
                    .completedAt(entity.getCompletedAt())
                    .suggestions(suggestions)
                    .build();
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Suggestion> findSuggestion(String suggestionId) {
        return suggestionRepository.findBySuggestionId(suggestionId).map(this::toSuggestion);
    }

    @Override
    @Transactional
    public void saveFeedback(Feedback feedback) {
        feedbackRepository.save(FeedbackEntity.builder()
                .feedbackId(feedback.getId())
                .suggestionId(feedback.getSuggestionId())
                .helpful(feedback.isHelpful())
                .correction(truncate(feedback.getCorrection(), 4000))
                .category(feedback.getCategory())
                .createdAt(feedback.getCreatedAt())
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public boolean feedbackExists(String feedbackId) {
        return feedbackRepository.existsByFeedbackId(feedbackId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Feedback> loadFeedbackHistory() {
        return feedbackRepository.findAllByOrderByCreatedAtAscIdAsc().stream()
                .map(e -> Feedback.builder()
                        .id(e.getFeedbackId())
                        .suggestionId(e.getSuggestionId())
                        .helpful(e.isHelpful())
                        .correction(e.getCorrection())
                        .category(e.getCategory())
                        .createdAt(e.getCreatedAt())
                        .build())
                .toList();
    }

    private void copyInto(SuggestionEntity row, Suggestion s, int generation, int rank) {
        Provenance p = s.getProvenance() != null ? s.getProvenance() : Provenance.empty();
        row.setSuggestionId(s.getId());
        row.setReviewId(s.getReviewId());
        row.setGeneration(generation);
        row.setRankPosition(rank);
        row.setCategory(s.getCategory());
        row.setSeverity(s.getSeverity().name());
        row.setFilePath(s.getLocation().getFilePath());
        row.setLineNumber(s.getLocation().getLine());
        row.setMessage(truncate(s.getMessage(), 4000));
        row.setFix(truncate(s.getFix(), 4000));
        row.setConfidence(s.getConfidence());
        row.setFindingIds(truncate(JOINER.join(p.getFindingIds()), 4000));
        row.setPatternIds(JOINER.join(p.getPatternIds()));
        row.setModelIds(JOINER.join(p.getModelIds()));
        row.setOrigins(JOINER.join(p.getOrigins()));
    }

    private Suggestion toSuggestion(SuggestionEntity row) {
        Set<FindingOrigin> origins = SPLITTER.splitToStream(nullToEmpty(row.getOrigins()))
                .map(FindingOrigin::valueOf)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(FindingOrigin.class)));

        return Suggestion.builder()
                .id(row.getSuggestionId())
                .reviewId(row.getReviewId())
                .category(row.getCategory())
                .severity(Severity.valueOf(row.getSeverity()))
                .location(new FileLocation(row.getFilePath(), row.getLineNumber()))
                .message(row.getMessage())
                .fix(row.getFix())
                .confidence(row.getConfidence())
                .provenance(Provenance.builder()
                        .findingIds(SPLITTER.splitToList(nullToEmpty(row.getFindingIds())))
                        .patternIds(SPLITTER.splitToList(nullToEmpty(row.getPatternIds())))
                        .modelIds(SPLITTER.splitToList(nullToEmpty(row.getModelIds())))
                        .origins(origins)
                        .build())
                .build();
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
