package com.purchasingpower.reviewflow.repository;

import com.purchasingpower.reviewflow.model.entity.SuggestionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Suggestions of every generation, including ones orphaned by a regenerate.
 */
@Repository
public interface SuggestionRepository extends JpaRepository<SuggestionEntity, Long> {

    Optional<SuggestionEntity> findBySuggestionId(String suggestionId);

    /**
     * Ranked suggestions of one generation of a review.
     */
    List<SuggestionEntity> findByReviewIdAndGenerationOrderByRankPositionAsc(String reviewId, int generation);
}
