package com.purchasingpower.reviewflow.repository;

import com.purchasingpower.reviewflow.model.entity.FeedbackEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FeedbackRepository extends JpaRepository<FeedbackEntity, Long> {

    boolean existsByFeedbackId(String feedbackId);

    /**
     * Full history in arrival order, for replay.
     */
    List<FeedbackEntity> findAllByOrderByCreatedAtAscIdAsc();
}
