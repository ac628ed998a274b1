package com.purchasingpower.reviewflow.review;

import com.purchasingpower.reviewflow.model.dto.ReviewEvent;

/**
 * Receives the ordered progress and complete events of each review.
 */
public interface ReviewEventPublisher {

    /**
     * @return the event as recorded, with its sequence number assigned
     */
    ReviewEvent publish(ReviewEvent event);
}
