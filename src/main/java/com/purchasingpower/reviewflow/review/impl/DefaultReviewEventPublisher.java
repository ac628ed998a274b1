package com.purchasingpower.reviewflow.review.impl;

import com.purchasingpower.reviewflow.model.dto.ReviewEvent;
import com.purchasingpower.reviewflow.review.ReviewEventPublisher;
import com.purchasingpower.reviewflow.service.ReviewEventLog;
import com.purchasingpower.reviewflow.service.ReviewStreamService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Appends to the event log, then pushes to any connected SSE client.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultReviewEventPublisher implements ReviewEventPublisher {

    private final ReviewEventLog eventLog;
    private final ReviewStreamService streamService;

    @Override
    public ReviewEvent publish(ReviewEvent event) {
        ReviewEvent recorded = eventLog.append(event);
        log.debug("📣 Review {} #{} {} {}", recorded.getReviewId(), recorded.getSequence(),
                recorded.getType(), recorded.getStatus());
        streamService.sendUpdate(recorded.getReviewId(), recorded);
        return recorded;
    }
}
