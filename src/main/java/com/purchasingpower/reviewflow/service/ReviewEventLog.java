package com.purchasingpower.reviewflow.service;

import com.purchasingpower.reviewflow.model.dto.ReviewEvent;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ordered in-memory event log per review id.
 *
 * Appending assigns the next sequence number of that review, starting at 1 and spanning generations.
 */
@Service
public class ReviewEventLog {

    private final Map<String, List<ReviewEvent>> logs = new ConcurrentHashMap<>();

    public ReviewEvent append(ReviewEvent event) {
        List<ReviewEvent> log = logs.computeIfAbsent(event.getReviewId(), k -> new ArrayList<>());
        synchronized (log) {
            ReviewEvent sequenced = event.toBuilder().sequence(log.size() + 1L).build();
            log.add(sequenced);
            return sequenced;
        }
    }

    public List<ReviewEvent> events(String reviewId) {
        return eventsAfter(reviewId, 0);
    }

    /**
     * Events with a sequence number greater than {@code afterSequence}.
     */
    public List<ReviewEvent> eventsAfter(String reviewId, long afterSequence) {
        List<ReviewEvent> log = logs.get(reviewId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            int from = (int) Math.min(Math.max(afterSequence, 0), log.size());
            return List.copyOf(log.subList(from, log.size()));
        }
    }
}
