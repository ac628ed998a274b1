package com.purchasingpower.reviewflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.reviewflow.model.dto.ReviewEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server-Sent Event streams of review events.
 *
 * Usage:
 * 1. Client calls GET /api/v1/reviews/{reviewId}/stream
 * 2. ReviewStreamService registers an SseEmitter and replays the latest generation from the event log
 * 3. The state machine publishes further events through sendUpdate()
 * 4. The stream completes after the terminal event
 *
 * Each emitter remembers the last sequence number it sent, so an event that races
 * the replay is delivered once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewStreamService {

    private static final String EVENT_NAME = "review-update";

    /**
     * Timeout for SSE connections (5 minutes).
     */
    private static final long SSE_TIMEOUT_MS = 5 * 60 * 1000;

    private final ObjectMapper objectMapper;
    private final ReviewEventLog eventLog;

    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();

    public SseEmitter createStream(String reviewId) {
        log.info("📡 Creating SSE stream for review: {}", reviewId);

        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        Subscriber subscriber = new Subscriber(emitter);

        emitter.onCompletion(() -> {
            log.info("✅ SSE stream completed for review: {}", reviewId);
            remove(reviewId, subscriber);
        });
        emitter.onTimeout(() -> {
            log.warn("⏱️ SSE stream timed out for review: {}", reviewId);
            remove(reviewId, subscriber);
        });
        emitter.onError(error -> {
            log.error("❌ SSE stream error for review: {}", reviewId, error);
            remove(reviewId, subscriber);
        });

        // live sends wait until the replay is done
        synchronized (subscriber) {
            Subscriber previous = subscribers.put(reviewId, subscriber);
            if (previous != null) {
                previous.emitter.complete();
            }

            for (ReviewEvent event : latestGeneration(eventLog.events(reviewId))) {
                if (!subscriber.send(event)) {
                    remove(reviewId, subscriber);
                    break;
                }
            }
        }
        return emitter;
    }

    public void sendUpdate(String reviewId, ReviewEvent event) {
        Subscriber subscriber = subscribers.get(reviewId);
        if (subscriber == null) {
            // replayed from the event log when a client connects
            return;
        }
        if (!subscriber.send(event)) {
            remove(reviewId, subscriber);
        }
    }

    public boolean hasActiveStream(String reviewId) {
        return subscribers.containsKey(reviewId);
    }

    public int getActiveStreamCount() {
        return subscribers.size();
    }

    private static List<ReviewEvent> latestGeneration(List<ReviewEvent> events) {
        if (events.isEmpty()) {
            return events;
        }
        int generation = events.get(events.size() - 1).getGeneration();
        return events.stream().filter(e -> e.getGeneration() == generation).toList();
    }

    private void remove(String reviewId, Subscriber subscriber) {
        if (subscribers.remove(reviewId, subscriber)) {
            log.debug("🗑️ Removed SSE emitter for review: {}", reviewId);
        }
    }

    private final class Subscriber {

        private final SseEmitter emitter;
        private long lastSequence;
        private boolean closed;

        Subscriber(SseEmitter emitter) {
            this.emitter = emitter;
        }

        synchronized boolean send(ReviewEvent event) {
            if (closed) {
                return false;
            }
            if (event.getSequence() <= lastSequence) {
                return true;
            }
            try {
                emitter.send(SseEmitter.event()
                        .id(String.valueOf(event.getSequence()))
                        .name(EVENT_NAME)
                        .data(objectMapper.writeValueAsString(event)));
                lastSequence = event.getSequence();

                log.debug("📤 Sent SSE update: reviewId={}, seq={}, status={}",
                        event.getReviewId(), event.getSequence(), event.getStatus());

                if (event.isTerminal()) {
                    closed = true;
                    emitter.complete();
                    return false;
                }
                return true;
            } catch (IOException e) {
                log.error("Failed to send SSE update for review: {}", event.getReviewId(), e);
                closed = true;
                emitter.completeWithError(e);
                return false;
            }
        }
    }
}
