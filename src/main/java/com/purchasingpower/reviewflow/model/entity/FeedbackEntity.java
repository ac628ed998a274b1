package com.purchasingpower.reviewflow.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only feedback history, replayed at startup to rebuild pattern weights.
 */
@Entity
@Table(name = "FEEDBACK", indexes = {
        @Index(name = "idx_feedback_feedback_id", columnList = "feedback_id", unique = true),
        @Index(name = "idx_feedback_suggestion", columnList = "suggestion_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "feedback_seq")
    @SequenceGenerator(name = "feedback_seq", sequenceName = "feedback_seq", allocationSize = 1)
    private Long id;

    @Column(name = "feedback_id", nullable = false, unique = true, length = 100)
    private String feedbackId;

    @Column(name = "suggestion_id", nullable = false, length = 100)
    private String suggestionId;

    @Column(name = "helpful", nullable = false)
    private boolean helpful;

    @Column(name = "correction", length = 4000)
    private String correction;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
