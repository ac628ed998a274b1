package com.purchasingpower.reviewflow.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Terminal snapshot of a review. One row per review id, overwritten by each generation.
 *
 * Table: REVIEWS
 */
@Entity
@Table(name = "REVIEWS", indexes = {
        @Index(name = "idx_review_review_id", columnList = "review_id", unique = true),
        @Index(name = "idx_review_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "review_seq")
    @SequenceGenerator(name = "review_seq", sequenceName = "review_seq", allocationSize = 1)
    private Long id;

    @Column(name = "review_id", nullable = false, unique = true, length = 100)
    private String reviewId;

    @Column(name = "repository_ref", length = 500)
    private String repositoryRef;

    @Lob
    @Column(name = "diff")
    private String diff;

    /**
     * Comma-separated changed file paths.
     */
    @Column(name = "changed_files", length = 4000)
    private String changedFiles;

    /**
     * Values: COMPLETED, FAILED
     */
    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "generation", nullable = false)
    private int generation;

    @Column(name = "failure_cause", length = 30)
    private String failureCause;

    @Column(name = "failure_message", length = 4000)
    private String failureMessage;

    @Column(name = "processing_ms")
    private long processingMillis;

    @Column(name = "cost")
    private double cost;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
