package com.purchasingpower.reviewflow.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One model provider call, or one answer served from the response cache.
 * Maps to the MODEL_CALL table.
 */
@Entity
@Table(name = "MODEL_CALL", indexes = {
        @Index(name = "idx_model_call_provider_tier", columnList = "provider_id, tier"),
        @Index(name = "idx_model_call_review", columnList = "review_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelCallEntity {

    public static final String SUCCESS = "SUCCESS";
    public static final String FAILURE = "FAILURE";
    public static final String TIMEOUT = "TIMEOUT";
    public static final String CACHE_HIT = "CACHE_HIT";

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "model_call_seq")
    @SequenceGenerator(name = "model_call_seq", sequenceName = "model_call_seq", allocationSize = 1)
    private Long id;

    @Column(name = "call_id", nullable = false, unique = true, length = 100)
    private String callId;

    @Column(name = "review_id", length = 100)
    private String reviewId;

    @Column(name = "provider_id", nullable = false, length = 50)
    private String providerId;

    @Column(name = "tier", nullable = false, length = 20)
    private String tier;

    /** SUCCESS, FAILURE, TIMEOUT or CACHE_HIT. */
    @Column(name = "outcome", nullable = false, length = 20)
    private String outcome;

    @Column(name = "latency_ms", nullable = false)
    private long latencyMs;

    @Column(name = "input_tokens", nullable = false)
    private int inputTokens;

    @Column(name = "output_tokens", nullable = false)
    private int outputTokens;

    @Column(name = "cost", nullable = false)
    private double cost;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
