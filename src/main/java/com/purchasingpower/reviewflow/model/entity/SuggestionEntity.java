package com.purchasingpower.reviewflow.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A suggestion as attached to a review, with its provenance flattened into columns.
 *
 * Rows are never deleted on regenerate: feedback may still point at an orphaned suggestion.
 */
@Entity
@Table(name = "SUGGESTIONS", indexes = {
        @Index(name = "idx_suggestion_suggestion_id", columnList = "suggestion_id", unique = true),
        @Index(name = "idx_suggestion_review", columnList = "review_id, generation")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "suggestion_seq")
    @SequenceGenerator(name = "suggestion_seq", sequenceName = "suggestion_seq", allocationSize = 1)
    private Long id;

    @Column(name = "suggestion_id", nullable = false, unique = true, length = 100)
    private String suggestionId;

    @Column(name = "review_id", nullable = false, length = 100)
    private String reviewId;

    /**
     * Latest generation this suggestion was attached to.
     */
    @Column(name = "generation", nullable = false)
    private int generation;

    /**
     * Position within the ranked list of that generation.
     */
    @Column(name = "rank_position", nullable = false)
    private int rankPosition;

    @Column(name = "category", nullable = false, length = 100)
    private String category;

    @Column(name = "severity", nullable = false, length = 20)
    private String severity;

    @Column(name = "file_path", nullable = false, length = 1000)
    private String filePath;

    @Column(name = "line_number")
    private int lineNumber;

    @Column(name = "message", length = 4000)
    private String message;

    @Column(name = "fix", length = 4000)
    private String fix;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "finding_ids", length = 4000)
    private String findingIds;

    @Column(name = "pattern_ids", length = 2000)
    private String patternIds;

    @Column(name = "model_ids", length = 1000)
    private String modelIds;

    @Column(name = "origins", length = 100)
    private String origins;
}
