package com.purchasingpower.reviewflow.model.feedback;

import com.purchasingpower.reviewflow.model.finding.Suggestion;
import lombok.Value;

/**
 * Feedback joined with the suggestion it judges. The suggestion is null when it could not be resolved.
 */
@Value
public class FeedbackRecord {
    Feedback feedback;
    Suggestion suggestion;

    public boolean isResolved() {
        return suggestion != null;
    }

    /**
     * Explicit feedback category, else the suggestion's, else "unknown".
     */
    public String category() {
        if (feedback.getCategory() != null && !feedback.getCategory().isBlank()) {
            return feedback.getCategory();
        }
        return suggestion != null ? suggestion.getCategory() : "unknown";
    }
}
