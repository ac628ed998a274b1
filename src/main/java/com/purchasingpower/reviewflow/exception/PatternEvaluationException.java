package com.purchasingpower.reviewflow.exception;

import lombok.Getter;

@Getter
public class PatternEvaluationException extends RuntimeException {

    private final String patternId;

    public PatternEvaluationException(String patternId, String message, Throwable cause) {
        super("Pattern " + patternId + ": " + message, cause);
        this.patternId = patternId;
    }
}
