package com.purchasingpower.reviewflow.exception;

import lombok.Getter;

@Getter
public class PatternNotFoundException extends RuntimeException {

    private final String patternId;

    public PatternNotFoundException(String patternId) {
        super("Pattern not found: " + patternId);
        this.patternId = patternId;
    }
}
