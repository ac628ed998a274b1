package com.purchasingpower.reviewflow.model.pattern;

/**
 * What a pattern's regex is matched against.
 */
public enum PatternScope {
    /** Each added line on its own. */
    LINE,
    /** The added lines of a hunk joined with newlines, for multi-line constructs. */
    HUNK
}
