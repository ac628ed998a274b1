package com.purchasingpower.reviewflow.model.diff;

import lombok.Value;

/**
 * One line of a hunk with the +/- marker stripped.
 * newLineNumber is 0 for removed lines.
 */
@Value
public class DiffLine {
    DiffLineType type;
    String content;
    int newLineNumber;

    public boolean isAdded() {
        return type == DiffLineType.ADDED;
    }
}
