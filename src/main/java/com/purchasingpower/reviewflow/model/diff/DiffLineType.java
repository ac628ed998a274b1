package com.purchasingpower.reviewflow.model.diff;

public enum DiffLineType {
    ADDED,
    REMOVED,
    CONTEXT
}
