package com.purchasingpower.reviewflow.model.llm;

/**
 * Cost/quality level of a model call.
 */
public enum ModelTier {
    /** Cheap screening call that decides whether deep analysis is worth paying for. */
    TRIAGE,
    /** Expensive call that produces detailed findings. */
    DEEP
}
