package com.purchasingpower.reviewflow.model.finding;

public enum FindingOrigin {
    RULE,
    MODEL
}
