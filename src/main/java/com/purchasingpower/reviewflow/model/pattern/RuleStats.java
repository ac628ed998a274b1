package com.purchasingpower.reviewflow.model.pattern;

import lombok.Value;

@Value
public class RuleStats {
    long evaluations;
    long matches;
    long errors;
}
