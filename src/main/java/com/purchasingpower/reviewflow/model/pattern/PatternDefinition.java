package com.purchasingpower.reviewflow.model.pattern;

import com.purchasingpower.reviewflow.model.finding.Severity;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A named detection rule as declared in configuration.
 *
 * The learned factor lives in PatternWeightTable and the active flag in PatternRegistry;
 * this type never changes after startup.
 */
@Value
@Builder
public class PatternDefinition {
    String id;
    String name;
    String category;
    Severity severity;
    String regex;
    PatternScope scope;
    List<String> fileGlobs;
    boolean caseInsensitive;
    double baseWeight;
    String message;
    String fix;
}
