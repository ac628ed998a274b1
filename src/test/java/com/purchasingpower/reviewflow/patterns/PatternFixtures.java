package com.purchasingpower.reviewflow.patterns;

import com.purchasingpower.reviewflow.model.finding.Severity;
import com.purchasingpower.reviewflow.model.pattern.PatternDefinition;
import com.purchasingpower.reviewflow.model.pattern.PatternScope;

import java.util.List;

public final class PatternFixtures {

    private PatternFixtures() {
    }

    public static PatternDefinition.PatternDefinitionBuilder pattern(String id, String category, String regex, double weight) {
        return PatternDefinition.builder()
                .id(id)
                .name(id)
                .category(category)
                .severity(Severity.MEDIUM)
                .regex(regex)
                .scope(PatternScope.LINE)
                .fileGlobs(List.of())
                .caseInsensitive(true)
                .baseWeight(weight)
                .message(id + " detected")
                .fix("fix " + id);
    }

    public static PatternDefinition hardcodedPassword() {
        return pattern("hardcoded-password", "security", "password\\s*=\\s*['\"][^'\"]+['\"]", 0.9)
                .severity(Severity.HIGH)
                .message("Hardcoded password detected")
                .build();
    }

    public static PatternDefinition magicNumber() {
        return pattern("magic-number", "maintainability", "\\b\\d{3,}\\b", 0.5)
                .severity(Severity.LOW)
                .build();
    }
}
