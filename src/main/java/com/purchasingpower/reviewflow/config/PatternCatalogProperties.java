package com.purchasingpower.reviewflow.config;

import com.purchasingpower.reviewflow.model.finding.Severity;
import com.purchasingpower.reviewflow.model.pattern.PatternScope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Pattern catalogue declared under {@code app.patterns.definitions}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.patterns")
public class PatternCatalogProperties {

    @Valid
    private List<Definition> definitions = new ArrayList<>();

    @Data
    public static class Definition {
        @NotBlank
        private String id;

        private String name;

        @NotBlank
        private String category;

        private Severity severity = Severity.MEDIUM;

        @NotBlank
        private String regex;

        private PatternScope scope = PatternScope.LINE;

        private List<String> fileGlobs = new ArrayList<>();

        private boolean caseInsensitive = true;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double baseWeight = 0.5;

        @NotBlank
        private String message;

        private String fix;

        private boolean active = true;
    }
}
