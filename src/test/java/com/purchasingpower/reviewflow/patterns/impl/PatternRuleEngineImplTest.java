package com.purchasingpower.reviewflow.patterns.impl;

import com.purchasingpower.reviewflow.exception.PatternNotFoundException;
import com.purchasingpower.reviewflow.model.diff.ParsedDiff;
import com.purchasingpower.reviewflow.model.finding.Finding;
import com.purchasingpower.reviewflow.model.finding.FindingOrigin;
import com.purchasingpower.reviewflow.model.finding.Severity;
import com.purchasingpower.reviewflow.model.pattern.PatternScope;
import com.purchasingpower.reviewflow.model.pattern.RuleStats;
import com.purchasingpower.reviewflow.parser.UnifiedDiffParser;
import com.purchasingpower.reviewflow.patterns.CompiledPattern;
import com.purchasingpower.reviewflow.patterns.PatternRegistry;
import com.purchasingpower.reviewflow.patterns.PatternWeightTable;
import com.purchasingpower.reviewflow.support.TestDiffs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.reviewflow.patterns.PatternFixtures.hardcodedPassword;
import static com.purchasingpower.reviewflow.patterns.PatternFixtures.magicNumber;
import static com.purchasingpower.reviewflow.patterns.PatternFixtures.pattern;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

@DisplayName("Pattern rule engine")
class PatternRuleEngineImplTest {

    private final UnifiedDiffParser parser = new UnifiedDiffParser();
    private PatternWeightTable weights;
    private PatternRuleEngineImpl engine;

    @BeforeEach
    void setUp() {
        weights = new PatternWeightTable(0.1);
        engine = new PatternRuleEngineImpl(weights);
    }

    @Test
    @DisplayName("Should report a hardcoded password at its new-side line with confidence = base weight")
    void evaluate_credential_reportsRuleFinding() {
        // Given
        ParsedDiff diff = parser.parse(TestDiffs.CREDENTIAL);
        List<CompiledPattern> patterns = new PatternRegistry(List.of(hardcodedPassword())).activePatterns();

        // When
        List<Finding> findings = engine.evaluate(diff, List.of(), patterns);

        // Then
        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.getOrigin()).isEqualTo(FindingOrigin.RULE);
        assertThat(finding.getCategory()).isEqualTo("security");
        assertThat(finding.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(finding.getLocation().getFilePath()).isEqualTo(TestDiffs.CREDENTIAL_PATH);
        assertThat(finding.getLocation().getLine()).isEqualTo(12);
        assertThat(finding.getConfidence()).isEqualTo(0.9);
        assertThat(finding.getPatternId()).isEqualTo("hardcoded-password");
    }

    @Test
    @DisplayName("Should give identical output for identical input, regardless of parallel evaluation")
    void evaluate_isDeterministic() {
        // Given
        ParsedDiff diff = parser.parse(TestDiffs.TWO_FILES);
        List<CompiledPattern> patterns = new PatternRegistry(List.of(
                magicNumber(),
                pattern("println", "logging", "System\\.out\\.println", 0.6).build(),
                pattern("any-def", "style", "def ", 0.3).build(),
                hardcodedPassword())).activePatterns();

        // When
        List<Finding> first = engine.evaluate(diff, List.of(), patterns);
        List<Finding> again = engine.evaluate(diff, List.of(), patterns);

        // Then
        assertThat(first).isNotEmpty();
        assertThat(again).isEqualTo(first);
        assertThat(first).extracting(Finding::getPatternId).containsExactly("magic-number", "println");
    }

    @Test
    @DisplayName("Should only look at added lines")
    void evaluate_ignoresContextAndRemovedLines() {
        // Given: "def run():" is a context line, "log(\"old\")" was removed
        ParsedDiff diff = parser.parse(TestDiffs.TWO_FILES);
        List<CompiledPattern> patterns = new PatternRegistry(List.of(
                pattern("any-def", "style", "def ", 0.3).build(),
                pattern("old-log", "style", "log\\(\"old\"\\)", 0.3).build())).activePatterns();

        // When
        List<Finding> findings = engine.evaluate(diff, List.of(), patterns);

        // Then
        assertThat(findings).isEmpty();
    }

    @Test
    @DisplayName("Should skip a broken pattern and still report the others")
    void evaluate_brokenPattern_isIsolated() {
        // Given
        ParsedDiff diff = parser.parse(TestDiffs.CREDENTIAL);
        List<CompiledPattern> patterns = new PatternRegistry(List.of(
                pattern("broken", "style", "[invalid regex", 0.5).build(),
                hardcodedPassword())).activePatterns();

        // When
        List<Finding> findings = engine.evaluate(diff, List.of(), patterns);

        // Then
        assertThat(findings).extracting(Finding::getPatternId).containsExactly("hardcoded-password");
        RuleStats brokenStats = engine.statistics().get("broken");
        assertThat(brokenStats.getErrors()).isEqualTo(1);
        assertThat(brokenStats.getMatches()).isZero();
    }

    @Test
    @DisplayName("Should scale confidence by the learned factor")
    void evaluate_usesLearnedFactor() {
        // Given
        weights.update("hardcoded-password", f -> 0.5);
        ParsedDiff diff = parser.parse(TestDiffs.CREDENTIAL);
        List<CompiledPattern> patterns = new PatternRegistry(List.of(hardcodedPassword())).activePatterns();

        // When
        List<Finding> findings = engine.evaluate(diff, List.of(), patterns);

        // Then
        assertThat(findings.get(0).getConfidence()).isCloseTo(0.45, offset(1e-9));
    }

    @Test
    @DisplayName("Should match hunk-scoped patterns across added lines")
    void evaluate_hunkScope_matchesAcrossLines() {
        // Given
        String diffText = String.join("\n",
                "--- a/src/Importer.java",
                "+++ b/src/Importer.java",
                "@@ -1,2 +1,6 @@",
                " void run() {",
                "+    try {",
                "+        load();",
                "+    } catch (IOException e) {",
                "+    }",
                " }",
                "");
        ParsedDiff diff = parser.parse(diffText);
        List<CompiledPattern> patterns = new PatternRegistry(List.of(
                pattern("empty-catch", "error-handling", "catch\\s*\\([^)]*\\)\\s*\\{\\s*\\}", 0.8)
                        .scope(PatternScope.HUNK)
                        .build())).activePatterns();

        // When
        List<Finding> findings = engine.evaluate(diff, List.of(), patterns);

        // Then
        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).getLocation().getLine()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should honour file globs")
    void evaluate_fileGlob_restrictsFiles() {
        // Given
        ParsedDiff diff = parser.parse(TestDiffs.TWO_FILES);
        List<CompiledPattern> patterns = new PatternRegistry(List.of(
                pattern("java-magic", "maintainability", "\\b\\d{3,}\\b", 0.5)
                        .fileGlobs(List.of("*.java"))
                        .build())).activePatterns();

        // When
        List<Finding> findings = engine.evaluate(diff, List.of(), patterns);

        // Then: the only magic number is in the python file
        assertThat(findings).isEmpty();
    }

    @Test
    @DisplayName("Should match recursive globs at the repository root and below")
    void evaluate_recursiveGlob_includesRootFiles() {
        // Given
        ParsedDiff diff = parser.parse(String.join("\n",
                "diff --git a/Main.java b/Main.java",
                "--- a/Main.java",
                "+++ b/Main.java",
                "@@ -1,1 +1,2 @@",
                " class Main {",
                "+    void run() { System.out.println(\"main\"); }",
                "diff --git a/src/App.java b/src/App.java",
                "--- a/src/App.java",
                "+++ b/src/App.java",
                "@@ -1,1 +1,2 @@",
                " class App {",
                "+    void run() { System.out.println(\"app\"); }",
                "diff --git a/tools/run.py b/tools/run.py",
                "--- a/tools/run.py",
                "+++ b/tools/run.py",
                "@@ -1,1 +1,2 @@",
                " import os",
                "+# System.out.println is java only",
                ""));
        List<CompiledPattern> patterns = new PatternRegistry(List.of(
                pattern("debug-print", "maintainability", "System\\.out\\.println", 0.5)
                        .fileGlobs(List.of("**/*.java"))
                        .build())).activePatterns();

        // When
        List<Finding> findings = engine.evaluate(diff, List.of(), patterns);

        // Then
        assertThat(findings).extracting(f -> f.getLocation().getFilePath())
                .containsExactly("Main.java", "src/App.java");
        assertThat(patterns.get(0).appliesTo("Main.java")).isTrue();
        assertThat(patterns.get(0).appliesTo("a/b/c/Deep.java")).isTrue();
        assertThat(patterns.get(0).appliesTo("run.py")).isFalse();
    }

    @Test
    @DisplayName("Should keep a pattern with a malformed glob and skip it at evaluation")
    void evaluate_malformedGlob_isIsolated() {
        // Given
        PatternRegistry registry = new PatternRegistry(List.of(
                pattern("bad-glob", "style", "password", 0.5).fileGlobs(List.of("src/[unclosed")).build(),
                hardcodedPassword()));
        ParsedDiff diff = parser.parse(TestDiffs.CREDENTIAL);

        // When
        List<Finding> findings = engine.evaluate(diff, List.of(), registry.activePatterns());

        // Then
        assertThat(registry.find("bad-glob")).isPresent();
        assertThat(registry.find("bad-glob").get().getCompileError()).contains("src/[unclosed");
        assertThat(findings).extracting(Finding::getPatternId).containsExactly("hardcoded-password");
        assertThat(engine.statistics().get("bad-glob").getErrors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject duplicate pattern ids and unknown ids on deactivate")
    void registry_rejectsBadIds() {
        assertThatThrownBy(() -> new PatternRegistry(List.of(magicNumber(), magicNumber())))
                .isInstanceOf(IllegalStateException.class);

        PatternRegistry registry = new PatternRegistry(List.of(magicNumber()));
        assertThatThrownBy(() -> registry.deactivate("nope"))
                .isInstanceOf(PatternNotFoundException.class);

        registry.deactivate("magic-number");
        assertThat(registry.activePatterns()).isEmpty();
        registry.activate("magic-number");
        assertThat(registry.activePatterns()).hasSize(1);
    }
}
