package com.purchasingpower.reviewflow.patterns.impl;

import com.purchasingpower.reviewflow.exception.PatternEvaluationException;
import com.purchasingpower.reviewflow.model.diff.DiffFile;
import com.purchasingpower.reviewflow.model.diff.DiffHunk;
import com.purchasingpower.reviewflow.model.diff.DiffLine;
import com.purchasingpower.reviewflow.model.diff.ParsedDiff;
import com.purchasingpower.reviewflow.model.finding.FileLocation;
import com.purchasingpower.reviewflow.model.finding.Finding;
import com.purchasingpower.reviewflow.model.finding.FindingOrigin;
import com.purchasingpower.reviewflow.model.pattern.PatternDefinition;
import com.purchasingpower.reviewflow.model.pattern.PatternScope;
import com.purchasingpower.reviewflow.model.pattern.RuleStats;
import com.purchasingpower.reviewflow.model.retrieval.ContextChunk;
import com.purchasingpower.reviewflow.patterns.CompiledPattern;
import com.purchasingpower.reviewflow.patterns.PatternRuleEngine;
import com.purchasingpower.reviewflow.patterns.PatternWeightTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;

/**
 * Regex-based rule engine.
 *
 * Patterns run in parallel; results are collected in pattern order and then sorted by
 * location, so the output does not depend on thread scheduling.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatternRuleEngineImpl implements PatternRuleEngine {

    private static final Comparator<Finding> FINDING_ORDER = Comparator
            .comparing((Finding f) -> f.getLocation().getFilePath())
            .thenComparingInt(f -> f.getLocation().getLine())
            .thenComparing(Finding::getPatternId);

    private final PatternWeightTable weightTable;

    private final Map<String, Counters> counters = new ConcurrentHashMap<>();

    @Override
    public List<Finding> evaluate(ParsedDiff diff, List<ContextChunk> context, List<CompiledPattern> activePatterns) {
        if (diff == null || activePatterns == null || activePatterns.isEmpty()) {
            return List.of();
        }

        List<Finding> findings = activePatterns.parallelStream()
                .map(pattern -> evaluateSafely(pattern, diff))
                .flatMap(List::stream)
                .sorted(FINDING_ORDER)
                .toList();

        log.info("🔎 Rule engine: {} patterns over {} added lines -> {} findings",
                activePatterns.size(), diff.addedLineCount(), findings.size());
        return findings;
    }

    @Override
    public Map<String, RuleStats> statistics() {
        Map<String, RuleStats> stats = new TreeMap<>();
        counters.forEach((id, c) -> stats.put(id, new RuleStats(c.evaluations.get(), c.matches.get(), c.errors.get())));
        return stats;
    }

    private List<Finding> evaluateSafely(CompiledPattern pattern, ParsedDiff diff) {
        Counters c = counters.computeIfAbsent(pattern.getId(), id -> new Counters());
        c.evaluations.incrementAndGet();
        try {
            List<Finding> found = evaluatePattern(pattern, diff);
            c.matches.addAndGet(found.size());
            return found;
        } catch (PatternEvaluationException e) {
            c.errors.incrementAndGet();
            log.error("❌ Skipping pattern {}: {}", e.getPatternId(), e.getMessage());
            return List.of();
        } catch (RuntimeException | StackOverflowError e) {
            c.errors.incrementAndGet();
            log.error("❌ Skipping pattern {} after evaluation error", pattern.getId(), e);
            return List.of();
        }
    }

    private List<Finding> evaluatePattern(CompiledPattern pattern, ParsedDiff diff) {
        PatternDefinition definition = pattern.getDefinition();
        if (pattern.getCompileError() != null) {
            throw new PatternEvaluationException(definition.getId(), "pattern does not compile: " + pattern.getCompileError(), null);
        }

        double confidence = clamp(definition.getBaseWeight() * weightTable.factor(definition.getId()));
        List<Finding> findings = new ArrayList<>();

        for (DiffFile file : diff.getFiles()) {
            if (!pattern.appliesTo(file.getPath())) {
                continue;
            }
            for (DiffHunk hunk : file.getHunks()) {
                List<Integer> lines = definition.getScope() == PatternScope.HUNK
                        ? matchHunk(pattern, hunk)
                        : matchLines(pattern, hunk);
                for (Integer line : lines) {
                    findings.add(toFinding(definition, file.getPath(), line, confidence));
                }
            }
        }
        return findings;
    }

    private List<Integer> matchLines(CompiledPattern pattern, DiffHunk hunk) {
        List<Integer> matched = new ArrayList<>();
        for (DiffLine line : hunk.addedLines()) {
            if (pattern.getRegex().matcher(line.getContent()).find()) {
                matched.add(line.getNewLineNumber());
            }
        }
        return matched;
    }

    /**
     * Matches across the joined added lines of a hunk and reports the line each match starts on.
     */
    private List<Integer> matchHunk(CompiledPattern pattern, DiffHunk hunk) {
        List<DiffLine> added = hunk.addedLines();
        if (added.isEmpty()) {
            return List.of();
        }
        StringBuilder text = new StringBuilder();
        int[] lineStarts = new int[added.size()];
        for (int i = 0; i < added.size(); i++) {
            lineStarts[i] = text.length();
            text.append(added.get(i).getContent()).append('\n');
        }

        List<Integer> matched = new ArrayList<>();
        Matcher matcher = pattern.getRegex().matcher(text);
        while (matcher.find()) {
            int index = lineIndexOf(lineStarts, matcher.start());
            int lineNumber = added.get(index).getNewLineNumber();
            if (!matched.contains(lineNumber)) {
                matched.add(lineNumber);
            }
        }
        return matched;
    }

    private int lineIndexOf(int[] lineStarts, int offset) {
        int index = 0;
        for (int i = 0; i < lineStarts.length; i++) {
            if (lineStarts[i] <= offset) {
                index = i;
            } else {
                break;
            }
        }
        return index;
    }

    private Finding toFinding(PatternDefinition definition, String path, int line, double confidence) {
        return Finding.builder()
                .id("rule:" + definition.getId() + "@" + path + ":" + line)
                .origin(FindingOrigin.RULE)
                .category(definition.getCategory())
                .severity(definition.getSeverity())
                .location(new FileLocation(path, line))
                .message(definition.getMessage())
                .fix(definition.getFix())
                .confidence(confidence)
                .patternId(definition.getId())
                .build();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static final class Counters {
        final AtomicLong evaluations = new AtomicLong();
        final AtomicLong matches = new AtomicLong();
        final AtomicLong errors = new AtomicLong();
    }
}
