package com.purchasingpower.reviewflow.learning.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.purchasingpower.reviewflow.learning.GoldenSetRecallEstimator;
import com.purchasingpower.reviewflow.model.diff.ParsedDiff;
import com.purchasingpower.reviewflow.model.feedback.GoldenCase;
import com.purchasingpower.reviewflow.model.finding.Finding;
import com.purchasingpower.reviewflow.parser.UnifiedDiffParser;
import com.purchasingpower.reviewflow.patterns.PatternRegistry;
import com.purchasingpower.reviewflow.patterns.PatternRuleEngine;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs every golden case through the active patterns and reports the share of expected
 * categories found. Model calls are left out so the estimate costs nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleGoldenSetRecallEstimator implements GoldenSetRecallEstimator {

    private final UnifiedDiffParser diffParser;
    private final PatternRegistry patternRegistry;
    private final PatternRuleEngine ruleEngine;

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final List<GoldenCase> cases = new ArrayList<>();

    @PostConstruct
    public void loadCases() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            for (Resource resource : resolver.getResources("classpath*:golden/*.yaml")) {
                cases.add(yamlMapper.readValue(resource.getInputStream(), GoldenCase.class));
            }
            log.info("Loaded {} golden review cases", cases.size());
        } catch (IOException e) {
            log.error("Failed to load golden review cases", e);
            throw new IllegalStateException("Golden set initialization failed", e);
        }
    }

    @Override
    public double estimateRecall() {
        long expected = 0;
        long found = 0;
        for (GoldenCase golden : cases) {
            ParsedDiff diff = diffParser.parse(golden.getDiff(),
                    golden.getFilePath() != null ? List.of(golden.getFilePath()) : List.of());
            Set<String> reported = ruleEngine.evaluate(diff, List.of(), patternRegistry.activePatterns()).stream()
                    .map(Finding::getCategory)
                    .collect(Collectors.toSet());

            for (String category : golden.getExpectedCategories()) {
                expected++;
                if (reported.contains(category)) {
                    found++;
                } else {
                    log.debug("Golden case {} missed category {}", golden.getName(), category);
                }
            }
        }
        return expected == 0 ? Double.NaN : (double) found / expected;
    }

    public int caseCount() {
        return cases.size();
    }
}
