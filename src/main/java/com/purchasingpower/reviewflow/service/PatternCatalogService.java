package com.purchasingpower.reviewflow.service;

import com.purchasingpower.reviewflow.model.pattern.PatternDefinition;
import com.purchasingpower.reviewflow.model.pattern.PatternStatus;
import com.purchasingpower.reviewflow.model.pattern.RuleStats;
import com.purchasingpower.reviewflow.patterns.CompiledPattern;
import com.purchasingpower.reviewflow.patterns.PatternRegistry;
import com.purchasingpower.reviewflow.patterns.PatternRuleEngine;
import com.purchasingpower.reviewflow.patterns.PatternWeightTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Runtime view and activation control of the pattern catalogue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatternCatalogService {

    private static final RuleStats NO_STATS = new RuleStats(0, 0, 0);

    private final PatternRegistry registry;
    private final PatternWeightTable weights;
    private final PatternRuleEngine ruleEngine;

    public List<PatternStatus> listPatterns() {
        Map<String, RuleStats> stats = ruleEngine.statistics();
        return registry.allPatterns().stream()
                .map(p -> toStatus(p, stats.getOrDefault(p.getId(), NO_STATS)))
                .toList();
    }

    public PatternStatus deactivate(String patternId) {
        registry.deactivate(patternId);
        log.info("🚫 Pattern {} deactivated", patternId);
        return status(patternId);
    }

    public PatternStatus activate(String patternId) {
        registry.activate(patternId);
        log.info("✅ Pattern {} activated", patternId);
        return status(patternId);
    }

    private PatternStatus status(String patternId) {
        return listPatterns().stream()
                .filter(s -> s.getId().equals(patternId))
                .findFirst()
                .orElseThrow();
    }

    private PatternStatus toStatus(CompiledPattern pattern, RuleStats stats) {
        PatternDefinition d = pattern.getDefinition();
        double factor = weights.factor(d.getId());
        return PatternStatus.builder()
                .id(d.getId())
                .name(d.getName())
                .category(d.getCategory())
                .severity(d.getSeverity().name())
                .active(registry.isActive(d.getId()))
                .baseWeight(d.getBaseWeight())
                .factor(factor)
                .currentWeight(Math.min(1.0, d.getBaseWeight() * factor))
                .evaluations(stats.getEvaluations())
                .matches(stats.getMatches())
                .errors(stats.getErrors())
                .build();
    }
}
