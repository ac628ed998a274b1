package com.purchasingpower.reviewflow.patterns;

import com.purchasingpower.reviewflow.config.PatternCatalogProperties;
import com.purchasingpower.reviewflow.exception.PatternNotFoundException;
import com.purchasingpower.reviewflow.model.pattern.PatternDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pattern catalogue keyed by id.
 *
 * <p>Definitions are fixed at startup. At runtime a pattern can only be deactivated
 * or re-activated; it is never removed, so feedback history that names it stays meaningful.
 */
@Slf4j
@Component
public class PatternRegistry {

    private final Map<String, CompiledPattern> patterns;
    private final Set<String> inactive = ConcurrentHashMap.newKeySet();

    @Autowired
    public PatternRegistry(PatternCatalogProperties properties) {
        this(properties.getDefinitions().stream().map(PatternRegistry::toDefinition).toList());
        properties.getDefinitions().stream()
                .filter(d -> !d.isActive())
                .forEach(d -> inactive.add(d.getId()));
    }

    public PatternRegistry(List<PatternDefinition> definitions) {
        Map<String, CompiledPattern> loaded = new LinkedHashMap<>();
        for (PatternDefinition definition : definitions) {
            CompiledPattern compiled = new CompiledPattern(definition);
            if (loaded.putIfAbsent(definition.getId(), compiled) != null) {
                throw new IllegalStateException("Duplicate pattern id: " + definition.getId());
            }
            if (compiled.getCompileError() != null) {
                log.error("❌ Pattern {} does not compile and will be skipped: {}",
                        definition.getId(), compiled.getCompileError());
            }
        }
        this.patterns = Map.copyOf(loaded);
        log.info("Loaded {} review patterns", patterns.size());
    }

    /**
     * Active patterns ordered by id.
     */
    public List<CompiledPattern> activePatterns() {
        return patterns.values().stream()
                .filter(p -> !inactive.contains(p.getId()))
                .sorted(Comparator.comparing(CompiledPattern::getId))
                .toList();
    }

    public List<CompiledPattern> allPatterns() {
        return patterns.values().stream()
                .sorted(Comparator.comparing(CompiledPattern::getId))
                .toList();
    }

    public Optional<CompiledPattern> find(String patternId) {
        return Optional.ofNullable(patterns.get(patternId));
    }

    public boolean isActive(String patternId) {
        return patterns.containsKey(patternId) && !inactive.contains(patternId);
    }

    public void deactivate(String patternId) {
        requireKnown(patternId);
        if (inactive.add(patternId)) {
            log.info("⏸️ Pattern deactivated: {}", patternId);
        }
    }

    public void activate(String patternId) {
        requireKnown(patternId);
        if (inactive.remove(patternId)) {
            log.info("▶️ Pattern activated: {}", patternId);
        }
    }

    private void requireKnown(String patternId) {
        if (!patterns.containsKey(patternId)) {
            throw new PatternNotFoundException(patternId);
        }
    }

    private static PatternDefinition toDefinition(PatternCatalogProperties.Definition d) {
        return PatternDefinition.builder()
                .id(d.getId())
                .name(d.getName() != null ? d.getName() : d.getId())
                .category(d.getCategory())
                .severity(d.getSeverity())
                .regex(d.getRegex())
                .scope(d.getScope())
                .fileGlobs(List.copyOf(d.getFileGlobs()))
                .caseInsensitive(d.isCaseInsensitive())
                .baseWeight(d.getBaseWeight())
                .message(d.getMessage())
                .fix(d.getFix())
                .build();
    }
}
