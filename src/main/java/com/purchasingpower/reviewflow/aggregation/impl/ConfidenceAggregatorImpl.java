package com.purchasingpower.reviewflow.aggregation.impl;

import com.google.common.hash.Hashing;
import com.purchasingpower.reviewflow.aggregation.ConfidenceAggregator;
import com.purchasingpower.reviewflow.aggregation.MessageSimilarity;
import com.purchasingpower.reviewflow.config.ReviewEngineProperties;
import com.purchasingpower.reviewflow.model.finding.Finding;
import com.purchasingpower.reviewflow.model.finding.FindingOrigin;
import com.purchasingpower.reviewflow.model.finding.Provenance;
import com.purchasingpower.reviewflow.model.finding.Severity;
import com.purchasingpower.reviewflow.model.finding.Suggestion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Greedy grouping over findings sorted by location.
 *
 * <p>A finding joins the first group with the same file and category whose anchor line is
 * within the line tolerance and which has a member with a similar message. Sharing a line is
 * not enough: two different issues reported on one line stay separate suggestions.
 * Grouping is order-independent because input is sorted first.
 */
@Slf4j
@Service
public class ConfidenceAggregatorImpl implements ConfidenceAggregator {

    private static final Comparator<Finding> INPUT_ORDER = Comparator
            .comparing((Finding f) -> f.getLocation().getFilePath())
            .thenComparingInt(f -> f.getLocation().getLine())
            .thenComparing(Finding::getCategory)
            .thenComparing(Comparator.comparingDouble(Finding::getConfidence).reversed())
            .thenComparing(Finding::getId);

    private static final Comparator<Finding> STRONGEST_FIRST = Comparator
            .comparingDouble(Finding::getConfidence).reversed()
            .thenComparing(f -> f.getOrigin() == FindingOrigin.RULE ? 0 : 1)
            .thenComparing(Finding::getId);

    private static final Comparator<Suggestion> OUTPUT_ORDER = Comparator
            .comparingDouble(Suggestion::getConfidence).reversed()
            .thenComparing(s -> -s.getSeverity().getRank())
            .thenComparing(s -> s.getLocation().getFilePath())
            .thenComparingInt(s -> s.getLocation().getLine())
            .thenComparing(Suggestion::getId);

    private final int lineTolerance;
    private final double similarityThreshold;
    private final double confidenceCap;

    @Autowired
    public ConfidenceAggregatorImpl(ReviewEngineProperties properties) {
        this(properties.getAggregation().getLineTolerance(),
                properties.getAggregation().getSimilarityThreshold(),
                properties.getAggregation().getConfidenceCap());
    }

    public ConfidenceAggregatorImpl(int lineTolerance, double similarityThreshold, double confidenceCap) {
        this.lineTolerance = lineTolerance;
        this.similarityThreshold = similarityThreshold;
        this.confidenceCap = confidenceCap;
    }

    @Override
    public List<Suggestion> aggregate(String reviewId, int generation, List<Finding> findings) {
        if (findings == null || findings.isEmpty()) {
            return List.of();
        }

        List<List<Finding>> groups = new ArrayList<>();
        findings.stream()
                .filter(Objects::nonNull)
                .sorted(INPUT_ORDER)
                .forEach(f -> groupFor(groups, f).add(f));

        List<Suggestion> suggestions = groups.stream()
                .map(group -> toSuggestion(reviewId, generation, group))
                .sorted(OUTPUT_ORDER)
                .toList();

        log.info("🧮 Aggregated {} findings into {} suggestions", findings.size(), suggestions.size());
        return suggestions;
    }

    /**
     * Combined confidence of a group: strongest finding per source, probabilistic union
     * across sources, capped, and never below the strongest single finding.
     */
    public double combine(List<Finding> group) {
        Map<String, Double> perSource = new HashMap<>();
        for (Finding f : group) {
            perSource.merge(f.sourceKey(), clamp(f.getConfidence()), Math::max);
        }
        double miss = 1.0;
        double strongest = 0.0;
        for (double c : perSource.values()) {
            miss *= (1.0 - c);
            strongest = Math.max(strongest, c);
        }
        double union = 1.0 - miss;
        return clamp(Math.max(Math.min(union, confidenceCap), strongest));
    }

    private List<Finding> groupFor(List<List<Finding>> groups, Finding finding) {
        for (List<Finding> group : groups) {
            Finding anchor = group.get(0);
            if (!anchor.getLocation().getFilePath().equals(finding.getLocation().getFilePath())
                    || !anchor.getCategory().equals(finding.getCategory())) {
                continue;
            }
            int distance = Math.abs(anchor.getLocation().getLine() - finding.getLocation().getLine());
            if (distance > lineTolerance) {
                continue;
            }
            boolean similar = group.stream()
                    .anyMatch(m -> MessageSimilarity.jaccard(m.getMessage(), finding.getMessage()) >= similarityThreshold);
            if (similar) {
                return group;
            }
        }
        List<Finding> fresh = new ArrayList<>();
        groups.add(fresh);
        return fresh;
    }

    private Suggestion toSuggestion(String reviewId, int generation, List<Finding> group) {
        List<Finding> ranked = group.stream().sorted(STRONGEST_FIRST).toList();
        Finding top = ranked.get(0);

        Severity severity = group.stream().map(Finding::getSeverity).reduce(Severity.LOW, Severity::max);
        String fix = ranked.stream().map(Finding::getFix).filter(Objects::nonNull).findFirst().orElse(null);

        TreeSet<String> findingIds = new TreeSet<>();
        TreeSet<String> patternIds = new TreeSet<>();
        TreeSet<String> modelIds = new TreeSet<>();
        EnumSet<FindingOrigin> origins = EnumSet.noneOf(FindingOrigin.class);
        for (Finding f : group) {
            findingIds.add(f.getId());
            origins.add(f.getOrigin());
            if (f.getPatternId() != null) {
                patternIds.add(f.getPatternId());
            }
            if (f.getModelId() != null) {
                modelIds.add(f.getModelId());
            }
        }

        return Suggestion.builder()
                .id(suggestionId(reviewId, generation, findingIds))
                .reviewId(reviewId)
                .category(top.getCategory())
                .severity(severity)
                .location(top.getLocation())
                .message(top.getMessage())
                .fix(fix)
                .confidence(combine(group))
                .provenance(Provenance.builder()
                        .findingIds(List.copyOf(findingIds))
                        .patternIds(List.copyOf(patternIds))
                        .modelIds(List.copyOf(modelIds))
                        .origins(EnumSet.copyOf(origins))
                        .build())
                .build();
    }

    private String suggestionId(String reviewId, int generation, TreeSet<String> findingIds) {
        String key = (reviewId == null ? "" : reviewId) + "#" + generation + "|" + String.join("|", findingIds);
        return "sug-" + Hashing.sha256().hashString(key, StandardCharsets.UTF_8).toString().substring(0, 16);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
