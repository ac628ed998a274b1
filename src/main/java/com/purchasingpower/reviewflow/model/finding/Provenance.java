package com.purchasingpower.reviewflow.model.finding;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Which findings, patterns and models produced a suggestion.
 */
@Value
@Builder
public class Provenance {
    List<String> findingIds;
    List<String> patternIds;
    List<String> modelIds;
    Set<FindingOrigin> origins;

    public static Provenance empty() {
        return Provenance.builder()
                .findingIds(List.of())
                .patternIds(List.of())
                .modelIds(List.of())
                .origins(Set.of())
                .build();
    }
}
