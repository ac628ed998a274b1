package com.purchasingpower.reviewflow.model.finding;

import lombok.Builder;
import lombok.Value;

/**
 * A candidate issue reported by exactly one source, before reconciliation.
 *
 * Rule findings carry a patternId, model findings a modelId.
 */
@Value
@Builder(toBuilder = true)
public class Finding {
    String id;
    FindingOrigin origin;
    String category;
    Severity severity;
    FileLocation location;
    String message;
    String fix;
    double confidence;
    String patternId;
    String modelId;

    /**
     * Independent-evidence key: one pattern or one model counts as one source.
     */
    public String sourceKey() {
        return origin == FindingOrigin.RULE ? "pattern:" + patternId : "model:" + modelId;
    }
}
