package com.purchasingpower.reviewflow.model.retrieval;

import lombok.Builder;
import lombok.Value;

/**
 * A piece of related code, documentation or history returned by the similarity index.
 */
@Value
@Builder(toBuilder = true)
public class ContextChunk {
    String location;
    String text;
    double relevance;
    ChunkOrigin origin;
}
