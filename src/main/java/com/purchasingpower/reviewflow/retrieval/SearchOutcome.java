package com.purchasingpower.reviewflow.retrieval;

import com.purchasingpower.reviewflow.model.retrieval.ContextChunk;
import lombok.Value;

import java.util.List;

/**
 * Answer of the similarity index: either chunks, or an explicit "unavailable" signal.
 */
@Value
public class SearchOutcome {
    boolean available;
    List<ContextChunk> chunks;
    String reason;

    public static SearchOutcome available(List<ContextChunk> chunks) {
        return new SearchOutcome(true, List.copyOf(chunks), null);
    }

    public static SearchOutcome unavailable(String reason) {
        return new SearchOutcome(false, List.of(), reason);
    }
}
