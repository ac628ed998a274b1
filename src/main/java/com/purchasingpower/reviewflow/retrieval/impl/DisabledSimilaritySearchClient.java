package com.purchasingpower.reviewflow.retrieval.impl;

import com.purchasingpower.reviewflow.model.retrieval.CodeBlock;
import com.purchasingpower.reviewflow.retrieval.SearchOutcome;
import com.purchasingpower.reviewflow.retrieval.SimilaritySearchClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Used when no vector index is configured. Always reports unavailable, so reviews run without context.
 */
@Component
@ConditionalOnProperty(prefix = "app.review.retrieval", name = "provider", havingValue = "none", matchIfMissing = true)
public class DisabledSimilaritySearchClient implements SimilaritySearchClient {

    @Override
    public SearchOutcome search(List<CodeBlock> queryChunks, String repositoryRef, int k) {
        return SearchOutcome.unavailable("no similarity index configured");
    }

    @Override
    public String getName() {
        return "none";
    }
}
