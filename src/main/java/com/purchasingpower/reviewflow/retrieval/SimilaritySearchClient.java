package com.purchasingpower.reviewflow.retrieval;

import com.purchasingpower.reviewflow.model.retrieval.CodeBlock;

import java.util.List;

/**
 * Narrow interface to the vector index.
 *
 * Implementations report failures through {@link SearchOutcome#unavailable(String)}
 * instead of throwing.
 */
public interface SimilaritySearchClient {

    SearchOutcome search(List<CodeBlock> queryChunks, String repositoryRef, int k);

    String getName();
}
