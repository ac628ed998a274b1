package com.purchasingpower.reviewflow.retrieval;

import com.purchasingpower.reviewflow.model.diff.ParsedDiff;
import com.purchasingpower.reviewflow.model.retrieval.ContextChunk;

import java.util.List;

public interface ContextRetriever {

    /**
     * Finds code, docs and history related to the changed code.
     *
     * @param diff parsed diff under review
     * @param filePaths changed file paths
     * @param repositoryRef repository the diff belongs to, used to scope the index query
     * @param k maximum number of chunks
     * @return at most k chunks, most relevant first
     * @throws com.purchasingpower.reviewflow.exception.RetrievalUnavailableException
     *         when the index is unavailable or too slow
     */
    List<ContextChunk> retrieve(ParsedDiff diff, List<String> filePaths, String repositoryRef, int k);
}
