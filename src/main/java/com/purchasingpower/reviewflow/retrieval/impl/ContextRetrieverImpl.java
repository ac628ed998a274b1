package com.purchasingpower.reviewflow.retrieval.impl;

import com.purchasingpower.reviewflow.config.ReviewEngineProperties;
import com.purchasingpower.reviewflow.exception.RetrievalUnavailableException;
import com.purchasingpower.reviewflow.model.diff.ParsedDiff;
import com.purchasingpower.reviewflow.model.retrieval.CodeBlock;
import com.purchasingpower.reviewflow.model.retrieval.ContextChunk;
import com.purchasingpower.reviewflow.retrieval.ContextRetriever;
import com.purchasingpower.reviewflow.retrieval.DiffChunker;
import com.purchasingpower.reviewflow.retrieval.SearchOutcome;
import com.purchasingpower.reviewflow.retrieval.SimilaritySearchClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Chunks the diff, queries the similarity index with a bounded wait, and normalizes the answer.
 *
 * An explicit "unavailable" answer is retried immediately up to the configured count;
 * a timeout is not retried.
 */
@Slf4j
@Service
public class ContextRetrieverImpl implements ContextRetriever {

    private static final Comparator<ContextChunk> BY_RELEVANCE = Comparator
            .comparingDouble(ContextChunk::getRelevance).reversed()
            .thenComparing(ContextChunk::getLocation);

    private final SimilaritySearchClient searchClient;
    private final DiffChunker chunker;
    private final Executor providerExecutor;
    private final ReviewEngineProperties.Retrieval settings;

    public ContextRetrieverImpl(SimilaritySearchClient searchClient,
                                DiffChunker chunker,
                                @Qualifier("providerExecutor") Executor providerExecutor,
                                ReviewEngineProperties properties) {
        this.searchClient = searchClient;
        this.chunker = chunker;
        this.providerExecutor = providerExecutor;
        this.settings = properties.getRetrieval();
    }

    @Override
    public List<ContextChunk> retrieve(ParsedDiff diff, List<String> filePaths, String repositoryRef, int k) {
        if (k <= 0) {
            return List.of();
        }
        List<CodeBlock> blocks = chunker.chunk(diff);
        if (blocks.isEmpty()) {
            log.debug("No changed code blocks to query for {}", filePaths);
            return List.of();
        }
        if (blocks.size() > settings.getMaxQueryChunks()) {
            blocks = blocks.subList(0, settings.getMaxQueryChunks());
        }

        SearchOutcome outcome = searchWithTimeout(blocks, repositoryRef, k);
        int retries = 0;
        while (!outcome.isAvailable() && retries < settings.getUnavailableRetries()) {
            retries++;
            log.warn("⚠️ Similarity index {} unavailable ({}), retry {}/{}",
                    searchClient.getName(), outcome.getReason(), retries, settings.getUnavailableRetries());
            outcome = searchWithTimeout(blocks, repositoryRef, k);
        }
        if (!outcome.isAvailable()) {
            throw new RetrievalUnavailableException(
                    "Similarity index " + searchClient.getName() + " unavailable: " + outcome.getReason(), false);
        }

        List<ContextChunk> chunks = normalize(outcome.getChunks(), k);
        log.info("📚 Retrieved {} context chunks for {} query blocks ({})", chunks.size(), blocks.size(), repositoryRef);
        return chunks;
    }

    private SearchOutcome searchWithTimeout(List<CodeBlock> blocks, String repositoryRef, int k) {
        Duration timeout = settings.getTimeout();
        CompletableFuture<SearchOutcome> future =
                CompletableFuture.supplyAsync(() -> searchClient.search(blocks, repositoryRef, k), providerExecutor);
        try {
            SearchOutcome outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return outcome != null ? outcome : SearchOutcome.unavailable("empty answer");
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RetrievalUnavailableException(
                    "Similarity index " + searchClient.getName() + " did not answer within " + timeout.toMillis() + "ms", true);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RetrievalUnavailableException("Retrieval interrupted", e);
        } catch (ExecutionException e) {
            return SearchOutcome.unavailable(e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
    }

    /**
     * One chunk per location (highest relevance wins), relevance clamped to [0,1],
     * most relevant first, at most k.
     */
    static List<ContextChunk> normalize(List<ContextChunk> raw, int k) {
        Map<String, ContextChunk> byLocation = new LinkedHashMap<>();
        for (ContextChunk chunk : raw) {
            if (chunk == null || chunk.getLocation() == null) {
                continue;
            }
            ContextChunk clamped = chunk.toBuilder()
                    .relevance(Math.max(0.0, Math.min(1.0, chunk.getRelevance())))
                    .build();
            byLocation.merge(clamped.getLocation(), clamped,
                    (a, b) -> a.getRelevance() >= b.getRelevance() ? a : b);
        }
        return byLocation.values().stream()
                .sorted(BY_RELEVANCE)
                .limit(k)
                .toList();
    }
}
