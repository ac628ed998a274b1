package com.purchasingpower.reviewflow.review;

import com.purchasingpower.reviewflow.aggregation.ConfidenceAggregator;
import com.purchasingpower.reviewflow.config.ReviewEngineProperties;
import com.purchasingpower.reviewflow.exception.AnalysisFailedException;
import com.purchasingpower.reviewflow.exception.RetrievalUnavailableException;
import com.purchasingpower.reviewflow.learning.SuggestionLedger;
import com.purchasingpower.reviewflow.model.diff.ParsedDiff;
import com.purchasingpower.reviewflow.model.finding.Finding;
import com.purchasingpower.reviewflow.model.finding.Suggestion;
import com.purchasingpower.reviewflow.model.retrieval.ContextChunk;
import com.purchasingpower.reviewflow.model.review.ReviewRequest;
import com.purchasingpower.reviewflow.model.review.ReviewStatus;
import com.purchasingpower.reviewflow.orchestration.ModelOrchestrator;
import com.purchasingpower.reviewflow.parser.UnifiedDiffParser;
import com.purchasingpower.reviewflow.patterns.PatternRegistry;
import com.purchasingpower.reviewflow.patterns.PatternRuleEngine;
import com.purchasingpower.reviewflow.retrieval.ContextRetriever;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * The analysis steps of one review generation:
 * retrieve context, run rules and model side by side, aggregate.
 *
 * <p>Each step first moves the session forward; if the session is already terminal
 * (cancelled or timed out) the pipeline stops without producing anything.
 */
@Slf4j
@Component
public class ReviewPipeline {

    private final UnifiedDiffParser diffParser;
    private final ContextRetriever contextRetriever;
    private final PatternRegistry patternRegistry;
    private final PatternRuleEngine ruleEngine;
    private final ModelOrchestrator modelOrchestrator;
    private final ConfidenceAggregator aggregator;
    private final SuggestionLedger ledger;
    private final ReviewEngineProperties properties;
    private final Executor analysisExecutor;

    public ReviewPipeline(UnifiedDiffParser diffParser,
                          ContextRetriever contextRetriever,
                          PatternRegistry patternRegistry,
                          PatternRuleEngine ruleEngine,
                          ModelOrchestrator modelOrchestrator,
                          ConfidenceAggregator aggregator,
                          SuggestionLedger ledger,
                          ReviewEngineProperties properties,
                          @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.diffParser = diffParser;
        this.contextRetriever = contextRetriever;
        this.patternRegistry = patternRegistry;
        this.ruleEngine = ruleEngine;
        this.modelOrchestrator = modelOrchestrator;
        this.aggregator = aggregator;
        this.ledger = ledger;
        this.properties = properties;
        this.analysisExecutor = analysisExecutor;
    }

    /**
     * @return the ranked suggestions, or empty when the session stopped accepting transitions
     * @throws AnalysisFailedException when neither the rules nor the model produced a result
     */
    public Optional<List<Suggestion>> execute(ReviewSession session) {
        ReviewRequest request = session.getRequest();
        String reviewId = session.getReviewId();
        ParsedDiff diff = diffParser.parse(request.getDiff(), request.getFilePaths());

        if (!session.advance(ReviewStatus.RETRIEVING, "🔍 Retrieving related context")) {
            return Optional.empty();
        }
        List<ContextChunk> context = retrieve(reviewId, diff, request);

        if (!session.advance(ReviewStatus.ANALYZING,
                "🧠 Analyzing " + diff.getFiles().size() + " files with " + context.size() + " context chunks")) {
            return Optional.empty();
        }

        CompletableFuture<List<Finding>> rules = CompletableFuture.supplyAsync(
                () -> ruleEngine.evaluate(diff, context, patternRegistry.activePatterns()), analysisExecutor);
        CompletableFuture<List<Finding>> model = CompletableFuture.supplyAsync(
                () -> modelOrchestrator.analyze(reviewId, diff, context, session.getBudget()), analysisExecutor);

        List<Finding> findings;
        try {
            findings = join(reviewId, rules, model);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            rules.cancel(true);
            model.cancel(true);
            log.info("⏹️ Review {} interrupted during analysis", reviewId);
            return Optional.empty();
        }

        if (!session.advance(ReviewStatus.AGGREGATING, "🧮 Aggregating " + findings.size() + " findings")) {
            return Optional.empty();
        }
        List<Suggestion> suggestions = aggregator.aggregate(reviewId, session.getGeneration(), findings);
        ledger.register(suggestions);
        return Optional.of(suggestions);
    }

    private List<ContextChunk> retrieve(String reviewId, ParsedDiff diff, ReviewRequest request) {
        try {
            return contextRetriever.retrieve(diff, diff.filePaths(), request.getRepositoryRef(),
                    properties.getRetrieval().getTopK());
        } catch (RetrievalUnavailableException e) {
            log.warn("⚠️ Review {} continues without context: {}", reviewId, e.getMessage());
            return List.of();
        }
    }

    private List<Finding> join(String reviewId,
                               CompletableFuture<List<Finding>> rules,
                               CompletableFuture<List<Finding>> model) throws InterruptedException {
        List<Finding> findings = new ArrayList<>();
        Throwable ruleError = null;
        Throwable modelError = null;

        try {
            findings.addAll(rules.get());
        } catch (ExecutionException e) {
            ruleError = e.getCause();
            log.error("❌ Rule engine failed for review {}", reviewId, ruleError);
        }
        try {
            findings.addAll(model.get());
        } catch (ExecutionException e) {
            modelError = e.getCause();
            log.error("❌ Model orchestrator failed for review {}", reviewId, modelError);
        }

        if (ruleError != null && modelError != null) {
            AnalysisFailedException failure = new AnalysisFailedException(reviewId,
                    "Rules and model both failed: " + ruleError.getMessage() + "; " + modelError.getMessage(),
                    ruleError);
            failure.addSuppressed(modelError);
            throw failure;
        }
        return findings;
    }
}
