package com.purchasingpower.reviewflow.review;

import com.purchasingpower.reviewflow.config.ReviewEngineProperties;
import com.purchasingpower.reviewflow.exception.ReviewFailureCause;
import com.purchasingpower.reviewflow.exception.ReviewInProgressException;
import com.purchasingpower.reviewflow.exception.ReviewNotFoundException;
import com.purchasingpower.reviewflow.learning.LearningMetricsCalculator;
import com.purchasingpower.reviewflow.learning.SuggestionLedger;
import com.purchasingpower.reviewflow.learning.impl.FeedbackLearningLoopImpl;
import com.purchasingpower.reviewflow.model.dto.ReviewEvent;
import com.purchasingpower.reviewflow.model.dto.ReviewEventType;
import com.purchasingpower.reviewflow.model.feedback.Feedback;
import com.purchasingpower.reviewflow.model.finding.FindingOrigin;
import com.purchasingpower.reviewflow.model.finding.Suggestion;
import com.purchasingpower.reviewflow.model.llm.ModelTier;
import com.purchasingpower.reviewflow.model.metrics.LearningMetrics;
import com.purchasingpower.reviewflow.model.review.Review;
import com.purchasingpower.reviewflow.model.review.ReviewRequest;
import com.purchasingpower.reviewflow.model.review.ReviewStatus;
import com.purchasingpower.reviewflow.support.ReviewEngineFixture;
import com.purchasingpower.reviewflow.support.TestDiffs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static com.purchasingpower.reviewflow.patterns.PatternFixtures.hardcodedPassword;
import static com.purchasingpower.reviewflow.patterns.PatternFixtures.magicNumber;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

@DisplayName("Review state machine")
class ReviewStateMachineTest {

    private static final Duration WAIT = Duration.ofSeconds(10);
    private static final String TRIAGE_CLEAN = "{\"hasIssues\": false, \"categories\": []}";
    private static final String TRIAGE_FLAGGED = "{\"hasIssues\": true, \"categories\": [\"security\"]}";
    private static final String DEEP_PASSWORD = "[{\"type\": \"security\", \"description\": \"Password is hardcoded\", "
            + "\"severity\": \"critical\", \"line_number\": 12, \"file_path\": \"" + TestDiffs.CREDENTIAL_PATH + "\", "
            + "\"confidence\": 0.8}]";

    private ReviewEngineFixture engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    @DisplayName("Should complete a credential review from rule findings alone")
    void submit_credentialDiff_completesWithRuleSuggestion() throws InterruptedException {
        // Given
        engine = new ReviewEngineFixture(List.of(hardcodedPassword(), magicNumber()));
        engine.getOllama().answer(ModelTier.TRIAGE, TRIAGE_CLEAN);
        ReviewStateMachine machine = engine.getStateMachine();

        // When
        Review pending = machine.submit(request("rev-1", TestDiffs.CREDENTIAL));
        Review done = machine.awaitCompletion("rev-1", WAIT);

        // Then
        assertThat(pending.getStatus()).isEqualTo(ReviewStatus.PENDING);
        assertThat(pending.getChangedFiles()).containsExactly(TestDiffs.CREDENTIAL_PATH);
        assertThat(done.getStatus()).isEqualTo(ReviewStatus.COMPLETED);
        assertThat(done.getSuggestions()).hasSize(1);

        Suggestion suggestion = done.getSuggestions().get(0);
        assertThat(suggestion.getCategory()).isEqualTo("security");
        assertThat(suggestion.getLocation().getLine()).isEqualTo(12);
        assertThat(suggestion.getConfidence()).isEqualTo(0.9);
        assertThat(suggestion.getProvenance().getOrigins()).containsExactly(FindingOrigin.RULE);
        assertThat(engine.getOllama().calls(ModelTier.DEEP)).isZero();
        assertThat(engine.getPersistence().findReview("rev-1")).isPresent();
    }

    @Test
    @DisplayName("Should emit progress events in lifecycle order followed by exactly one completion")
    void submit_emitsOrderedEvents() throws InterruptedException {
        // Given
        engine = new ReviewEngineFixture(List.of(hardcodedPassword()));
        engine.getOllama().answer(ModelTier.TRIAGE, TRIAGE_CLEAN);

        // When
        engine.getStateMachine().submit(request("rev-events", TestDiffs.CREDENTIAL));
        engine.getStateMachine().awaitCompletion("rev-events", WAIT);

        // Then
        List<ReviewEvent> events = engine.getEventLog().events("rev-events");
        assertThat(events).extracting(ReviewEvent::getStatus).containsExactly(
                ReviewStatus.PENDING, ReviewStatus.RETRIEVING, ReviewStatus.ANALYZING,
                ReviewStatus.AGGREGATING, ReviewStatus.COMPLETED);
        assertThat(events).extracting(ReviewEvent::getSequence).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(events).filteredOn(e -> e.getType() == ReviewEventType.COMPLETE).hasSize(1);
        assertThat(events.get(4).getSuggestions()).hasSize(1);
    }

    @Test
    @DisplayName("Should merge agreeing rule and model findings into one stronger suggestion")
    void submit_ruleAndModelAgree() throws InterruptedException {
        // Given
        engine = new ReviewEngineFixture(List.of(hardcodedPassword()));
        engine.getOllama().answer(ModelTier.TRIAGE, TRIAGE_FLAGGED).answer(ModelTier.DEEP, DEEP_PASSWORD);

        // When
        engine.getStateMachine().submit(request("rev-agree", TestDiffs.CREDENTIAL));
        Review done = engine.getStateMachine().awaitCompletion("rev-agree", WAIT);

        // Then
        assertThat(done.getSuggestions()).hasSize(1);
        Suggestion suggestion = done.getSuggestions().get(0);
        assertThat(suggestion.getConfidence()).isEqualTo(0.95);
        assertThat(suggestion.getProvenance().getOrigins())
                .containsExactlyInAnyOrder(FindingOrigin.RULE, FindingOrigin.MODEL);
        assertThat(suggestion.getProvenance().getModelIds()).containsExactly("ollama-deep");
    }

    @Test
    @DisplayName("Should reject a second submission while the review is running")
    void submit_whileRunning_rejected() throws InterruptedException {
        // Given
        engine = new ReviewEngineFixture(List.of(hardcodedPassword()));
        engine.getOllama().delay(Duration.ofMillis(1500)).answer(ModelTier.TRIAGE, TRIAGE_CLEAN);
        ReviewStateMachine machine = engine.getStateMachine();
        machine.submit(request("rev-busy", TestDiffs.CREDENTIAL));

        // When / Then
        assertThatThrownBy(() -> machine.submit(request("rev-busy", TestDiffs.CREDENTIAL)))
                .isInstanceOf(ReviewInProgressException.class);
        assertThatThrownBy(() -> machine.regenerate("rev-busy"))
                .isInstanceOf(ReviewInProgressException.class);

        Review done = machine.awaitCompletion("rev-busy", WAIT);
        assertThat(done.getStatus()).isEqualTo(ReviewStatus.COMPLETED);
        assertThat(done.getGeneration()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail a cancelled review with CANCELLED and leave it unchanged afterwards")
    void cancel_runningReview() throws InterruptedException {
        // Given
        engine = new ReviewEngineFixture(List.of(hardcodedPassword()));
        engine.getOllama().delay(Duration.ofMillis(1500)).answer(ModelTier.TRIAGE, TRIAGE_CLEAN);
        ReviewStateMachine machine = engine.getStateMachine();
        machine.submit(request("rev-cancel", TestDiffs.CREDENTIAL));

        // When
        Review cancelled = machine.cancel("rev-cancel");
        Thread.sleep(2000);

        // Then
        assertThat(cancelled.getStatus()).isEqualTo(ReviewStatus.FAILED);
        assertThat(cancelled.getFailureCause()).isEqualTo(ReviewFailureCause.CANCELLED);

        Review later = machine.find("rev-cancel").orElseThrow();
        assertThat(later.getStatus()).isEqualTo(ReviewStatus.FAILED);
        assertThat(later.getSuggestions()).isEmpty();
        assertThat(engine.getEventLog().events("rev-cancel"))
                .filteredOn(ReviewEvent::isTerminal)
                .hasSize(1);
        assertThat(machine.cancel("rev-cancel").getFailureCause()).isEqualTo(ReviewFailureCause.CANCELLED);
    }

    @Test
    @DisplayName("Should fail a review that runs past its deadline with TIMEOUT")
    void deadline_elapses_failsWithTimeout() throws InterruptedException {
        // Given
        engine = new ReviewEngineFixture(List.of(hardcodedPassword()), Duration.ofMillis(300), Duration.ofSeconds(5));
        engine.getOllama().delay(Duration.ofSeconds(3)).answer(ModelTier.TRIAGE, TRIAGE_CLEAN);

        // When
        engine.getStateMachine().submit(request("rev-slow", TestDiffs.CREDENTIAL));
        Review done = engine.getStateMachine().awaitCompletion("rev-slow", WAIT);

        // Then
        assertThat(done.getStatus()).isEqualTo(ReviewStatus.FAILED);
        assertThat(done.getFailureCause()).isEqualTo(ReviewFailureCause.TIMEOUT);
        assertThat(engine.getPersistence().savedSnapshots())
                .extracting(Review::getFailureCause)
                .containsExactly(ReviewFailureCause.TIMEOUT);
    }

    @Test
    @DisplayName("Should rerun a finished review as a new generation with continuing event numbers")
    void regenerate_finishedReview_newGeneration() throws InterruptedException {
        // Given
        engine = new ReviewEngineFixture(List.of(hardcodedPassword()));
        engine.getOllama().answer(ModelTier.TRIAGE, TRIAGE_CLEAN);
        ReviewStateMachine machine = engine.getStateMachine();
        machine.submit(request("rev-regen", TestDiffs.CREDENTIAL));
        machine.awaitCompletion("rev-regen", WAIT);

        // When
        Review restarted = machine.regenerate("rev-regen");
        Review done = machine.awaitCompletion("rev-regen", WAIT);

        // Then
        assertThat(restarted.getGeneration()).isEqualTo(2);
        assertThat(restarted.getStatus()).isEqualTo(ReviewStatus.PENDING);
        assertThat(done.getStatus()).isEqualTo(ReviewStatus.COMPLETED);
        List<ReviewEvent> events = engine.getEventLog().events("rev-regen");
        assertThat(events).hasSize(10);
        assertThat(events.get(5).getGeneration()).isEqualTo(2);
        assertThat(events.get(5).getSequence()).isEqualTo(6L);
    }

    @Test
    @DisplayName("Should start a new generation when a finished id is submitted again")
    void submit_finishedId_startsNextGeneration() throws InterruptedException {
        // Given
        engine = new ReviewEngineFixture(List.of(hardcodedPassword()));
        engine.getOllama().answer(ModelTier.TRIAGE, TRIAGE_CLEAN);
        ReviewStateMachine machine = engine.getStateMachine();
        machine.submit(request("rev-again", TestDiffs.CREDENTIAL));
        machine.awaitCompletion("rev-again", WAIT);

        // When
        Review second = machine.submit(request("rev-again", TestDiffs.CLEAN));
        Review done = machine.awaitCompletion("rev-again", WAIT);

        // Then
        assertThat(second.getGeneration()).isEqualTo(2);
        assertThat(done.getSuggestions()).isEmpty();
    }

    @Test
    @DisplayName("Should reject blank diffs and unknown ids")
    void invalidRequests() {
        engine = new ReviewEngineFixture(List.of(hardcodedPassword()));
        ReviewStateMachine machine = engine.getStateMachine();

        assertThatThrownBy(() -> machine.submit(request("rev-x", "   ")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> machine.regenerate("missing"))
                .isInstanceOf(ReviewNotFoundException.class);
        assertThatThrownBy(() -> machine.cancel("missing"))
                .isInstanceOf(ReviewNotFoundException.class);
        assertThat(machine.find("missing")).isEmpty();
    }

    @Test
    @DisplayName("Should assign an id when the request has none")
    void submit_withoutId_generatesOne() throws InterruptedException {
        engine = new ReviewEngineFixture(List.of(hardcodedPassword()));
        engine.getOllama().answer(ModelTier.TRIAGE, TRIAGE_CLEAN);

        Review pending = engine.getStateMachine().submit(request(null, TestDiffs.CREDENTIAL));

        assertThat(pending.getId()).isNotBlank();
        assertThat(engine.getStateMachine().awaitCompletion(pending.getId(), WAIT).getStatus())
                .isEqualTo(ReviewStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should complete from rules alone when both providers time out")
    void submit_allProvidersTimeOut_completesWithRuleSuggestions() throws InterruptedException {
        // Given
        engine = new ReviewEngineFixture(List.of(hardcodedPassword()), Duration.ofSeconds(10), Duration.ofMillis(200));
        engine.getOllama().delay(Duration.ofSeconds(1)).answer(ModelTier.TRIAGE, TRIAGE_FLAGGED);
        engine.getGemini().delay(Duration.ofSeconds(1)).answer(ModelTier.TRIAGE, TRIAGE_FLAGGED);

        // When
        engine.getStateMachine().submit(request("rev-providers-slow", TestDiffs.CREDENTIAL));
        Review done = engine.getStateMachine().awaitCompletion("rev-providers-slow", WAIT);

        // Then
        assertThat(done.getStatus()).isEqualTo(ReviewStatus.COMPLETED);
        assertThat(done.getSuggestions()).hasSize(1);
        assertThat(done.getSuggestions().get(0).getConfidence()).isEqualTo(0.9);
        assertThat(done.getSuggestions())
                .allSatisfy(s -> assertThat(s.getProvenance().getOrigins()).containsExactly(FindingOrigin.RULE));
        assertThat(engine.getOllama().calls(ModelTier.TRIAGE)).isEqualTo(1);
        assertThat(engine.getGemini().calls(ModelTier.TRIAGE)).isEqualTo(1);
        assertThat(engine.getOllama().calls(ModelTier.DEEP)).isZero();
        assertThat(engine.getGemini().calls(ModelTier.DEEP)).isZero();
    }

    @Test
    @DisplayName("Should give a regenerated review fresh suggestion ids and keep the earlier prediction for replay")
    void regenerate_keepsPriorSuggestionsForReplay() throws InterruptedException {
        // Given
        engine = new ReviewEngineFixture(List.of(hardcodedPassword()));
        engine.getOllama().answer(ModelTier.TRIAGE, TRIAGE_CLEAN);
        ReviewStateMachine machine = engine.getStateMachine();
        machine.submit(request("rev-orphan", TestDiffs.CREDENTIAL));
        Suggestion first = machine.awaitCompletion("rev-orphan", WAIT).getSuggestions().get(0);
        engine.getWeights().update("hardcoded-password", factor -> 0.5);

        // When
        machine.regenerate("rev-orphan");
        Suggestion second = machine.awaitCompletion("rev-orphan", WAIT).getSuggestions().get(0);

        // Then
        assertThat(first.getConfidence()).isEqualTo(0.9);
        assertThat(second.getConfidence()).isCloseTo(0.45, offset(1e-9));
        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(engine.getLedger().find(first.getId()).orElseThrow().getConfidence()).isEqualTo(0.9);
        assertThat(engine.getPersistence().findSuggestion(first.getId()).orElseThrow().getConfidence()).isEqualTo(0.9);

        // And a cold replay calibrates feedback on the orphan against what was shown at the time
        FeedbackLearningLoopImpl loop = new FeedbackLearningLoopImpl(
                new SuggestionLedger(engine.getPersistence()), engine.getPersistence(), engine.getWeights(),
                new LearningMetricsCalculator(() -> 1.0, 10, 10), new ReviewEngineProperties(),
                Runnable::run, Clock.systemUTC());
        LearningMetrics metrics = loop.replay(List.of(Feedback.builder()
                .id("fb-orphan")
                .suggestionId(first.getId())
                .helpful(true)
                .build()));
        assertThat(metrics.getCalibrationError()).isCloseTo(0.1, offset(1e-9));
    }

    private static ReviewRequest request(String id, String diff) {
        return ReviewRequest.builder()
                .reviewId(id)
                .repositoryRef("acme/billing")
                .diff(diff)
                .build();
    }
}
