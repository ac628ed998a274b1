package com.purchasingpower.reviewflow.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.reviewflow.model.dto.SubmitReviewRequest;
import com.purchasingpower.reviewflow.review.ReviewStateMachine;
import com.purchasingpower.reviewflow.support.TestDiffs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for ReviewController.
 *
 * No model provider is enabled in the test profile, so reviews complete from rule findings.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ReviewControllerTest {

    private static final Duration WAIT = Duration.ofSeconds(15);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ReviewStateMachine stateMachine;

    @Test
    @DisplayName("Should accept a diff and later report the hardcoded password")
    void submit_thenGet_returnsSuggestions() throws Exception {
        // Given
        SubmitReviewRequest request = submitRequest("api-rev-1", TestDiffs.CREDENTIAL);

        // When
        mockMvc.perform(post("/api/v1/reviews")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value("api-rev-1"))
                .andExpect(jsonPath("$.data.status").value("PENDING"))
                .andExpect(jsonPath("$.data.diff").doesNotExist());

        stateMachine.awaitCompletion("api-rev-1", WAIT);

        // Then
        mockMvc.perform(get("/api/v1/reviews/api-rev-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("COMPLETED"))
                .andExpect(jsonPath("$.data.suggestions[0].category").value("security"))
                .andExpect(jsonPath("$.data.suggestions[0].location.line").value(12))
                .andExpect(jsonPath("$.data.suggestions[0].provenance.patternIds[0]").value("hardcoded-password"));
    }

    @Test
    @DisplayName("Should list the event log and filter by sequence")
    void events_afterSequence() throws Exception {
        // Given
        mockMvc.perform(post("/api/v1/reviews")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(submitRequest("api-rev-events", TestDiffs.TWO_FILES))))
                .andExpect(status().isAccepted());
        stateMachine.awaitCompletion("api-rev-events", WAIT);

        // When / Then
        mockMvc.perform(get("/api/v1/reviews/api-rev-events/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(5))
                .andExpect(jsonPath("$.data[0].status").value("PENDING"))
                .andExpect(jsonPath("$.data[4].type").value("COMPLETE"));

        mockMvc.perform(get("/api/v1/reviews/api-rev-events/events").param("after", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].sequence").value(4));
    }

    @Test
    @DisplayName("Should regenerate a finished review as generation 2")
    void regenerate_finishedReview() throws Exception {
        // Given
        mockMvc.perform(post("/api/v1/reviews")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(submitRequest("api-rev-regen", TestDiffs.CREDENTIAL))))
                .andExpect(status().isAccepted());
        stateMachine.awaitCompletion("api-rev-regen", WAIT);

        // When
        mockMvc.perform(post("/api/v1/reviews/api-rev-regen/regenerate"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.generation").value(2));

        // Then
        assertThat(stateMachine.awaitCompletion("api-rev-regen", WAIT).getGeneration()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should stream the replayed events of a finished review")
    void stream_finishedReview() throws Exception {
        // Given
        mockMvc.perform(post("/api/v1/reviews")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(submitRequest("api-rev-stream", TestDiffs.CLEAN))))
                .andExpect(status().isAccepted());
        stateMachine.awaitCompletion("api-rev-stream", WAIT);

        // When / Then
        mockMvc.perform(get("/api/v1/reviews/api-rev-stream/stream"))
                .andExpect(request().asyncStarted());
    }

    @Test
    @DisplayName("Should reject a blank diff with 400")
    void submit_blankDiff_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/reviews")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(submitRequest("api-rev-bad", " "))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").isNotEmpty());
    }

    @Test
    @DisplayName("Should answer 404 for unknown reviews")
    void unknownReview_notFound() throws Exception {
        mockMvc.perform(get("/api/v1/reviews/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
        mockMvc.perform(get("/api/v1/reviews/does-not-exist/events"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/v1/reviews/does-not-exist/regenerate"))
                .andExpect(status().isNotFound());
    }

    private static SubmitReviewRequest submitRequest(String id, String diff) {
        SubmitReviewRequest request = new SubmitReviewRequest();
        request.setReviewId(id);
        request.setRepositoryRef("acme/billing");
        request.setDiff(diff);
        return request;
    }
}
