package com.purchasingpower.reviewflow.orchestration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.reviewflow.model.llm.ModelFinding;
import com.purchasingpower.reviewflow.model.llm.TriageResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns raw model text into typed results.
 *
 * Models wrap JSON in markdown fences or prose often enough that the first JSON value
 * in the text is extracted before parsing. Anything that still does not fit the
 * expected shape is reported as empty.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelOutputParser {

    private final ObjectMapper objectMapper;

    /**
     * Expects {@code {"hasIssues": true, "categories": ["security"]}}.
     */
    public Optional<TriageResult> parseTriage(String raw) {
        Optional<JsonNode> root = readJson(raw);
        if (root.isEmpty() || !root.get().isObject()) {
            return Optional.empty();
        }
        JsonNode node = root.get();
        JsonNode flag = node.has("hasIssues") ? node.get("hasIssues") : node.get("has_issues");
        if (flag == null || !flag.isBoolean()) {
            return Optional.empty();
        }
        List<String> categories = new ArrayList<>();
        JsonNode cats = node.path("categories");
        if (cats.isArray()) {
            cats.forEach(c -> {
                if (c.isTextual() && !c.asText().isBlank()) {
                    categories.add(c.asText().trim().toLowerCase(Locale.ROOT));
                }
            });
        }
        return Optional.of(new TriageResult(flag.asBoolean(), List.copyOf(categories)));
    }

    /**
     * Expects a JSON array of findings, or an object wrapping it under "suggestions" or "findings".
     */
    public Optional<List<ModelFinding>> parseFindings(String raw) {
        Optional<JsonNode> root = readJson(raw);
        if (root.isEmpty()) {
            return Optional.empty();
        }
        JsonNode items = root.get();
        if (items.isObject()) {
            items = items.has("suggestions") ? items.get("suggestions") : items.get("findings");
        }
        if (items == null || !items.isArray()) {
            return Optional.empty();
        }

        List<ModelFinding> findings = new ArrayList<>();
        for (JsonNode item : items) {
            if (!item.isObject()) {
                continue;
            }
            try {
                findings.add(objectMapper.treeToValue(item, ModelFinding.class));
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed finding item: {}", e.getOriginalMessage());
            }
        }
        return Optional.of(findings);
    }

    private Optional<JsonNode> readJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = stripFences(raw.trim());
        int start = firstJsonStart(text);
        if (start < 0) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readTree(text.substring(start)));
        } catch (JsonProcessingException e) {
            log.debug("Model output is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).trim();
    }

    private int firstJsonStart(String text) {
        int brace = text.indexOf('{');
        int bracket = text.indexOf('[');
        if (brace < 0) {
            return bracket;
        }
        if (bracket < 0) {
            return brace;
        }
        return Math.min(brace, bracket);
    }
}
