package com.purchasingpower.reviewflow.learning;

import com.purchasingpower.reviewflow.model.finding.Suggestion;
import com.purchasingpower.reviewflow.storage.ReviewPersistence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Every suggestion ever attached to a review, by id. Suggestions orphaned by a regenerate
 * stay here so late feedback can still reach the patterns behind them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SuggestionLedger {

    private final ReviewPersistence persistence;
    private final Map<String, Suggestion> suggestions = new ConcurrentHashMap<>();

    /**
     * Records newly attached suggestions. An id already known keeps its first record, so the
     * confidence predicted when the suggestion was shown is never replaced.
     */
    public void register(List<Suggestion> attached) {
        attached.forEach(s -> suggestions.putIfAbsent(s.getId(), s));
        log.debug("Ledger now holds {} suggestions", suggestions.size());
    }

    public Optional<Suggestion> find(String suggestionId) {
        Suggestion cached = suggestions.get(suggestionId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Suggestion> stored = persistence.findSuggestion(suggestionId);
        stored.ifPresent(s -> suggestions.put(s.getId(), s));
        return stored;
    }
}
