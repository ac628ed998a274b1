package com.purchasingpower.reviewflow.orchestration.impl;

import com.purchasingpower.reviewflow.model.llm.CacheEntry;
import com.purchasingpower.reviewflow.model.llm.ModelTier;
import com.purchasingpower.reviewflow.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("In-memory response cache")
class InMemoryResponseCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    private final InMemoryResponseCache cache = new InMemoryResponseCache(clock);

    @Test
    @DisplayName("Should serve an entry until its TTL has elapsed")
    void get_respectsTtl() {
        // Given
        cache.put("fp-1", entry("fp-1"), Duration.ofHours(1));

        // When / Then
        clock.advance(Duration.ofMinutes(59));
        assertThat(cache.get("fp-1")).isPresent();

        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.get("fp-1")).isEmpty();

        assertThat(cache.stats().getHits()).isEqualTo(1);
        assertThat(cache.stats().getMisses()).isEqualTo(1);
        assertThat(cache.stats().getSize()).isZero();
    }

    @Test
    @DisplayName("Should purge only expired entries")
    void purgeExpired_removesStaleEntries() {
        // Given
        cache.put("short", entry("short"), Duration.ofMinutes(5));
        cache.put("long", entry("long"), Duration.ofDays(1));
        clock.advance(Duration.ofMinutes(10));

        // When
        int removed = cache.purgeExpired();

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(cache.get("long")).isPresent();
    }

    @Test
    @DisplayName("Should not store entries with a zero TTL")
    void put_zeroTtl_ignored() {
        cache.put("fp", entry("fp"), Duration.ZERO);
        assertThat(cache.get("fp")).isEmpty();
    }

    private CacheEntry entry(String fingerprint) {
        return CacheEntry.builder()
                .fingerprint(fingerprint)
                .tier(ModelTier.TRIAGE)
                .providerId("ollama")
                .modelId("ollama-triage")
                .output("{\"hasIssues\": false}")
                .createdAt(clock.instant())
                .build();
    }
}
