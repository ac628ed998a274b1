package com.purchasingpower.reviewflow.orchestration.impl;

import com.purchasingpower.reviewflow.model.llm.CacheEntry;
import com.purchasingpower.reviewflow.model.llm.CacheStats;
import com.purchasingpower.reviewflow.orchestration.ResponseCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local response cache with per-entry expiry.
 *
 * Expiry is checked on every read against the injected clock; the periodic purge only reclaims memory.
 */
@Slf4j
@Component
public class InMemoryResponseCache implements ResponseCache {

    private final Map<String, Stored> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final Clock clock;

    public InMemoryResponseCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<CacheEntry> get(String fingerprint) {
        Stored stored = entries.get(fingerprint);
        if (stored == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (!clock.instant().isBefore(stored.expiresAt)) {
            entries.remove(fingerprint, stored);
            misses.incrementAndGet();
            log.debug("Cache entry expired: {}", fingerprint);
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(stored.entry);
    }

    @Override
    public void put(String fingerprint, CacheEntry entry, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return;
        }
        entries.put(fingerprint, new Stored(entry, clock.instant().plus(ttl)));
    }

    @Scheduled(fixedDelayString = "${app.review.cache.purge-interval-ms:600000}")
    public void scheduledPurge() {
        purgeExpired();
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt));
        int removed = before - entries.size();
        if (removed > 0) {
            log.info("🧹 Purged {} expired model responses", removed);
        }
        return removed;
    }

    @Override
    public CacheStats stats() {
        return CacheStats.builder()
                .hits(hits.get())
                .misses(misses.get())
                .size(entries.size())
                .build();
    }

    private static final class Stored {
        final CacheEntry entry;
        final Instant expiresAt;

        Stored(CacheEntry entry, Instant expiresAt) {
            this.entry = entry;
            this.expiresAt = expiresAt;
        }
    }
}
