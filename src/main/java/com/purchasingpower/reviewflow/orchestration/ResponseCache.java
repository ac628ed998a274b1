package com.purchasingpower.reviewflow.orchestration;

import com.purchasingpower.reviewflow.model.llm.CacheEntry;
import com.purchasingpower.reviewflow.model.llm.CacheStats;

import java.time.Duration;
import java.util.Optional;

/**
 * Model response cache keyed by request fingerprint.
 *
 * An entry older than its TTL is never returned.
 */
public interface ResponseCache {

    Optional<CacheEntry> get(String fingerprint);

    void put(String fingerprint, CacheEntry entry, Duration ttl);

    /**
     * Drops expired entries and returns how many were removed.
     */
    int purgeExpired();

    CacheStats stats();
}
