package com.purchasingpower.reviewflow.model.finding;

import java.util.Locale;

/**
 * Issue severity, ordered critical &gt; high &gt; medium &gt; low.
 */
public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public static Severity max(Severity a, Severity b) {
        return a.rank >= b.rank ? a : b;
    }

    /**
     * Lenient parse for model output; unknown values map to MEDIUM.
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "critical":
            case "blocker":
                return CRITICAL;
            case "high":
            case "major":
            case "error":
                return HIGH;
            case "low":
            case "minor":
            case "info":
                return LOW;
            default:
                return MEDIUM;
        }
    }
}
