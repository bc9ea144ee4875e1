package com.openforge.docrouter.domain;

import java.util.Locale;

/**
 * Ordinal confidence of a stored fact. Conflict resolution compares ranks,
 * never raw scores.
 */
public enum ConfidenceTier {

    EXPERIMENTAL(1),
    LOW(2),
    MEDIUM(3),
    HIGH(4);

    private final int rank;

    ConfidenceTier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /** 0.95+ HIGH, 0.80+ MEDIUM, 0.60+ LOW, otherwise EXPERIMENTAL. */
    public static ConfidenceTier fromScore(double score) {
        if (score >= 0.95) return HIGH;
        if (score >= 0.80) return MEDIUM;
        if (score >= 0.60) return LOW;
        return EXPERIMENTAL;
    }

    public static ConfidenceTier fromValue(String raw, ConfidenceTier fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
