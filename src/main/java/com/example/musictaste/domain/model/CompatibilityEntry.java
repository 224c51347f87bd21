package com.example.musictaste.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached taste compatibility of a user pair.
 */
public final class CompatibilityEntry {

    private final double score;
    private final CompatibilityBreakdown breakdown;
    private final Instant computedAt;

    public CompatibilityEntry(double score, CompatibilityBreakdown breakdown, Instant computedAt) {
        this.score = score;
        this.breakdown = breakdown;
        this.computedAt = computedAt;
    }

    public double getScore() {
        return score;
    }

    public CompatibilityBreakdown getBreakdown() {
        return breakdown;
    }

    public Instant getComputedAt() {
        return computedAt;
    }

    /** Score as a rounded 0-100 percentage. */
    public int percentage() {
        return (int) Math.round(score * 100.0D);
    }

    /**
     * An entry is fresh while its age is strictly below {@code ttl}.
     */
    public boolean isFresh(Instant now, Duration ttl) {
        if (computedAt == null) {
            return false;
        }
        return Duration.between(computedAt, now).compareTo(ttl) < 0;
    }
}
