package com.example.musictaste.domain.scoring;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential time decay {@code e^(-rate * days)} shared by the community and trending scorers.
 */
public final class TimeDecay {

    private static final double MILLIS_PER_DAY = 24.0D * 60.0D * 60.0D * 1000.0D;

    private TimeDecay() {
    }

    /**
     * Fractional days elapsed from {@code from} to {@code now}. Timestamps in
     * the future (clock skew) count as zero days.
     */
    public static double daysBetween(Instant from, Instant now) {
        if (from == null || now == null) {
            return 0.0D;
        }
        long millis = Duration.between(from, now).toMillis();
        return Math.max(0.0D, millis / MILLIS_PER_DAY);
    }

    public static double factor(double rate, double days) {
        return Math.exp(-rate * days);
    }
}
