package com.example.musictaste.domain.scoring;

/**
 * Helpers for the [0, 1] score invariant.
 * <p>
 * {@link #checkUnit} is for component scores that must already be bounded:
 * a value outside [0, 1] is a defect in the scorer, so it is asserted instead
 * of clamped. {@link #clampUnit} is only for the documented clamps
 * (final weighted sums, normalized predictions).
 */
public final class ScoreBounds {

    private ScoreBounds() {
    }

    public static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0D;
        }
        return Math.max(0.0D, Math.min(1.0D, value));
    }

    public static double checkUnit(String name, double value) {
        assert value >= 0.0D && value <= 1.0D : name + " score escaped [0,1]: " + value;
        return value;
    }
}
