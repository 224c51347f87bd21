package com.example.musictaste.domain.scoring;

import com.example.musictaste.domain.model.EraRange;
import java.util.List;

/**
 * Scores how close a release year sits to the middle of the user's preferred eras.
 */
public final class EraProximityScorer {

    /** Returned when the user has no era preference. */
    public static final double NO_PREFERENCE_SCORE = 0.5D;

    private EraProximityScorer() {
    }

    public static double score(Integer releaseYear, List<EraRange> preferredEras) {
        if (preferredEras == null || preferredEras.isEmpty()) {
            return NO_PREFERENCE_SCORE;
        }
        if (releaseYear == null) {
            return 0.0D;
        }
        double best = 0.0D;
        for (EraRange era : preferredEras) {
            best = Math.max(best, scoreInRange(releaseYear, era));
        }
        return ScoreBounds.checkUnit("era", best);
    }

    static double scoreInRange(int year, EraRange era) {
        if (!era.contains(year)) {
            return 0.0D;
        }
        double halfRange = era.halfRange();
        if (halfRange == 0.0D) {
            return year == era.getStart() ? 1.0D : 0.0D;
        }
        double score = 1.0D - Math.abs(year - era.midpoint()) / halfRange;
        return ScoreBounds.clampUnit(score);
    }
}
