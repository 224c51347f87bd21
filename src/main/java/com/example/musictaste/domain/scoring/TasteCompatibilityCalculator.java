package com.example.musictaste.domain.scoring;

import com.example.musictaste.domain.model.CompatibilityBreakdown;
import com.example.musictaste.domain.model.EraRange;
import com.example.musictaste.domain.model.PreferenceProfile;
import java.util.List;
import java.util.Map;

/**
 * Pure component math behind the two-user taste compatibility score. All
 * components are symmetric in their arguments.
 */
public final class TasteCompatibilityCalculator {

    /** Midpoint distance (in years) at which era similarity reaches 0. */
    public static final double ERA_MAX_DIFF_YEARS = 100.0D;

    private TasteCompatibilityCalculator() {
    }

    public static CompatibilityBreakdown breakdown(Map<Long, Double> ratingsA,
                                                   Map<Long, Double> ratingsB,
                                                   GenreProfile genresA,
                                                   GenreProfile genresB,
                                                   PreferenceProfile profileA,
                                                   PreferenceProfile profileB) {
        double cf = CosineSimilarity.effective(ratingsA, ratingsB);
        double genre = SetSimilarity.jaccard(genresA.genreSet(), genresB.genreSet());
        double artist = SetSimilarity.jaccard(profileA.getFavoriteArtistIds(), profileB.getFavoriteArtistIds());
        double language = SetSimilarity.jaccard(profileA.getPreferredLanguages(), profileB.getPreferredLanguages());
        double era = eraSimilarity(profileA.getPreferredEras(), profileB.getPreferredEras());
        return new CompatibilityBreakdown(
                ScoreBounds.checkUnit("cf", cf),
                ScoreBounds.checkUnit("genre", genre),
                ScoreBounds.checkUnit("artist", artist),
                ScoreBounds.checkUnit("language", language),
                ScoreBounds.checkUnit("era", era));
    }

    /**
     * {@code max(0, 1 - |midA - midB| / 100)} over each user's mean era
     * midpoint; 0 when either user has no era preference.
     */
    public static double eraSimilarity(List<EraRange> erasA, List<EraRange> erasB) {
        if (erasA == null || erasB == null || erasA.isEmpty() || erasB.isEmpty()) {
            return 0.0D;
        }
        double diff = Math.abs(meanMidpoint(erasA) - meanMidpoint(erasB));
        return Math.max(0.0D, 1.0D - diff / ERA_MAX_DIFF_YEARS);
    }

    static double meanMidpoint(List<EraRange> eras) {
        double sum = 0.0D;
        for (EraRange era : eras) {
            sum += era.midpoint();
        }
        return sum / eras.size();
    }
}
