package com.example.musictaste.domain.scoring;

import com.example.musictaste.domain.model.SongReview;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * User-user collaborative filtering: predicts the target user's rating of a
 * song from the ratings of other users who reviewed it, weighted by cosine
 * similarity of rating vectors.
 */
public final class CollaborativeFilteringScorer {

    public static final double NEUTRAL_SCORE = 0.5D;
    public static final double MIN_RATING = 0.5D;
    public static final double RATING_SPAN = 4.5D;

    private CollaborativeFilteringScorer() {
    }

    /**
     * @param userId      the target user
     * @param userRatings target user's rating vector, song id to rating
     * @param songReviews every review of the song being scored
     * @param ratingsOf   rating vector lookup for other users
     * @return normalized prediction in [0, 1], or 0.5 without positive-similarity neighbours
     */
    public static double score(long userId,
                               Map<Long, Double> userRatings,
                               List<SongReview> songReviews,
                               Function<Long, Map<Long, Double>> ratingsOf) {
        if (songReviews == null || songReviews.isEmpty()) {
            return NEUTRAL_SCORE;
        }
        double numerator = 0.0D;
        double denominator = 0.0D;
        for (SongReview review : songReviews) {
            if (review.getUserId() == userId) {
                continue;
            }
            double similarity = CosineSimilarity.effective(userRatings, ratingsOf.apply(review.getUserId()));
            if (similarity <= 0.0D) {
                continue;
            }
            numerator += similarity * review.getRating();
            denominator += similarity;
        }
        if (denominator == 0.0D) {
            return NEUTRAL_SCORE;
        }
        return normalize(numerator / denominator);
    }

    /**
     * Maps a rating on the 0.5-5 scale onto [0, 1].
     */
    public static double normalize(double prediction) {
        return ScoreBounds.clampUnit((prediction - MIN_RATING) / RATING_SPAN);
    }
}
