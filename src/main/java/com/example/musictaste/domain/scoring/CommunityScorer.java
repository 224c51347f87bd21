package com.example.musictaste.domain.scoring;

import com.example.musictaste.domain.model.SentimentAnnotation;
import com.example.musictaste.domain.model.SongReview;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Aggregates a song's reviews into one recency-, sentiment- and
 * socially-weighted community score in [0, 1].
 */
public final class CommunityScorer {

    /** Per-day decay rate applied to review ratings. */
    public static final double DECAY_RATE = 0.1D;
    public static final double SENTIMENT_THETA = 0.2D;
    /** Reviews with toxicity above this contribute nothing. */
    public static final double TOXICITY_THRESHOLD = 0.5D;
    public static final double NEUTRAL_SCORE = 0.5D;
    public static final double MAX_RATING = 5.0D;

    private CommunityScorer() {
    }

    /**
     * @param reviews       all reviews of the song
     * @param now           reference time for decay
     * @param socialWeights viewer's weight toward each reviewer id
     */
    public static double score(List<SongReview> reviews, Instant now, ToDoubleFunction<Long> socialWeights) {
        if (reviews == null || reviews.isEmpty()) {
            return NEUTRAL_SCORE;
        }
        double weightedSum = 0.0D;
        double totalWeight = 0.0D;
        for (SongReview review : reviews) {
            double weight = socialWeights.applyAsDouble(review.getUserId());
            double decayed = review.getRating()
                    * TimeDecay.factor(DECAY_RATE, TimeDecay.daysBetween(review.getCreatedAt(), now));
            weightedSum += weight * sentimentMultiplier(review.getSentiment()) * decayed;
            // toxic reviews still count toward the denominator
            totalWeight += weight;
        }
        if (totalWeight == 0.0D) {
            return NEUTRAL_SCORE;
        }
        return ScoreBounds.clampUnit(weightedSum / totalWeight / MAX_RATING);
    }

    /**
     * 0 for toxic reviews, {@code 1 + 0.2 * sentiment} otherwise, and a
     * neutral 1.0 while the annotation has not landed yet.
     */
    public static double sentimentMultiplier(Optional<SentimentAnnotation> annotation) {
        return annotation.map(CommunityScorer::multiplierOf).orElse(1.0D);
    }

    private static double multiplierOf(SentimentAnnotation annotation) {
        if (annotation.getToxicity() > TOXICITY_THRESHOLD) {
            return 0.0D;
        }
        return 1.0D + SENTIMENT_THETA * annotation.getSentiment();
    }
}
