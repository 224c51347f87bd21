package com.example.musictaste.domain.scoring;

import com.example.musictaste.domain.model.SongReview;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Preference-agnostic engagement over the last seven days:
 * each review adds {@code rating * e^(-0.2 * days)} to its song.
 */
public final class TrendingScorer {

    public static final Duration WINDOW = Duration.ofDays(7);
    public static final double DECAY_RATE = 0.2D;

    private TrendingScorer() {
    }

    /**
     * Summed engagement per song id. Reviews created before {@code now - WINDOW} are ignored.
     */
    public static Map<Long, Double> engagementBySong(Collection<SongReview> reviews, Instant now) {
        Instant windowStart = now.minus(WINDOW);
        Map<Long, Double> engagement = new HashMap<>();
        for (SongReview review : reviews) {
            Instant createdAt = review.getCreatedAt();
            if (createdAt == null || createdAt.isBefore(windowStart)) {
                continue;
            }
            double weight = TimeDecay.factor(DECAY_RATE, TimeDecay.daysBetween(createdAt, now));
            engagement.merge(review.getSongId(), review.getRating() * weight, Double::sum);
        }
        return engagement;
    }

    /**
     * Song ids by engagement descending; equal engagement falls back to ascending song id.
     */
    public static List<Map.Entry<Long, Double>> rank(Map<Long, Double> engagement, int limit) {
        List<Map.Entry<Long, Double>> entries = new ArrayList<>(engagement.entrySet());
        entries.sort((a, b) -> {
            int byEngagement = Double.compare(b.getValue(), a.getValue());
            return byEngagement != 0 ? byEngagement : Long.compare(a.getKey(), b.getKey());
        });
        return entries.size() > limit ? new ArrayList<>(entries.subList(0, Math.max(0, limit))) : entries;
    }
}
