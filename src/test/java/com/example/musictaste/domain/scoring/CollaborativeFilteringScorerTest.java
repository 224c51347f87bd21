package com.example.musictaste.domain.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.musictaste.domain.model.SongReview;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CollaborativeFilteringScorerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
    private static final long TARGET_SONG = 99L;

    private final Map<Long, Map<Long, Double>> vectors = new HashMap<>();

    @Test
    void shouldPredictFromSimilarUsers() {
        Map<Long, Double> me = vector(10L, 5.0D, 11L, 3.0D);
        vectors.put(2L, vector(10L, 5.0D, 11L, 3.0D));

        double score = CollaborativeFilteringScorer.score(1L, me,
                Collections.singletonList(review(2L, 4.0D)), vectors::get);

        assertEquals((4.0D - 0.5D) / 4.5D, score, 1e-9);
    }

    @Test
    void shouldWeightNeighboursBySimilarity() {
        Map<Long, Double> me = vector(10L, 5.0D, 11L, 1.0D);
        vectors.put(2L, vector(10L, 5.0D, 11L, 1.0D));
        vectors.put(3L, vector(10L, 1.0D, 11L, 5.0D));
        List<SongReview> reviews = Arrays.asList(review(2L, 5.0D), review(3L, 1.0D));

        double sim3 = CosineSimilarity.effective(me, vectors.get(3L));
        double expected = CollaborativeFilteringScorer.normalize((5.0D + sim3 * 1.0D) / (1.0D + sim3));

        assertEquals(expected, CollaborativeFilteringScorer.score(1L, me, reviews, vectors::get), 1e-9);
    }

    @Test
    void shouldBeNeutralWithoutUsableNeighbours() {
        Map<Long, Double> me = vector(10L, 5.0D);
        vectors.put(2L, vector(20L, 5.0D));

        assertEquals(0.5D, CollaborativeFilteringScorer.score(1L, me,
                Collections.<SongReview>emptyList(), vectors::get), 0.0D);
        assertEquals(0.5D, CollaborativeFilteringScorer.score(1L, me,
                Collections.singletonList(review(2L, 5.0D)), vectors::get), 0.0D);
    }

    @Test
    void shouldIgnoreTheUsersOwnReview() {
        Map<Long, Double> me = vector(10L, 5.0D, TARGET_SONG, 1.0D);

        double score = CollaborativeFilteringScorer.score(1L, me,
                Collections.singletonList(review(1L, 1.0D)), id -> me);

        assertEquals(0.5D, score, 0.0D);
    }

    @Test
    void normalizeShouldMapRatingScaleOntoUnitInterval() {
        assertEquals(0.0D, CollaborativeFilteringScorer.normalize(0.5D), 1e-9);
        assertEquals(1.0D, CollaborativeFilteringScorer.normalize(5.0D), 1e-9);
        assertEquals(0.0D, CollaborativeFilteringScorer.normalize(0.1D), 0.0D);
    }

    private static SongReview review(long userId, double rating) {
        return new SongReview(null, userId, TARGET_SONG, rating, null, NOW, null);
    }

    private static Map<Long, Double> vector(Object... pairs) {
        Map<Long, Double> map = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((Long) pairs[i], (Double) pairs[i + 1]);
        }
        return map;
    }
}
