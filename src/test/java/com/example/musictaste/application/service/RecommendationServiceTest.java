package com.example.musictaste.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musictaste.common.config.AppRecommendationProperties;
import com.example.musictaste.common.config.TaskExecutionConfig;
import com.example.musictaste.common.exception.BusinessException;
import com.example.musictaste.domain.ScoringMode;
import com.example.musictaste.domain.model.CompatibilityBreakdown;
import com.example.musictaste.domain.model.CompatibilityEntry;
import com.example.musictaste.domain.model.EraRange;
import com.example.musictaste.domain.model.FollowEdges;
import com.example.musictaste.domain.model.PreferenceProfile;
import com.example.musictaste.domain.model.Recommendation;
import com.example.musictaste.domain.model.ScoredSong;
import com.example.musictaste.domain.model.Song;
import com.example.musictaste.domain.model.SongRating;
import com.example.musictaste.domain.model.SongReview;
import com.example.musictaste.domain.model.UserPair;
import com.example.musictaste.infrastructure.persistence.MusicTasteStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

class RecommendationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final long USER = 1L;

    private MusicTasteStore store;
    private SimpleMeterRegistry meterRegistry;
    private RecommendationService service;

    private final PreferenceProfile englishNineties = new PreferenceProfile(
            Collections.singletonList("en"),
            Collections.singletonList(new EraRange(1990, 1999)),
            Collections.singletonList(7L));

    @BeforeEach
    void setUp() {
        store = mock(MusicTasteStore.class);
        meterRegistry = new SimpleMeterRegistry();
        Executor sameThread = Runnable::run;
        service = new RecommendationService(store, new AppRecommendationProperties(), Duration.ofHours(1),
                sameThread, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));

        when(store.getPreferenceProfile(USER)).thenReturn(englishNineties);
        when(store.getFollowEdges(USER)).thenReturn(FollowEdges.none());
    }

    @Test
    void fourInteractionsShouldUseColdStart() {
        when(store.getReviewsByUser(USER)).thenReturn(ratings(4));
        when(store.getCandidateSongs(anyCollection(), anyList(), anyInt())).thenReturn(Arrays.asList(
                song(20L, 1L, "en", 1975, 0.9D, "pop"),
                song(21L, 7L, "en", 2015, 0.2D, "pop"),
                song(22L, 7L, "es", 1995, 3.0D, "pop")));

        Recommendation recommendation = service.recommend(USER, 20);

        assertEquals(ScoringMode.COLD_START, recommendation.getMode());
        assertEquals(Arrays.asList(21L, 20L), songIds(recommendation.getSongs()));
        assertNull(recommendation.getSongs().get(0).getComponents());
        verify(store).getCandidateSongs(eq(englishNineties.getPreferredLanguages()),
                eq(Collections.<EraRange>emptyList()), eq(60));
        verify(store, never()).getReviewsBySong(anyLong());
        assertEquals(1.0D, meterRegistry.counter("music.recommend.mode", "mode", "COLD_START").count(), 0.0D);
    }

    @Test
    void fiveInteractionsShouldUseHybridScoring() {
        List<SongRating> mine = ratings(5);
        when(store.getReviewsByUser(USER)).thenReturn(mine);
        when(store.getReviewsByUser(2L)).thenReturn(mine);
        when(store.getGenresRatedAtLeast(USER, 4.0D)).thenReturn(Arrays.asList("rock", "rock"));
        when(store.getCandidateSongs(anyCollection(), anyList(), anyInt())).thenReturn(Arrays.asList(
                song(12L, 1L, "en", 1992, 0.9D, "jazz"),
                song(11L, 1L, "es", 1995, 0.8D, "rock"),
                song(3L, 1L, "en", 1995, 0.7D, "rock"),
                song(10L, 1L, "en", 1995, 0.1D, "rock")));
        when(store.getReviewsBySong(10L)).thenReturn(Collections.singletonList(review(2L, 10L, 5.0D)));

        Recommendation recommendation = service.recommend(USER, 20);

        assertEquals(ScoringMode.HYBRID, recommendation.getMode());
        assertEquals(Arrays.asList(10L, 12L), songIds(recommendation.getSongs()));

        ScoredSong top = recommendation.getSongs().get(0);
        assertNotNull(top.getComponents());
        assertEquals(1.0D, top.getComponents().getGenre(), 1e-9);
        assertEquals(1.0D, top.getComponents().getCf(), 1e-9);
        assertEquals(1.0D, top.getComponents().getCommunity(), 1e-9);
        assertEquals(0.25D + 0.30D + 0.20D + 0.10D + 0.05D * (1.0D - 0.5D / 4.5D), top.getScore(), 1e-9);

        ScoredSong second = recommendation.getSongs().get(1);
        assertEquals(0.5D, second.getComponents().getCf(), 0.0D);
        assertEquals(0.5D, second.getComponents().getCommunity(), 0.0D);

        verify(store, never()).getReviewsBySong(3L);
        verify(store, never()).getReviewsBySong(11L);
        assertEquals(1.0D, meterRegistry.counter("music.recommend.mode", "mode", "HYBRID").count(), 0.0D);
    }

    @Test
    void freshCompatibilityShouldBoostReviewerWeight() {
        stubSingleCandidateWithTwoReviewers();
        when(store.getCompatibilityCache(UserPair.of(USER, 2L))).thenReturn(Optional.of(
                new CompatibilityEntry(0.9D, breakdown(), NOW.minus(Duration.ofMinutes(10)))));

        ScoredSong scored = service.recommend(USER, 10).getSongs().get(0);

        assertEquals((1.3D * 5.0D + 1.0D) / 2.3D / 5.0D, scored.getComponents().getCommunity(), 1e-9);
        verify(store, never()).upsertCompatibilityCache(any(UserPair.class), any(CompatibilityEntry.class));
    }

    @Test
    void staleCompatibilityShouldNotBoostReviewerWeight() {
        stubSingleCandidateWithTwoReviewers();
        when(store.getCompatibilityCache(UserPair.of(USER, 2L))).thenReturn(Optional.of(
                new CompatibilityEntry(0.9D, breakdown(), NOW.minus(Duration.ofHours(2)))));

        ScoredSong scored = service.recommend(USER, 10).getSongs().get(0);

        assertEquals((5.0D + 1.0D) / 2.0D / 5.0D, scored.getComponents().getCommunity(), 1e-9);
    }

    @Test
    void otherUsersRatingsShouldBeLoadedOncePerRequest() {
        List<SongRating> mine = ratings(5);
        when(store.getReviewsByUser(USER)).thenReturn(mine);
        when(store.getReviewsByUser(2L)).thenReturn(mine);
        when(store.getCandidateSongs(anyCollection(), anyList(), anyInt())).thenReturn(Arrays.asList(
                song(10L, 1L, "en", 1995, 0.5D, "rock"),
                song(11L, 1L, "en", 1996, 0.4D, "rock")));
        when(store.getReviewsBySong(10L)).thenReturn(Collections.singletonList(review(2L, 10L, 4.0D)));
        when(store.getReviewsBySong(11L)).thenReturn(Collections.singletonList(review(2L, 11L, 3.0D)));

        service.recommend(USER, 10);

        verify(store, times(1)).getReviewsByUser(2L);
        verify(store, times(1)).getCompatibilityCache(UserPair.of(USER, 2L));
    }

    @Test
    void storeFailureShouldNotDegradeToEmptyList() {
        when(store.getReviewsByUser(USER)).thenThrow(new QueryTimeoutException("reviews timed out"));

        BusinessException error = assertThrows(BusinessException.class, () -> service.recommend(USER, 20));

        assertEquals("RECOMMENDATION_UNAVAILABLE", error.getCode());
        assertEquals(1.0D, meterRegistry.counter("music.recommend.failure").count(), 0.0D);
    }

    @Test
    void failureInParallelLookupShouldSurfaceAsUnavailable() {
        when(store.getReviewsByUser(USER)).thenReturn(ratings(6));
        when(store.getCandidateSongs(anyCollection(), anyList(), anyInt())).thenReturn(
                Collections.singletonList(song(10L, 1L, "en", 1995, 0.5D, "rock")));
        when(store.getReviewsBySong(10L)).thenThrow(new QueryTimeoutException("song reviews timed out"));

        BusinessException error = assertThrows(BusinessException.class, () -> service.recommend(USER, 20));

        assertEquals("RECOMMENDATION_UNAVAILABLE", error.getCode());
    }

    @Test
    void shutDownExecutorShouldFailFastAsUnavailable() {
        when(store.getReviewsByUser(USER)).thenReturn(ratings(5));
        TaskExecutionConfig config = new TaskExecutionConfig();
        ExecutorService executor = config.recommendationExecutor(new AppRecommendationProperties());
        config.shutdown();
        RecommendationService stopped = new RecommendationService(store, new AppRecommendationProperties(),
                Duration.ofHours(1), executor, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));

        BusinessException error = assertTimeoutPreemptively(Duration.ofSeconds(3),
                () -> assertThrows(BusinessException.class, () -> stopped.recommend(USER, 10)));

        assertEquals("RECOMMENDATION_UNAVAILABLE", error.getCode());
        assertEquals(1.0D, meterRegistry.counter("music.recommend.failure").count(), 0.0D);
    }

    @Test
    void candidatePoolShouldBeCappedBeforeScoring() {
        AppRecommendationProperties properties = new AppRecommendationProperties();
        properties.setCandidateCap(2);
        RecommendationService capped = new RecommendationService(store, properties, Duration.ofHours(1),
                Runnable::run, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
        when(store.getReviewsByUser(USER)).thenReturn(ratings(5));
        List<Song> pool = new ArrayList<>();
        for (long id = 100L; id < 105L; id++) {
            pool.add(song(id, 1L, "en", 1995, 0.5D, "rock"));
        }
        when(store.getCandidateSongs(anyCollection(), anyList(), anyInt())).thenReturn(pool);

        Recommendation recommendation = capped.recommend(USER, 10);

        verify(store).getCandidateSongs(any(), any(), eq(2));
        verify(store, times(2)).getReviewsBySong(anyLong());
        assertEquals(Arrays.asList(100L, 101L), songIds(recommendation.getSongs()));
    }

    @Test
    void invalidUserShouldBeRejected() {
        BusinessException error = assertThrows(BusinessException.class, () -> service.recommend(0L, 20));

        assertEquals("400", error.getCode());
        verify(store, never()).getReviewsByUser(anyLong());
    }

    @Test
    void limitShouldBeNormalized() {
        assertEquals(1, RecommendationService.normalizeLimit(0));
        assertEquals(1, RecommendationService.normalizeLimit(-5));
        assertEquals(100, RecommendationService.normalizeLimit(500));
        assertEquals(20, RecommendationService.normalizeLimit(20));
    }

    @Test
    void hybridResultShouldBeTruncatedToLimit() {
        when(store.getReviewsByUser(USER)).thenReturn(ratings(5));
        List<Song> pool = new ArrayList<>();
        for (long id = 100L; id < 110L; id++) {
            pool.add(song(id, 1L, "en", 1995, 0.5D, "rock"));
        }
        when(store.getCandidateSongs(anyCollection(), anyList(), anyInt())).thenReturn(pool);

        Recommendation recommendation = service.recommend(USER, 3);

        // identical scores keep popularity order
        assertEquals(Arrays.asList(100L, 101L, 102L), songIds(recommendation.getSongs()));
    }

    private void stubSingleCandidateWithTwoReviewers() {
        when(store.getReviewsByUser(USER)).thenReturn(ratings(5));
        when(store.getCandidateSongs(anyCollection(), anyList(), anyInt())).thenReturn(
                Collections.singletonList(song(10L, 1L, "en", 1995, 0.5D, "rock")));
        when(store.getReviewsBySong(10L)).thenReturn(Arrays.asList(review(2L, 10L, 5.0D), review(3L, 10L, 1.0D)));
    }

    private static List<SongRating> ratings(int count) {
        List<SongRating> ratings = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            ratings.add(new SongRating(i, i % 2 == 0 ? 4.0D : 5.0D));
        }
        return ratings;
    }

    private static Song song(long id, long artistId, String language, int year, double popularity, String genre) {
        return new Song(id, artistId, "song-" + id, Collections.singletonList(genre), language, year, popularity);
    }

    private static SongReview review(long userId, long songId, double rating) {
        return new SongReview(null, userId, songId, rating, null, NOW, null);
    }

    private static CompatibilityBreakdown breakdown() {
        return new CompatibilityBreakdown(0.9D, 0.9D, 0.9D, 0.9D, 0.9D);
    }

    private static List<Long> songIds(List<ScoredSong> songs) {
        List<Long> ids = new ArrayList<>();
        for (ScoredSong song : songs) {
            ids.add(song.getSong().getId());
        }
        return ids;
    }
}
